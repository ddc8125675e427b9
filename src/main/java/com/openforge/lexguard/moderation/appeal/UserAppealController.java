package com.openforge.lexguard.moderation.appeal;

import com.openforge.lexguard.auth.CurrentUser;
import com.openforge.lexguard.moderation.dto.AppealResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/user/appeals")
@RequiredArgsConstructor
public class UserAppealController {

    private final AppealWorkflow workflow;

    public record SubmitAppealRequest(
            @NotNull                                              Long   suspensionId,
            @NotBlank @Size(max = AppealWorkflow.MAX_REASON_LENGTH)  String appealReason,
            @Size(max = AppealWorkflow.MAX_CONTEXT_LENGTH)          String additionalContext
    ) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AppealResponse submit(@Valid @RequestBody SubmitAppealRequest req) {
        return AppealResponse.from(workflow.submit(
                CurrentUser.id(), req.suspensionId(), req.appealReason(), req.additionalContext()));
    }

    @GetMapping
    public List<AppealResponse> mine() {
        return workflow.listForUser(CurrentUser.id()).stream().map(AppealResponse::from).toList();
    }
}
