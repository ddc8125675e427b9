package com.openforge.lexguard.moderation.appeal;

import com.openforge.lexguard.auth.CurrentUser;
import com.openforge.lexguard.domain.Appeal.AppealStatus;
import com.openforge.lexguard.moderation.dto.AppealResponse;
import com.openforge.lexguard.moderation.dto.PageResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Back-office appeal queue. Requires ROLE_ADMIN (see SecurityConfig).
 *
 *   GET  /api/admin/appeals?status=&page=&size=
 *   GET  /api/admin/appeals/stats
 *   GET  /api/admin/appeals/{id}
 *   POST /api/admin/appeals/{id}/review
 *   POST /api/admin/appeals/{id}/resolve
 */
@Validated
@RestController
@RequestMapping("/api/admin/appeals")
@RequiredArgsConstructor
public class AdminAppealController {

    private final AppealWorkflow workflow;

    public record ResolveAppealRequest(
            @NotNull          AppealOutcome outcome,
            @Size(max = 1000) String        adminNotes,
            @Size(max = 1000) String        rejectionReason
    ) {}

    @GetMapping
    public PageResponse<AppealResponse> list(
            @RequestParam(required = false) AppealStatus status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return PageResponse.of(
                workflow.listByStatus(status, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "id"))),
                AppealResponse::from);
    }

    @GetMapping("/stats")
    public AppealStats stats() {
        return workflow.stats();
    }

    @GetMapping("/{id}")
    public AppealResponse get(@PathVariable Long id) {
        return AppealResponse.from(workflow.get(id));
    }

    @PostMapping("/{id}/review")
    public AppealResponse beginReview(@PathVariable Long id) {
        return AppealResponse.from(workflow.beginReview(id, CurrentUser.id()));
    }

    @PostMapping("/{id}/resolve")
    public AppealResponse resolve(@PathVariable Long id, @Valid @RequestBody ResolveAppealRequest req) {
        return AppealResponse.from(workflow.resolve(
                id, CurrentUser.id(), req.outcome(), req.adminNotes(), req.rejectionReason()));
    }
}
