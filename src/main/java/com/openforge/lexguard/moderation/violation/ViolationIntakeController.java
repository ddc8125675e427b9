package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.moderation.dto.RecordOutcomeResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Intake for classifier verdicts. Called by trusted back-end services
 * (role SERVICE or ADMIN) after a post, reply or prompt was flagged.
 *
 *   POST /api/moderation/violations
 *
 * 201 for a newly recorded violation, 200 for a duplicate inside the
 * dedup window.
 */
@RestController
@RequestMapping("/api/moderation/violations")
@RequiredArgsConstructor
public class ViolationIntakeController {

    private final ViolationRecorder recorder;

    public record VerdictPayload(
            boolean              flagged,
            Map<String, Boolean> categories,
            Map<String, Double>  scores,
            @Size(max = 1000) String summary
    ) {}

    public record ViolationReport(
            @NotNull                 Long           userId,
            @NotNull                 ViolationType  violationType,
            @Size(max = 128)         String         contentId,
                                     String         contentText,
            @NotNull @Valid          VerdictPayload verdict
    ) {}

    @PostMapping
    public ResponseEntity<RecordOutcomeResponse> record(@Valid @RequestBody ViolationReport report) {
        VerdictPayload v = report.verdict();
        RecordOutcome outcome = recorder.record(new RecordedViolation.Automatic(
                report.userId(),
                report.violationType(),
                report.contentId(),
                report.contentText(),
                new ModerationVerdict(v.flagged(), v.categories(), v.scores(), v.summary())));
        return ResponseEntity.status(outcome.duplicate() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(RecordOutcomeResponse.from(outcome));
    }
}
