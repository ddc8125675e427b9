package com.openforge.lexguard.moderation.admin;

import com.openforge.lexguard.auth.CurrentUser;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.moderation.dto.AccountStatusResponse;
import com.openforge.lexguard.moderation.dto.PageResponse;
import com.openforge.lexguard.moderation.dto.RecordOutcomeResponse;
import com.openforge.lexguard.moderation.dto.SuspensionResponse;
import com.openforge.lexguard.moderation.dto.ViolationResponse;
import com.openforge.lexguard.moderation.suspension.SuspensionDuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Back-office moderation. Requires ROLE_ADMIN; the acting admin id comes
 * from the JWT and is written to the audit trail.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  GET    /api/admin/moderation/violations         list, filter         │
 * │  GET    /api/admin/moderation/suspensions        list, filter         │
 * │  GET    /api/admin/moderation/suspended-users    suspended + banned   │
 * │  GET    /api/admin/moderation/stats              aggregate counts     │
 * │  POST   /api/admin/moderation/users/{id}/strike                       │
 * │  POST   /api/admin/moderation/users/{id}/remove-strike                │
 * │  POST   /api/admin/moderation/users/{id}/suspend                      │
 * │  POST   /api/admin/moderation/users/{id}/ban                          │
 * │  POST   /api/admin/moderation/users/{id}/lift-suspension              │
 * │  POST   /api/admin/moderation/users/{id}/lift-ban                     │
 * │  DELETE /api/admin/moderation/users/{id}                              │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@Validated
@RestController
@RequestMapping("/api/admin/moderation")
@RequiredArgsConstructor
public class AdminModerationController {

    private final AdminOverrideGateway   gateway;
    private final ModerationQueryService queries;

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record AdminActionRequest(
            @NotBlank @Size(max = 500) String reason,
            @Size(max = 128)           String contentId,
                                       String contentText
    ) {}

    public record SuspendRequest(
            @NotBlank @Size(max = 500) String             reason,
                                       SuspensionDuration duration,
            @Size(max = 128)           String             contentId,
                                       String             contentText
    ) {}

    public record ReasonRequest(
            @NotBlank @Size(max = 500) String reason
    ) {}

    // ── Reads ────────────────────────────────────────────────────────────────

    @GetMapping("/violations")
    public PageResponse<ViolationResponse> violations(
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false) ViolationType type,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return PageResponse.of(queries.listViolations(userId, type, newestFirst(page, size)), ViolationResponse::from);
    }

    @GetMapping("/suspensions")
    public PageResponse<SuspensionResponse> suspensions(
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false) SuspensionStatus status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return PageResponse.of(queries.listSuspensions(userId, status, newestFirst(page, size)), SuspensionResponse::from);
    }

    @GetMapping("/suspended-users")
    public PageResponse<AccountStatusResponse> suspendedUsers(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return PageResponse.of(queries.listRestrictedAccounts(newestFirst(page, size)), AccountStatusResponse::from);
    }

    @GetMapping("/stats")
    public ModerationQueryService.ModerationStats stats() {
        return queries.stats();
    }

    // ── Overrides ────────────────────────────────────────────────────────────

    @PostMapping("/users/{userId}/strike")
    public RecordOutcomeResponse strike(@PathVariable Long userId, @Valid @RequestBody AdminActionRequest req) {
        return RecordOutcomeResponse.from(
                gateway.applyStrike(CurrentUser.id(), userId, req.reason(), req.contentId(), req.contentText()));
    }

    @PostMapping("/users/{userId}/remove-strike")
    public AccountStatusResponse removeStrike(@PathVariable Long userId, @Valid @RequestBody ReasonRequest req) {
        return AccountStatusResponse.from(gateway.removeStrike(CurrentUser.id(), userId, req.reason()));
    }

    @PostMapping("/users/{userId}/suspend")
    public SuspensionResponse suspend(@PathVariable Long userId, @Valid @RequestBody SuspendRequest req) {
        return SuspensionResponse.from(gateway.forceSuspend(
                CurrentUser.id(), userId, req.duration(), req.reason(), req.contentId(), req.contentText()));
    }

    @PostMapping("/users/{userId}/ban")
    public SuspensionResponse ban(@PathVariable Long userId, @Valid @RequestBody AdminActionRequest req) {
        return SuspensionResponse.from(gateway.forcePermanentBan(
                CurrentUser.id(), userId, req.reason(), req.contentId(), req.contentText()));
    }

    @PostMapping("/users/{userId}/lift-suspension")
    public AccountStatusResponse liftSuspension(@PathVariable Long userId, @Valid @RequestBody ReasonRequest req) {
        return AccountStatusResponse.from(gateway.liftSuspension(CurrentUser.id(), userId, req.reason()));
    }

    @PostMapping("/users/{userId}/lift-ban")
    public AccountStatusResponse liftBan(@PathVariable Long userId, @Valid @RequestBody ReasonRequest req) {
        return AccountStatusResponse.from(gateway.liftBan(CurrentUser.id(), userId, req.reason()));
    }

    @DeleteMapping("/users/{userId}")
    public ResponseEntity<Void> delete(@PathVariable Long userId,
                                       @RequestParam @NotBlank @Size(max = 500) String reason) {
        gateway.deleteAccount(CurrentUser.id(), userId, reason);
        return ResponseEntity.noContent().build();
    }

    private static Pageable newestFirst(int page, int size) {
        return PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "id"));
    }
}
