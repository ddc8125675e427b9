package com.openforge.lexguard.moderation.admin;

import com.openforge.lexguard.domain.AdminAuditLog.AdminAction;
import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Violation;
import com.openforge.lexguard.moderation.AlreadySuspendedException;
import com.openforge.lexguard.moderation.InvalidTransitionException;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.moderation.ModerationValidationException;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.moderation.policy.EnforcementAction;
import com.openforge.lexguard.moderation.suspension.SuspensionDuration;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import com.openforge.lexguard.moderation.violation.RecordOutcome;
import com.openforge.lexguard.moderation.violation.RecordedViolation;
import com.openforge.lexguard.moderation.violation.ViolationRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manual enforcement by an administrator.
 *
 * Each method is one unit of work that takes the same account lock as the
 * automatic path and appends an audit row in the same transaction, so an
 * override and a concurrent classifier report are strictly ordered.
 *
 *   applyStrike       → ViolationRecorder (goes through the ladder)
 *   removeStrike      → AccountStatusStore (never escalates)
 *   forceSuspend      → AccountStatusStore + violation + SuspensionLedger.open
 *   forcePermanentBan → (lift active temporary) + AccountStatusStore + violation + SuspensionLedger.open
 *   liftSuspension    → SuspensionLedger.lift + AccountStatusStore
 *   liftBan           → AccountStatusStore.unban + SuspensionLedger.liftActive
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminOverrideGateway {

    private final ViolationRecorder      recorder;
    private final AccountStatusStore     accounts;
    private final SuspensionLedger       ledger;
    private final AdminAuditTrail        audit;
    private final ModerationTransactions tx;
    private final Clock                  clock;

    public RecordOutcome applyStrike(Long adminId, Long userId, String reason, String contentId, String contentText) {
        RecordedViolation.AdminOverride report =
                new RecordedViolation.AdminOverride(userId, adminId, contentId, contentText, reason);
        return tx.execute("adminApplyStrike", () -> {
            RecordOutcome outcome = recorder.record(report);
            if (!outcome.duplicate()) {
                audit.record(adminId, AdminAction.APPLY_STRIKE, userId, details(
                        "reason", reason,
                        "violation_id", outcome.violation().getId(),
                        "action_taken", outcome.actionTaken().name(),
                        "strike_count_after", outcome.account().strikeCount()));
            }
            log.info("[Admin] admin={} applied strike to user={} → {}", adminId, userId, outcome.actionTaken());
            return outcome;
        });
    }

    public AccountState removeStrike(Long adminId, Long userId, String reason) {
        requireAttribution(adminId, reason);
        return tx.execute("adminRemoveStrike", () -> {
            int before = AccountState.of(accounts.lockForUpdate(userId)).strikeCount();
            AccountState after = accounts.removeStrike(userId);
            audit.record(adminId, AdminAction.REMOVE_STRIKE, userId, details(
                    "reason", reason,
                    "strikes_before", before,
                    "strikes_after", after.strikeCount()));
            log.info("[Admin] admin={} removed strike from user={} ({} → {})",
                    adminId, userId, before, after.strikeCount());
            return after;
        });
    }

    /**
     * Suspends for the chosen duration regardless of strikes. Counts towards
     * the ban threshold but never escalates to a ban by itself.
     */
    public Suspension forceSuspend(Long adminId, Long userId, SuspensionDuration duration, String reason,
                                   String contentId, String contentText) {
        RecordedViolation.AdminOverride report =
                new RecordedViolation.AdminOverride(userId, adminId, contentId, contentText, reason);
        SuspensionDuration length = duration == null ? SuspensionDuration.DEFAULT : duration;

        return tx.execute("adminForceSuspend", () -> {
            AccountState before = ledger.settleOverdue(userId);
            if (before.isBanned()) {
                throw new InvalidTransitionException("Account " + userId + " is banned; lift the ban before suspending");
            }
            Optional<Suspension> active = ledger.getActive(userId);
            if (active.isPresent()) {
                throw new AlreadySuspendedException(userId, active.get().getId());
            }

            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime endsAt = length.endFrom(now);
            AccountState after = accounts.forceSuspend(userId, endsAt);
            Violation violation = recorder.recordForcedAction(report, EnforcementAction.SUSPENDED, after);
            Suspension suspension = ledger.open(userId, "Admin suspension: " + reason, List.of(violation.getId()),
                    after.suspensionCount(), before.strikeCount(), now, endsAt);

            audit.record(adminId, AdminAction.FORCE_SUSPEND, userId, details(
                    "reason", reason,
                    "duration", length.code(),
                    "suspension_id", suspension.getId(),
                    "ends_at", endsAt.toString()));
            log.warn("[Admin] admin={} suspended user={} for {} (suspension id={})",
                    adminId, userId, length, suspension.getId());
            return suspension;
        });
    }

    /**
     * Permanent ban regardless of history. An overdue suspension is expired
     * first; one still running is lifted as superseded, so the account never
     * has two active suspensions.
     */
    public Suspension forcePermanentBan(Long adminId, Long userId, String reason, String contentId, String contentText) {
        RecordedViolation.AdminOverride report =
                new RecordedViolation.AdminOverride(userId, adminId, contentId, contentText, reason);

        return tx.execute("adminForceBan", () -> {
            AccountState before = ledger.settleOverdue(userId);
            if (before.isBanned()) {
                throw new InvalidTransitionException("Account " + userId + " is already banned");
            }
            Optional<Suspension> superseded = ledger.liftActive(userId, adminId, "Superseded by permanent ban");

            LocalDateTime now = LocalDateTime.now(clock);
            AccountState after = accounts.forceBan(userId, reason);
            Violation violation = recorder.recordForcedAction(report, EnforcementAction.BANNED, after);
            Suspension ban = ledger.open(userId, "Admin permanent ban: " + reason, List.of(violation.getId()),
                    after.suspensionCount(), before.strikeCount(), now, null);

            Map<String, Object> details = details(
                    "reason", reason,
                    "suspension_id", ban.getId());
            superseded.ifPresent(s -> details.put("superseded_suspension_id", s.getId()));
            audit.record(adminId, AdminAction.FORCE_BAN, userId, details);
            log.warn("[Admin] admin={} permanently banned user={} (suspension id={})", adminId, userId, ban.getId());
            return ban;
        });
    }

    /**
     * Ends the active suspension early. Strike and suspension counts stay.
     *
     * @throws InvalidTransitionException if the account is not suspended, including when its window has already passed
     */
    public AccountState liftSuspension(Long adminId, Long userId, String reason) {
        requireAttribution(adminId, reason);
        // commits on its own: a window that already passed ends EXPIRED, and the lift is then refused
        ledger.settleOverdue(userId);

        return tx.execute("adminLiftSuspension", () -> {
            AccountState current = AccountState.of(accounts.lockForUpdate(userId));
            if (!current.isSuspended()) {
                throw new InvalidTransitionException(
                        "Account " + userId + " is not suspended (status=" + current.status() + ")");
            }
            Optional<Suspension> active = ledger.getActive(userId);
            active.ifPresent(s -> ledger.lift(s.getId(), adminId, reason));
            AccountState after = accounts.liftSuspension(userId, adminId, reason);

            audit.record(adminId, AdminAction.LIFT_SUSPENSION, userId, details(
                    "reason", reason,
                    "suspension_id", active.map(Suspension::getId).orElse(null)));
            log.info("[Admin] admin={} lifted suspension of user={}", adminId, userId);
            return after;
        });
    }

    /** Unban. Strikes restart at 0, the suspension count is kept. */
    public AccountState liftBan(Long adminId, Long userId, String reason) {
        requireAttribution(adminId, reason);
        return tx.execute("adminLiftBan", () -> {
            AccountState after = accounts.unban(userId, adminId, reason);
            Optional<Suspension> lifted = ledger.liftActive(userId, adminId, "Ban lifted: " + reason);

            audit.record(adminId, AdminAction.LIFT_BAN, userId, details(
                    "reason", reason,
                    "suspension_id", lifted.map(Suspension::getId).orElse(null)));
            log.warn("[Admin] admin={} lifted ban of user={}", adminId, userId);
            return after;
        });
    }

    /** Deletes the account and everything recorded against it. The audit row survives. */
    public void deleteAccount(Long adminId, Long userId, String reason) {
        requireAttribution(adminId, reason);
        tx.run("adminDeleteAccount", () -> {
            AccountState snapshot = AccountState.of(accounts.lockForUpdate(userId));
            accounts.deleteAccount(userId);
            audit.record(adminId, AdminAction.DELETE_ACCOUNT, userId, details(
                    "reason", reason,
                    "status", snapshot.status().name(),
                    "suspension_count", snapshot.suspensionCount()));
            log.warn("[Admin] admin={} deleted account user={}", adminId, userId);
        });
    }

    private static void requireAttribution(Long adminId, String reason) {
        if (adminId == null) {
            throw new ModerationValidationException("Admin actions must be attributed to an admin");
        }
        if (reason == null || reason.isBlank()) {
            throw new ModerationValidationException("Admin actions require a reason");
        }
    }

    /** Insertion-ordered, null-tolerant detail map for the audit row. */
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
