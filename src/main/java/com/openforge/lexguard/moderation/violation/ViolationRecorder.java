package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Violation;
import com.openforge.lexguard.moderation.InvalidTransitionException;
import com.openforge.lexguard.moderation.ModerationProperties;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.moderation.policy.Decision;
import com.openforge.lexguard.moderation.policy.EnforcementAction;
import com.openforge.lexguard.moderation.policy.EnforcementPolicy;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import com.openforge.lexguard.repository.ViolationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for flagged content.
 *
 * One call = one unit of work:
 *
 *   lock account
 *     → dedup probe (same user, content and type inside the window)
 *     → settle an overdue suspension / refuse a live one or a ban
 *     → EnforcementPolicy.decide
 *     → insert violation
 *     → AccountStatusStore.applyDecision
 *     → SuspensionLedger.open (only when the ladder escalates)
 *
 * A crash anywhere in the chain rolls all of it back.
 */
@Slf4j
@Service
public class ViolationRecorder {

    private final ViolationRepository    violationRepository;
    private final AccountStatusStore     accounts;
    private final SuspensionLedger       ledger;
    private final EnforcementPolicy      policy;
    private final ModerationTransactions tx;
    private final Clock                  clock;
    private final Duration               dedupWindow;
    private final int                    snapshotLimit;

    public ViolationRecorder(ViolationRepository violationRepository,
                             AccountStatusStore accounts,
                             SuspensionLedger ledger,
                             EnforcementPolicy policy,
                             ModerationTransactions tx,
                             Clock clock,
                             ModerationProperties properties) {
        this.violationRepository = violationRepository;
        this.accounts            = accounts;
        this.ledger              = ledger;
        this.policy              = policy;
        this.tx                  = tx;
        this.clock               = clock;
        this.dedupWindow         = properties.dedupWindow();
        this.snapshotLimit       = properties.contentSnapshotLimit();
    }

    public RecordOutcome record(RecordedViolation report) {
        return tx.execute("recordViolation", () -> {
            Long userId = report.userId();
            AccountState state = AccountState.of(accounts.lockForUpdate(userId));
            LocalDateTime now = LocalDateTime.now(clock);

            Optional<Violation> earlier = findDuplicate(report, now);
            if (earlier.isPresent()) {
                return duplicateOutcome(earlier.get(), state);
            }

            if (state.isSuspensionOver(now)) {
                state = ledger.settleOverdue(userId);
            }
            if (state.isBanned()) {
                throw new InvalidTransitionException("Account " + userId + " is permanently banned");
            }
            if (state.isSuspended()) {
                throw new InvalidTransitionException(
                        "Account " + userId + " is suspended until " + state.suspensionEnd());
            }

            Decision decision = policy.decide(state, now);
            List<Long> earlierStrikes = decision.escalates()
                    ? strikesSinceLastReset(userId, decision.strikesAtEscalation() - 1)
                    : List.of();

            Violation violation = violationRepository.save(Violation.builder()
                    .userId(userId)
                    .violationType(report.violationType())
                    .contentId(report.contentId())
                    .contentText(snapshot(report.contentText()))
                    .flaggedCategories(report.verdict().categories())
                    .categoryScores(report.verdict().scores())
                    .violationSummary(report.verdict().summary())
                    .source(report.source())
                    .adminId(report.adminId())
                    .actionTaken(decision.action().toActionTaken())
                    .strikeCountAfter(decision.strikeCountAfter())
                    .suspensionCountAfter(decision.suspensionCountAfter())
                    .build());

            AccountState after = accounts.applyDecision(userId, decision, banReason(decision, report));

            Suspension suspension = null;
            if (decision.escalates()) {
                List<Long> evidence = new ArrayList<>(earlierStrikes);
                evidence.add(violation.getId());
                suspension = ledger.open(userId, suspensionReason(decision, report), evidence,
                        decision.suspensionCountAfter(), decision.strikesAtEscalation(),
                        now, decision.suspensionEnd());
            }

            logOutcome(report, violation, decision);
            return new RecordOutcome(violation, violation.getActionTaken(), after, suspension, false,
                    EnforcementMessages.forAction(violation.getActionTaken(), after.strikeCount(),
                            after.suspensionCount(), after.suspensionEnd(), policy.strikesForSuspension()));
        });
    }

    /**
     * Writes the violation behind an admin-forced suspension or ban. The
     * account has already been moved by the caller; {@code after} is its new state.
     */
    public Violation recordForcedAction(RecordedViolation.AdminOverride report,
                                        EnforcementAction action, AccountState after) {
        return tx.execute("recordForcedAction", () -> {
            Violation violation = violationRepository.save(Violation.builder()
                    .userId(report.userId())
                    .violationType(report.violationType())
                    .contentId(report.contentId())
                    .contentText(snapshot(report.contentText()))
                    .flaggedCategories(report.verdict().categories())
                    .categoryScores(report.verdict().scores())
                    .violationSummary(report.verdict().summary())
                    .source(report.source())
                    .adminId(report.adminId())
                    .actionTaken(action.toActionTaken())
                    .strikeCountAfter(after.strikeCount())
                    .suspensionCountAfter(after.suspensionCount())
                    .build());
            log.warn("[Recorder] admin={} forced {} on user={} (violation id={})",
                    report.adminId(), action, report.userId(), violation.getId());
            return violation;
        });
    }

    // ── internals ────────────────────────────────────────────────────────────

    private Optional<Violation> findDuplicate(RecordedViolation report, LocalDateTime now) {
        if (report.contentId() == null || report.contentId().isBlank()) {
            return Optional.empty();
        }
        return violationRepository.findFirstByUserIdAndContentIdAndViolationTypeAndCreateTimeAfterOrderByIdAsc(
                report.userId(), report.contentId(), report.violationType(), now.minus(dedupWindow));
    }

    private RecordOutcome duplicateOutcome(Violation earlier, AccountState state) {
        log.info("[Recorder] duplicate report for user={} content={} ignored, first record id={}",
                earlier.getUserId(), earlier.getContentId(), earlier.getId());
        Suspension suspension = ledger.listForUser(earlier.getUserId()).stream()
                .filter(s -> s.getViolationIds().contains(earlier.getId()))
                .findFirst()
                .orElse(null);
        return new RecordOutcome(earlier, earlier.getActionTaken(), state, suspension, true,
                EnforcementMessages.forAction(earlier.getActionTaken(), earlier.getStrikeCountAfter(),
                        earlier.getSuspensionCountAfter(), state.suspensionEnd(), policy.strikesForSuspension()));
    }

    /**
     * Ids of the strikes that built up since the last escalation, oldest first.
     * Walks back from the newest record and stops at the previous escalation.
     */
    private List<Long> strikesSinceLastReset(Long userId, int wanted) {
        if (wanted <= 0) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>(wanted);
        for (Violation v : violationRepository.findByUserIdOrderByIdDesc(userId, PageRequest.of(0, wanted))) {
            if (v.getActionTaken() != Violation.ActionTaken.STRIKE_ADDED) {
                break;
            }
            ids.add(v.getId());
        }
        Collections.reverse(ids);
        return ids;
    }

    private String snapshot(String text) {
        if (text == null || text.length() <= snapshotLimit) {
            return text;
        }
        return text.substring(0, snapshotLimit);
    }

    private static String suspensionReason(Decision decision, RecordedViolation report) {
        String base = decision.action() == EnforcementAction.BANNED
                ? "Permanent ban after " + decision.suspensionCountAfter() + " suspensions"
                : "Temporary suspension after " + decision.strikesAtEscalation() + " strikes";
        if (report instanceof RecordedViolation.AdminOverride override) {
            return base + " (admin strike: " + override.reason() + ")";
        }
        return base;
    }

    private static String banReason(Decision decision, RecordedViolation report) {
        return decision.action() == EnforcementAction.BANNED ? suspensionReason(decision, report) : null;
    }

    private void logOutcome(RecordedViolation report, Violation violation, Decision decision) {
        if (report instanceof RecordedViolation.AdminOverride override) {
            log.info("[Recorder] admin={} strike on user={} → {} (violation id={})",
                    override.adminId(), report.userId(), decision.action(), violation.getId());
        } else if (decision.escalates()) {
            log.warn("[Recorder] user={} {} after {} strikes (violation id={}, type={})",
                    report.userId(), decision.action(), decision.strikesAtEscalation(),
                    violation.getId(), report.violationType());
        } else {
            log.info("[Recorder] user={} strike {} recorded (violation id={}, type={})",
                    report.userId(), decision.strikeCountAfter(), violation.getId(), report.violationType());
        }
    }
}
