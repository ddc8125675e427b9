package com.openforge.lexguard.moderation.appeal;

import com.openforge.lexguard.domain.AdminAuditLog.AdminAction;
import com.openforge.lexguard.domain.Appeal;
import com.openforge.lexguard.domain.Appeal.AppealStatus;
import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.moderation.AppealNotFoundException;
import com.openforge.lexguard.moderation.DuplicateAppealException;
import com.openforge.lexguard.moderation.InvalidTransitionException;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.moderation.ModerationValidationException;
import com.openforge.lexguard.moderation.SuspensionNotActiveException;
import com.openforge.lexguard.moderation.SuspensionNotFoundException;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.admin.AdminAuditTrail;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import com.openforge.lexguard.repository.AppealRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One appeal per suspension: PENDING → UNDER_REVIEW → APPROVED | REJECTED.
 *
 * Approval touches three rows (suspension, account, appeal) in one unit of
 * work, in that order, so the appeal only reads APPROVED once the other two
 * writes have gone through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppealWorkflow {

    static final int MAX_REASON_LENGTH  = 200;
    static final int MAX_CONTEXT_LENGTH = 2000;

    private final AppealRepository       appealRepository;
    private final SuspensionLedger       ledger;
    private final AccountStatusStore     accounts;
    private final AdminAuditTrail        audit;
    private final ModerationTransactions tx;
    private final Clock                  clock;

    /**
     * @throws SuspensionNotFoundException  unknown suspension, or one that belongs to someone else
     * @throws DuplicateAppealException     the suspension has already been appealed
     * @throws SuspensionNotActiveException the suspension is lifted or expired, including one whose
     *                                      window has passed but the sweep has not reached yet
     * @throws InvalidTransitionException   the suspension is a permanent ban
     */
    public Appeal submit(Long userId, Long suspensionId, String reason, String additionalContext) {
        String trimmedReason = reason == null ? "" : reason.trim();
        if (trimmedReason.isEmpty()) {
            throw new ModerationValidationException("Appeal reason is required");
        }
        if (trimmedReason.length() > MAX_REASON_LENGTH) {
            throw new ModerationValidationException("Appeal reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        if (additionalContext != null && additionalContext.length() > MAX_CONTEXT_LENGTH) {
            throw new ModerationValidationException("Additional context must be at most " + MAX_CONTEXT_LENGTH + " characters");
        }

        // commits on its own so an overdue suspension stays EXPIRED when the appeal is refused
        ledger.settleOverdue(userId);

        return tx.execute("submitAppeal", () -> {
            accounts.lockForUpdate(userId);
            Suspension suspension = ledger.get(suspensionId);
            if (!suspension.getUserId().equals(userId)) {
                throw new SuspensionNotFoundException(suspensionId);
            }
            if (appealRepository.existsBySuspensionId(suspensionId)) {
                throw new DuplicateAppealException(suspensionId);
            }
            if (suspension.getStatus() != SuspensionStatus.ACTIVE) {
                throw new SuspensionNotActiveException(suspensionId);
            }
            if (suspension.isPermanent()) {
                throw new InvalidTransitionException("Permanent bans cannot be appealed");
            }

            Appeal appeal = Appeal.builder()
                    .userId(userId)
                    .suspensionId(suspensionId)
                    .appealReason(trimmedReason)
                    .additionalContext(additionalContext)
                    .build();
            try {
                appeal = appealRepository.saveAndFlush(appeal);
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateAppealException(suspensionId);
            }
            log.info("[Appeal] user={} submitted appeal id={} for suspension={}", userId, appeal.getId(), suspensionId);
            return appeal;
        });
    }

    /** PENDING → UNDER_REVIEW. */
    public Appeal beginReview(Long appealId, Long adminId) {
        return tx.execute("beginAppealReview", () -> {
            Appeal appeal = lockAndLoad(appealId);
            if (appeal.getStatus() != AppealStatus.PENDING) {
                throw new InvalidTransitionException(
                        "Appeal " + appealId + " is " + appeal.getStatus() + ", only PENDING appeals can be taken into review");
            }
            appeal.setStatus(AppealStatus.UNDER_REVIEW);
            appeal.setReviewedBy(adminId);
            audit.record(adminId, AdminAction.APPEAL_REVIEW_STARTED, appeal.getUserId(),
                    Map.of("appeal_id", appealId, "suspension_id", appeal.getSuspensionId()));
            log.info("[Appeal] appeal id={} under review by admin={}", appealId, adminId);
            return appeal;
        });
    }

    /**
     * Closes an open appeal. Approval lifts the suspension and reactivates the
     * account; rejection only records the verdict.
     *
     * @throws SuspensionNotActiveException on approval when the suspension already ended; an
     *                                      overdue one is expired first and stays EXPIRED
     */
    public Appeal resolve(Long appealId, Long adminId, AppealOutcome outcome, String adminNotes, String rejectionReason) {
        if (outcome == null) {
            throw new ModerationValidationException("Appeal outcome is required");
        }
        if (outcome == AppealOutcome.REJECTED && (rejectionReason == null || rejectionReason.isBlank())) {
            throw new ModerationValidationException("A rejection reason is required");
        }

        if (outcome == AppealOutcome.APPROVED) {
            Long owner = appealRepository.findUserIdById(appealId)
                    .orElseThrow(() -> new AppealNotFoundException(appealId));
            ledger.settleOverdue(owner);
        }

        return tx.execute("resolveAppeal", () -> {
            Appeal appeal = lockAndLoad(appealId);
            if (!appeal.getStatus().isOpen()) {
                throw new InvalidTransitionException("Appeal " + appealId + " is already " + appeal.getStatus());
            }

            if (outcome == AppealOutcome.APPROVED) {
                String liftReason = "Appeal approved" + (adminNotes == null || adminNotes.isBlank() ? "" : ": " + adminNotes);
                ledger.lift(appeal.getSuspensionId(), adminId, liftReason);
                accounts.liftSuspension(appeal.getUserId(), adminId, liftReason);
            } else {
                appeal.setRejectionReason(rejectionReason);
            }

            appeal.setStatus(outcome.toStatus());
            appeal.setReviewedBy(adminId);
            appeal.setReviewedAt(LocalDateTime.now(clock));
            appeal.setAdminNotes(adminNotes);
            appealRepository.save(appeal);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("appeal_id", appealId);
            details.put("suspension_id", appeal.getSuspensionId());
            if (rejectionReason != null) {
                details.put("rejection_reason", rejectionReason);
            }
            audit.record(adminId,
                    outcome == AppealOutcome.APPROVED ? AdminAction.APPEAL_APPROVED : AdminAction.APPEAL_REJECTED,
                    appeal.getUserId(), details);

            log.info("[Appeal] appeal id={} {} by admin={} (user={}, suspension={})",
                    appealId, outcome, adminId, appeal.getUserId(), appeal.getSuspensionId());
            return appeal;
        });
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public Appeal get(Long appealId) {
        return appealRepository.findById(appealId).orElseThrow(() -> new AppealNotFoundException(appealId));
    }

    /** Newest first. */
    public List<Appeal> listForUser(Long userId) {
        return appealRepository.findByUserIdOrderByIdDesc(userId);
    }

    public Page<Appeal> listByStatus(AppealStatus status, Pageable pageable) {
        return status == null ? appealRepository.findAll(pageable) : appealRepository.findByStatus(status, pageable);
    }

    public boolean hasAppeal(Long suspensionId) {
        return appealRepository.existsBySuspensionId(suspensionId);
    }

    public AppealStats stats() {
        long pending     = appealRepository.countByStatus(AppealStatus.PENDING);
        long underReview = appealRepository.countByStatus(AppealStatus.UNDER_REVIEW);
        long approved    = appealRepository.countByStatus(AppealStatus.APPROVED);
        long rejected    = appealRepository.countByStatus(AppealStatus.REJECTED);
        return new AppealStats(pending, underReview, approved, rejected, pending + underReview + approved + rejected);
    }

    /** Account lock first, then the appeal, so the appeal is read after any competing writer committed. */
    private Appeal lockAndLoad(Long appealId) {
        Long userId = appealRepository.findUserIdById(appealId)
                .orElseThrow(() -> new AppealNotFoundException(appealId));
        accounts.lockForUpdate(userId);
        return get(appealId);
    }
}
