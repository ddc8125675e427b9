package com.openforge.lexguard.moderation.suspension;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.Suspension.SuspensionType;
import com.openforge.lexguard.moderation.AlreadySuspendedException;
import com.openforge.lexguard.moderation.ModerationException;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.moderation.ModerationValidationException;
import com.openforge.lexguard.moderation.SuspensionNotActiveException;
import com.openforge.lexguard.moderation.SuspensionNotFoundException;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.repository.SuspensionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-mostly history of suspensions, one ACTIVE entry per account at most.
 *
 * Every write takes the owning account's row lock first, so the "at most one
 * active" check and the ACTIVE → EXPIRED transition are decided by exactly one
 * writer. expire() is a conditional transition: the first caller moves the row
 * and returns the account to ACTIVE, every later caller gets {@code false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuspensionLedger {

    private final SuspensionRepository   suspensionRepository;
    private final AccountStatusStore     accounts;
    private final ModerationTransactions tx;
    private final Clock                  clock;

    /**
     * Opens a new suspension. A null {@code endsAt} opens a permanent one.
     *
     * @throws AlreadySuspendedException if the account already has an active suspension
     */
    public Suspension open(Long userId, String reason, List<Long> violationIds,
                           int suspensionNumber, int strikesAtSuspension,
                           LocalDateTime startedAt, LocalDateTime endsAt) {
        if (violationIds == null || violationIds.isEmpty()) {
            throw new ModerationValidationException("A suspension must reference at least one violation");
        }
        if (endsAt != null && !endsAt.isAfter(startedAt)) {
            throw new ModerationValidationException("Suspension must end after it starts");
        }

        return tx.execute("openSuspension", () -> {
            accounts.lockForUpdate(userId);
            suspensionRepository.findFirstByUserIdAndStatusOrderByIdDesc(userId, SuspensionStatus.ACTIVE)
                    .ifPresent(active -> {
                        throw new AlreadySuspendedException(userId, active.getId());
                    });

            Suspension suspension = Suspension.builder()
                    .userId(userId)
                    .suspensionType(endsAt == null ? SuspensionType.PERMANENT : SuspensionType.TEMPORARY)
                    .reason(reason)
                    .violationIds(List.copyOf(violationIds))
                    .suspensionNumber(suspensionNumber)
                    .strikesAtSuspension(strikesAtSuspension)
                    .startedAt(startedAt)
                    .endsAt(endsAt)
                    .build();
            Suspension saved = suspensionRepository.save(suspension);

            log.warn("[Ledger] opened {} suspension id={} user={} #{} until={}",
                    saved.getSuspensionType(), saved.getId(), userId, suspensionNumber, endsAt);
            return saved;
        });
    }

    /**
     * Moves an ACTIVE suspension to LIFTED. The account itself is not touched;
     * callers pair this with AccountStatusStore in the same unit of work.
     *
     * @throws SuspensionNotActiveException if it is already lifted or expired
     */
    public Suspension lift(Long suspensionId, Long adminId, String reason) {
        return tx.execute("liftSuspension", () -> {
            Long userId = ownerOf(suspensionId);
            accounts.lockForUpdate(userId);
            Suspension suspension = get(suspensionId);
            if (suspension.getStatus() != SuspensionStatus.ACTIVE) {
                throw new SuspensionNotActiveException(suspensionId);
            }
            suspension.setStatus(SuspensionStatus.LIFTED);
            suspension.setLiftedAt(LocalDateTime.now(clock));
            suspension.setLiftedBy(adminId);
            suspension.setLiftedReason(reason);
            log.info("[Ledger] lifted suspension id={} user={} by admin={}", suspensionId, userId, adminId);
            return suspension;
        });
    }

    /** Lifts whatever suspension is active for the account, if any. */
    public Optional<Suspension> liftActive(Long userId, Long adminId, String reason) {
        return tx.execute("liftActiveSuspension", () -> {
            accounts.lockForUpdate(userId);
            return getActive(userId).map(active -> lift(active.getId(), adminId, reason));
        });
    }

    /**
     * ACTIVE → EXPIRED once the window has passed, then returns the account to
     * ACTIVE. Idempotent: returns {@code false} when there was nothing to do.
     */
    public boolean expire(Long suspensionId) {
        return tx.execute("expireSuspension", () -> {
            Long userId = ownerOf(suspensionId);
            accounts.lockForUpdate(userId);
            Suspension suspension = get(suspensionId);
            LocalDateTime now = LocalDateTime.now(clock);

            boolean due = suspension.getStatus() == SuspensionStatus.ACTIVE
                    && suspension.getEndsAt() != null
                    && !now.isBefore(suspension.getEndsAt());
            if (!due) {
                log.debug("[Ledger] expire id={} skipped (status={}, endsAt={})",
                        suspensionId, suspension.getStatus(), suspension.getEndsAt());
                return false;
            }

            suspension.setStatus(SuspensionStatus.EXPIRED);
            accounts.returnToActiveAfterExpiry(userId);
            log.info("[Ledger] expired suspension id={} user={}", suspensionId, userId);
            return true;
        });
    }

    /**
     * Brings an account whose suspension window has passed back to ACTIVE.
     * Used on the read path and before new enforcement, so a missed sweep
     * never leaves a user locked out.
     */
    public AccountState settleOverdue(Long userId) {
        return tx.execute("settleOverdue", () -> {
            AccountState state = AccountState.of(accounts.lockForUpdate(userId));
            if (!state.isSuspensionOver(LocalDateTime.now(clock))) {
                return state;
            }
            Optional<Suspension> active = getActive(userId);
            if (active.isPresent()) {
                expire(active.get().getId());
            } else {
                accounts.returnToActiveAfterExpiry(userId);
            }
            return accounts.getStatus(userId);
        });
    }

    /**
     * Expires every due suspension, one unit of work each. A failure on one
     * row is logged and the sweep moves on; the next run picks it up again.
     * A store outage while listing candidates surfaces as StoreUnavailableException.
     *
     * @return number of suspensions this call expired
     */
    public int expireDue() {
        List<Long> due = tx.execute("findDueSuspensions",
                () -> suspensionRepository.findDueForExpiry(LocalDateTime.now(clock)));
        int expired = 0;
        for (Long id : due) {
            try {
                if (expire(id)) {
                    expired++;
                }
            } catch (ModerationException e) {
                log.error("[Ledger] sweep could not expire suspension id={}: {}", id, e.getMessage());
            }
        }
        if (!due.isEmpty()) {
            log.info("[Ledger] sweep: {} due, {} expired", due.size(), expired);
        }
        return expired;
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public Suspension get(Long suspensionId) {
        return suspensionRepository.findById(suspensionId)
                .orElseThrow(() -> new SuspensionNotFoundException(suspensionId));
    }

    public Optional<Suspension> getActive(Long userId) {
        return suspensionRepository.findFirstByUserIdAndStatusOrderByIdDesc(userId, SuspensionStatus.ACTIVE);
    }

    /** Full history, oldest first. */
    public List<Suspension> listForUser(Long userId) {
        return suspensionRepository.findByUserIdOrderByIdAsc(userId);
    }

    private Long ownerOf(Long suspensionId) {
        return suspensionRepository.findUserIdById(suspensionId)
                .orElseThrow(() -> new SuspensionNotFoundException(suspensionId));
    }
}
