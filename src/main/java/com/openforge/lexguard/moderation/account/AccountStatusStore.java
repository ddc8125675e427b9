package com.openforge.lexguard.moderation.account;

import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.AccountNotFoundException;
import com.openforge.lexguard.moderation.InvalidTransitionException;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.moderation.policy.Decision;
import com.openforge.lexguard.moderation.policy.EnforcementPolicy;
import com.openforge.lexguard.repository.AppealRepository;
import com.openforge.lexguard.repository.SuspensionRepository;
import com.openforge.lexguard.repository.UserRepository;
import com.openforge.lexguard.repository.ViolationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Owner of the live moderation state of every account.
 *
 * Single writer per account: each mutation first takes a row-level write lock
 * on the user ({@link #lockForUpdate}) and then does its read-modify-write
 * inside the surrounding unit of work. Concurrent calls for the same account
 * queue on that lock; calls for different accounts never contend.
 *
 * Transition table enforced here:
 *
 *   ACTIVE    ──strike────────→ ACTIVE (strike_count + 1)
 *   ACTIVE    ──suspend───────→ SUSPENDED
 *   ACTIVE    ──ban───────────→ BANNED
 *   SUSPENDED ──lift / expire─→ ACTIVE
 *   SUSPENDED ──ban───────────→ BANNED
 *   BANNED    ──unban─────────→ ACTIVE   (explicit admin operation only)
 *
 * Anything else raises InvalidTransitionException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountStatusStore {

    private final UserRepository         userRepository;
    private final ViolationRepository    violationRepository;
    private final SuspensionRepository   suspensionRepository;
    private final AppealRepository       appealRepository;
    private final EnforcementPolicy      policy;
    private final ModerationTransactions tx;
    private final Clock                  clock;

    // ── Reads ────────────────────────────────────────────────────────────────

    /** Latest committed state. */
    public AccountState getStatus(Long userId) {
        return userRepository.findById(userId)
                .map(AccountState::of)
                .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    /**
     * Takes the account row lock for the running unit of work and returns the
     * managed entity. Must be called inside ModerationTransactions.
     */
    public User lockForUpdate(Long userId) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("lockForUpdate requires an active moderation transaction");
        }
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    // ── Ladder ───────────────────────────────────────────────────────────────

    /** Installs the outcome of the enforcement ladder. */
    public AccountState applyDecision(Long userId, Decision decision) {
        return applyDecision(userId, decision, null);
    }

    public AccountState applyDecision(Long userId, Decision decision, String banReason) {
        return tx.execute("applyDecision", () -> {
            User user = lockForUpdate(userId);
            if (user.getAccountStatus() == AccountStatus.BANNED) {
                throw new InvalidTransitionException("Account " + userId + " is banned");
            }

            user.setStrikeCount(decision.strikeCountAfter());
            user.setSuspensionCount(decision.suspensionCountAfter());
            user.setLastViolationAt(decision.decidedAt());

            switch (decision.action()) {
                case STRIKE_ADDED -> { }
                case SUSPENDED -> {
                    user.setAccountStatus(AccountStatus.SUSPENDED);
                    user.setSuspensionEnd(decision.suspensionEnd());
                }
                case BANNED -> installBan(user, decision.decidedAt(), banReason);
            }

            log.info("[Account] user={} {} → strikes={} suspensions={} status={}",
                    userId, decision.action(), user.getStrikeCount(),
                    user.getSuspensionCount(), user.getAccountStatus());
            return AccountState.of(user);
        });
    }

    /**
     * Strike correction. Floors at 0, never escalates, never touches the
     * suspension count; undoing a suspension is liftSuspension's job.
     */
    public AccountState removeStrike(Long userId) {
        return tx.execute("removeStrike", () -> {
            User user = lockForUpdate(userId);
            int before = user.getStrikeCount();
            user.setStrikeCount(policy.strikesAfterRemoval(AccountState.of(user)));
            log.info("[Account] user={} strike removed {} → {}", userId, before, user.getStrikeCount());
            return AccountState.of(user);
        });
    }

    // ── Admin-forced states ──────────────────────────────────────────────────

    /**
     * Suspends outside the ladder. The suspension number continues the
     * account's own sequence.
     */
    public AccountState forceSuspend(Long userId, LocalDateTime endsAt) {
        return tx.execute("forceSuspend", () -> {
            User user = lockForUpdate(userId);
            switch (user.getAccountStatus()) {
                case BANNED -> throw new InvalidTransitionException(
                        "Account " + userId + " is banned; lift the ban before suspending");
                case SUSPENDED -> throw new InvalidTransitionException(
                        "Account " + userId + " is already suspended");
                case ACTIVE -> { }
            }
            LocalDateTime now = LocalDateTime.now(clock);
            user.setAccountStatus(AccountStatus.SUSPENDED);
            user.setStrikeCount(0);
            user.setSuspensionCount(user.getSuspensionCount() + 1);
            user.setSuspensionEnd(endsAt);
            user.setLastViolationAt(now);
            log.warn("[Account] user={} force-suspended until {} (suspension #{})",
                    userId, endsAt, user.getSuspensionCount());
            return AccountState.of(user);
        });
    }

    /** Bans outside the ladder. Allowed from ACTIVE and SUSPENDED. */
    public AccountState forceBan(Long userId, String reason) {
        return tx.execute("forceBan", () -> {
            User user = lockForUpdate(userId);
            if (user.getAccountStatus() == AccountStatus.BANNED) {
                throw new InvalidTransitionException("Account " + userId + " is already banned");
            }
            LocalDateTime now = LocalDateTime.now(clock);
            user.setStrikeCount(0);
            user.setSuspensionCount(user.getSuspensionCount() + 1);
            user.setLastViolationAt(now);
            installBan(user, now, reason);
            log.warn("[Account] user={} force-banned (suspension #{})", userId, user.getSuspensionCount());
            return AccountState.of(user);
        });
    }

    // ── Back to ACTIVE ───────────────────────────────────────────────────────

    /**
     * Early end of a suspension. Strike and suspension counts are history and
     * stay as they are.
     */
    public AccountState liftSuspension(Long userId, Long adminId, String reason) {
        return tx.execute("liftSuspension", () -> {
            User user = lockForUpdate(userId);
            if (user.getAccountStatus() != AccountStatus.SUSPENDED) {
                throw new InvalidTransitionException(
                        "Account " + userId + " is not suspended (status=" + user.getAccountStatus() + ")");
            }
            user.setAccountStatus(AccountStatus.ACTIVE);
            user.setSuspensionEnd(null);
            log.info("[Account] user={} suspension lifted by admin={} reason={}", userId, adminId, reason);
            return AccountState.of(user);
        });
    }

    /**
     * Natural end of a suspension window. A no-op unless the account is still
     * suspended and its window has passed, so a late or repeated call is harmless.
     */
    public AccountState returnToActiveAfterExpiry(Long userId) {
        return tx.execute("returnToActive", () -> {
            User user = lockForUpdate(userId);
            LocalDateTime now = LocalDateTime.now(clock);
            if (AccountState.of(user).isSuspensionOver(now)) {
                user.setAccountStatus(AccountStatus.ACTIVE);
                user.setStrikeCount(0);
                user.setSuspensionEnd(null);
                log.info("[Account] user={} suspension window over, back to ACTIVE", userId);
            }
            return AccountState.of(user);
        });
    }

    /**
     * Unban: a distinct operation from lifting a suspension. Strikes restart at
     * 0; the suspension count is kept as the permanent record.
     */
    public AccountState unban(Long userId, Long adminId, String reason) {
        return tx.execute("unban", () -> {
            User user = lockForUpdate(userId);
            if (user.getAccountStatus() != AccountStatus.BANNED) {
                throw new InvalidTransitionException("Account " + userId + " is not banned");
            }
            user.setAccountStatus(AccountStatus.ACTIVE);
            user.setStrikeCount(0);
            user.setSuspensionEnd(null);
            user.setBannedAt(null);
            user.setBannedReason(null);
            log.warn("[Account] user={} UNBANNED by admin={} reason={}", userId, adminId, reason);
            return AccountState.of(user);
        });
    }

    // ── Deletion ─────────────────────────────────────────────────────────────

    /** Removes the account together with its violations, suspensions and appeals. */
    public void deleteAccount(Long userId) {
        tx.run("deleteAccount", () -> {
            User user = lockForUpdate(userId);
            int appeals     = appealRepository.deleteByUserId(userId);
            int suspensions = suspensionRepository.deleteByUserId(userId);
            int violations  = violationRepository.deleteByUserId(userId);
            userRepository.delete(user);
            log.warn("[Account] user={} deleted with {} violations, {} suspensions, {} appeals",
                    userId, violations, suspensions, appeals);
        });
    }

    private static void installBan(User user, LocalDateTime at, String reason) {
        user.setAccountStatus(AccountStatus.BANNED);
        user.setSuspensionEnd(null);
        user.setBannedAt(at);
        user.setBannedReason(reason);
    }
}
