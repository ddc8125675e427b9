package com.openforge.lexguard.moderation.policy;

import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.domain.User.AccountStatus;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of one account's moderation state, as committed.
 */
public record AccountState(
        Long          userId,
        AccountStatus status,
        int           strikeCount,
        int           suspensionCount,
        LocalDateTime suspensionEnd,
        LocalDateTime lastViolationAt,
        LocalDateTime bannedAt,
        String        bannedReason
) {

    public static AccountState of(User user) {
        return new AccountState(
                user.getId(),
                user.getAccountStatus(),
                user.getStrikeCount(),
                user.getSuspensionCount(),
                user.getSuspensionEnd(),
                user.getLastViolationAt(),
                user.getBannedAt(),
                user.getBannedReason()
        );
    }

    /** A brand-new account: no strikes, no suspensions. */
    public static AccountState fresh(Long userId) {
        return new AccountState(userId, AccountStatus.ACTIVE, 0, 0, null, null, null, null);
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public boolean isBanned() {
        return status == AccountStatus.BANNED;
    }

    public boolean isSuspended() {
        return status == AccountStatus.SUSPENDED;
    }

    /** Suspended, but the window has already passed and nobody has expired it yet. */
    public boolean isSuspensionOver(LocalDateTime now) {
        return isSuspended() && suspensionEnd != null && !now.isBefore(suspensionEnd);
    }
}
