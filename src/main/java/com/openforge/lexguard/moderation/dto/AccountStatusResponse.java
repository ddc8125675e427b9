package com.openforge.lexguard.moderation.dto;

import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.moderation.policy.AccountState;

import java.time.LocalDateTime;

/** Moderation standing of one account, as shown to the user or an admin. */
public record AccountStatusResponse(
        Long          userId,
        String        username,
        String        accountStatus,
        int           strikeCount,
        int           suspensionCount,
        LocalDateTime suspensionEnd,
        LocalDateTime lastViolationAt,
        LocalDateTime bannedAt,
        String        bannedReason
) {

    public static AccountStatusResponse from(AccountState s) {
        return new AccountStatusResponse(s.userId(), null, s.status().name(), s.strikeCount(),
                s.suspensionCount(), s.suspensionEnd(), s.lastViolationAt(), s.bannedAt(), s.bannedReason());
    }

    public static AccountStatusResponse from(User u) {
        AccountState s = AccountState.of(u);
        return new AccountStatusResponse(s.userId(), u.getUsername(), s.status().name(), s.strikeCount(),
                s.suspensionCount(), s.suspensionEnd(), s.lastViolationAt(), s.bannedAt(), s.bannedReason());
    }
}
