package com.openforge.lexguard.moderation.gate;

import com.openforge.lexguard.moderation.violation.EnforcementMessages;

import java.time.LocalDateTime;

/**
 * Answer to "may this user post right now?".
 *
 * @param suspensionEnd set only for TEMPORARY restrictions
 */
public record GateResult(
        boolean       allowed,
        Restriction   restriction,
        LocalDateTime suspensionEnd,
        String        message
) {

    public enum Restriction {
        NONE,
        TEMPORARY,
        PERMANENT
    }

    public static GateResult allow() {
        return new GateResult(true, Restriction.NONE, null, null);
    }

    public static GateResult suspendedUntil(LocalDateTime end) {
        return new GateResult(false, Restriction.TEMPORARY, end, EnforcementMessages.temporarilySuspended(end));
    }

    public static GateResult banned() {
        return new GateResult(false, Restriction.PERMANENT, null, EnforcementMessages.permanentlyBanned());
    }
}
