package com.openforge.lexguard.moderation;

/** A second active suspension was requested for the same account. */
public class AlreadySuspendedException extends ModerationException {

    public AlreadySuspendedException(Long userId, Long activeSuspensionId) {
        super(ErrorKind.CONFLICT, "ALREADY_SUSPENDED",
                "User %d already has an active suspension (%d)".formatted(userId, activeSuspensionId));
    }
}
