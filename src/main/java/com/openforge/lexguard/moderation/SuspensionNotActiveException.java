package com.openforge.lexguard.moderation;

public class SuspensionNotActiveException extends ModerationException {

    public SuspensionNotActiveException(Long suspensionId) {
        super(ErrorKind.CONFLICT, "SUSPENSION_NOT_ACTIVE", "Suspension " + suspensionId + " is not active");
    }
}
