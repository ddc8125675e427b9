package com.openforge.lexguard.moderation;

public class SuspensionNotFoundException extends ModerationException {

    public SuspensionNotFoundException(Long suspensionId) {
        super(ErrorKind.NOT_FOUND, "SUSPENSION_NOT_FOUND", "Suspension not found: " + suspensionId);
    }
}
