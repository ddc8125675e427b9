package com.openforge.lexguard.moderation;

public class AppealNotFoundException extends ModerationException {

    public AppealNotFoundException(Long appealId) {
        super(ErrorKind.NOT_FOUND, "APPEAL_NOT_FOUND", "Appeal not found: " + appealId);
    }
}
