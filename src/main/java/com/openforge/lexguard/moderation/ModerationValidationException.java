package com.openforge.lexguard.moderation;

/** Malformed input rejected before it reaches the enforcement logic. */
public class ModerationValidationException extends ModerationException {

    public ModerationValidationException(String message) {
        super(ErrorKind.VALIDATION, "VALIDATION_FAILED", message);
    }
}
