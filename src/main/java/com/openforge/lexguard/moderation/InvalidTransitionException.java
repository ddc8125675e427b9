package com.openforge.lexguard.moderation;

/** The requested state change is not reachable from the current state. */
public class InvalidTransitionException extends ModerationException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.CONFLICT, "INVALID_TRANSITION", message);
    }
}
