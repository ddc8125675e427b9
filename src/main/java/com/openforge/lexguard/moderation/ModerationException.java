package com.openforge.lexguard.moderation;

import lombok.Getter;

/**
 * Base for every error the enforcement engine surfaces to its callers.
 *
 * The {@link ErrorKind} tells callers what to do next: NOT_FOUND and
 * VALIDATION are never retried, CONFLICT needs a fresh read before retrying
 * with corrected intent, STORE_UNAVAILABLE is the only kind that is safe to
 * retry as-is.
 */
@Getter
public abstract class ModerationException extends RuntimeException {

    public enum ErrorKind {
        NOT_FOUND,
        CONFLICT,
        VALIDATION,
        STORE_UNAVAILABLE
    }

    private final ErrorKind kind;
    private final String    errorCode;

    protected ModerationException(ErrorKind kind, String errorCode, String message) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    protected ModerationException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
    }
}
