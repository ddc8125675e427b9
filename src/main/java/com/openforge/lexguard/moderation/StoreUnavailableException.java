package com.openforge.lexguard.moderation;

/**
 * The persistence layer could not complete a unit of work after all retries.
 * Safe to retry later: every unit of work is atomic and recording is deduplicated.
 */
public class StoreUnavailableException extends ModerationException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, "STORE_UNAVAILABLE",
                "Moderation store unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
