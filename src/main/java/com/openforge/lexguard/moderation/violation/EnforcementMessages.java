package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Violation;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** User-facing text for the outcome of an enforcement step. */
public final class EnforcementMessages {

    private static final DateTimeFormatter END_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private EnforcementMessages() {
    }

    public static String forAction(Violation.ActionTaken action, int strikeCount, int suspensionCount,
                                   LocalDateTime suspensionEnd, int strikesForSuspension) {
        return switch (action) {
            case BANNED -> "Your account has been permanently banned for repeated violations of our "
                    + "community guidelines. If you believe this was a mistake, please contact support.";
            case SUSPENDED -> "Your account has been suspended until "
                    + (suspensionEnd == null ? "further notice" : END_FORMAT.format(suspensionEnd))
                    + " for violating our community guidelines. This is suspension #" + suspensionCount
                    + ". Your strike count has been reset.";
            case STRIKE_ADDED -> {
                int remaining = Math.max(0, strikesForSuspension - strikeCount);
                yield "Community guidelines violation detected. You have " + strikeCount
                        + (strikeCount == 1 ? " strike" : " strikes") + ". " + remaining
                        + " more will lead to suspension.";
            }
        };
    }

    public static String temporarilySuspended(LocalDateTime until) {
        return until == null
                ? "Your account is suspended."
                : "Your account is suspended until " + END_FORMAT.format(until) + ".";
    }

    public static String permanentlyBanned() {
        return "Your account has been permanently banned.";
    }
}
