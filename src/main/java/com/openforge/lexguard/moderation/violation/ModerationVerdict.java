package com.openforge.lexguard.moderation.violation;

import java.util.Map;

/**
 * What the classifier (or an administrator) said about one piece of content.
 * Only flagged verdicts are ever recorded.
 */
public record ModerationVerdict(
        boolean              flagged,
        Map<String, Boolean> categories,
        Map<String, Double>  scores,
        String               summary
) {

    public ModerationVerdict {
        categories = categories == null ? Map.of() : Map.copyOf(categories);
        scores     = scores == null ? Map.of() : Map.copyOf(scores);
    }

    /** Synthetic verdict attached to an administrator-applied violation. */
    public static ModerationVerdict adminAction(String reason) {
        return new ModerationVerdict(true,
                Map.of("admin_action", true),
                Map.of("admin_action", 1.0),
                "Admin action: " + reason);
    }
}
