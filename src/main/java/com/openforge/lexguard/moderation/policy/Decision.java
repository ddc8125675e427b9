package com.openforge.lexguard.moderation.policy;

import java.time.LocalDateTime;

/**
 * Output of the enforcement ladder for one violation.
 *
 * @param strikesAtEscalation strikes counted when the decision was taken,
 *                            including the triggering one
 * @param suspensionEnd       set only for SUSPENDED
 */
public record Decision(
        EnforcementAction action,
        int               strikeCountAfter,
        int               suspensionCountAfter,
        int               strikesAtEscalation,
        LocalDateTime     suspensionEnd,
        LocalDateTime     decidedAt
) {

    public boolean escalates() {
        return action.escalates();
    }
}
