package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Violation;
import com.openforge.lexguard.moderation.policy.AccountState;

/**
 * Result of recording one violation.
 *
 * @param suspension the suspension opened by this violation, if it escalated
 * @param duplicate  true when the same content was already recorded inside the
 *                   dedup window; nothing was written and {@code violation} is
 *                   the earlier record
 */
public record RecordOutcome(
        Violation             violation,
        Violation.ActionTaken actionTaken,
        AccountState          account,
        Suspension            suspension,
        boolean               duplicate,
        String                message
) {

    public boolean escalated() {
        return actionTaken != Violation.ActionTaken.STRIKE_ADDED;
    }
}
