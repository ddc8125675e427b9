package com.openforge.lexguard.moderation.policy;

import com.openforge.lexguard.domain.Violation;

public enum EnforcementAction {
    STRIKE_ADDED,
    SUSPENDED,
    BANNED;

    public Violation.ActionTaken toActionTaken() {
        return switch (this) {
            case STRIKE_ADDED -> Violation.ActionTaken.STRIKE_ADDED;
            case SUSPENDED    -> Violation.ActionTaken.SUSPENDED;
            case BANNED       -> Violation.ActionTaken.BANNED;
        };
    }

    public boolean escalates() {
        return this != STRIKE_ADDED;
    }
}
