package com.openforge.lexguard.moderation.appeal;

import com.openforge.lexguard.domain.Appeal.AppealStatus;

/** Final verdict an administrator gives an appeal. */
public enum AppealOutcome {
    APPROVED,
    REJECTED;

    public AppealStatus toStatus() {
        return this == APPROVED ? AppealStatus.APPROVED : AppealStatus.REJECTED;
    }
}
