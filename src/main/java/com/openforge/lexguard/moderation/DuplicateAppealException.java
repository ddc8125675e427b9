package com.openforge.lexguard.moderation;

/** Exactly one appeal is allowed per suspension. */
public class DuplicateAppealException extends ModerationException {

    public DuplicateAppealException(Long suspensionId) {
        super(ErrorKind.CONFLICT, "DUPLICATE_APPEAL", "An appeal already exists for suspension " + suspensionId);
    }
}
