package com.openforge.lexguard.moderation;

public class AccountNotFoundException extends ModerationException {

    public AccountNotFoundException(Long userId) {
        super(ErrorKind.NOT_FOUND, "ACCOUNT_NOT_FOUND", "Account not found: " + userId);
    }
}
