package com.openforge.lexguard.auth.dto;

import com.openforge.lexguard.domain.User;

public record AuthResponse(
        Long               userId,
        String             username,
        String             displayName,
        User.Role          role,
        User.AccountStatus accountStatus,
        String             token
) {
}
