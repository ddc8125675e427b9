package com.openforge.lexguard.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** identifier is a username or an email address. */
public record LoginRequest(
        @NotBlank @Size(max = 128) String identifier,
        @NotBlank @Size(max = 72)  String password
) {
}
