package com.openforge.lexguard.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Self-service signup always creates a USER account. */
public record RegisterRequest(
        @NotBlank @Size(min = 3, max = 64) @Pattern(regexp = "[A-Za-z0-9_.-]+") String username,
        @Email @Size(max = 128)                                                  String email,
        @NotBlank @Size(min = 8, max = 72)                                       String password,
        @Size(max = 128)                                                         String displayName
) {
}
