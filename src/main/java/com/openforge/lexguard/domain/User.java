package com.openforge.lexguard.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Platform user together with the live moderation state of the account.
 *
 * The moderation columns (strike_count … banned_reason) are written only by
 * AccountStatusStore, always under a row lock. Invariants kept there:
 *
 *   status = SUSPENDED  ⇒  suspension_end set, strike_count = 0
 *   status = BANNED     ⇒  suspension_end null
 *   status = ACTIVE     ⇒  strike_count in [0, strikes-for-suspension - 1]
 */
@Getter
@Setter
@Entity
@Table(name = "users")
public class User extends BaseEntity {

    @Column(nullable = false, length = 64, unique = true)
    private String username;

    @Column(nullable = true, length = 128, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.USER;

    @Column(name = "last_login_time")
    private LocalDateTime lastLoginTime;

    // ── Moderation state ─────────────────────────────────────────────────────

    @Enumerated(EnumType.STRING)
    @Column(name = "account_status", nullable = false, length = 16)
    private AccountStatus accountStatus = AccountStatus.ACTIVE;

    @Column(name = "strike_count", nullable = false)
    private int strikeCount = 0;

    /** Only ever grows, except through an explicit admin correction. */
    @Column(name = "suspension_count", nullable = false)
    private int suspensionCount = 0;

    /** Null unless account_status = SUSPENDED. */
    @Column(name = "suspension_end")
    private LocalDateTime suspensionEnd;

    @Column(name = "last_violation_at")
    private LocalDateTime lastViolationAt;

    @Column(name = "banned_at")
    private LocalDateTime bannedAt;

    @Column(name = "banned_reason", length = 1000)
    private String bannedReason;

    public enum Role {
        USER,
        ADMIN,
        /** Trusted back-end callers that report classifier verdicts. */
        SERVICE
    }

    public enum AccountStatus {
        ACTIVE,
        SUSPENDED,
        BANNED
    }
}
