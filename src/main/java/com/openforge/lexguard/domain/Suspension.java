package com.openforge.lexguard.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the per-account suspension history.
 *
 * Lifecycle: ACTIVE → LIFTED (admin or approved appeal) | EXPIRED (window passed).
 * At most one ACTIVE row per user; SuspensionLedger enforces it under the
 * account row lock.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "user_suspensions",
    indexes = {
        @Index(name = "idx_suspension_user_status", columnList = "user_id, status"),
        @Index(name = "idx_suspension_status_ends", columnList = "status, ends_at")
    }
)
public class Suspension extends BaseEntity {

    public enum SuspensionType {
        TEMPORARY,
        PERMANENT
    }

    public enum SuspensionStatus {
        ACTIVE,
        LIFTED,
        EXPIRED
    }

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "suspension_type", nullable = false, length = 16)
    private SuspensionType suspensionType;

    @Column(nullable = false, length = 1000)
    private String reason;

    /** Evidence trail, oldest first. Never empty. */
    @Builder.Default
    @Convert(converter = JsonConverters.LongListConverter.class)
    @Column(name = "violation_ids", nullable = false, columnDefinition = "TEXT")
    private List<Long> violationIds = new ArrayList<>();

    /** 1-based, per account. */
    @Column(name = "suspension_number", nullable = false)
    private int suspensionNumber;

    @Column(name = "strikes_at_suspension", nullable = false)
    private int strikesAtSuspension;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    /** Null exactly when suspension_type = PERMANENT. */
    @Column(name = "ends_at")
    private LocalDateTime endsAt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SuspensionStatus status = SuspensionStatus.ACTIVE;

    @Column(name = "lifted_at")
    private LocalDateTime liftedAt;

    @Column(name = "lifted_by")
    private Long liftedBy;

    @Column(name = "lifted_reason", length = 1000)
    private String liftedReason;

    public boolean isPermanent() {
        return suspensionType == SuspensionType.PERMANENT;
    }
}
