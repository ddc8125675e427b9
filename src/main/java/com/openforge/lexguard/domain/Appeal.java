package com.openforge.lexguard.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A user's contest of exactly one suspension.
 *
 * State machine: PENDING → UNDER_REVIEW → APPROVED | REJECTED.
 * The unique constraint on suspension_id is the last line of defence against
 * a duplicate appeal racing past the application check.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "user_suspension_appeals",
    uniqueConstraints = @UniqueConstraint(name = "uq_appeal_suspension", columnNames = "suspension_id"),
    indexes = @Index(name = "idx_appeal_status", columnList = "status")
)
public class Appeal extends BaseEntity {

    public enum AppealStatus {
        PENDING,
        UNDER_REVIEW,
        APPROVED,
        REJECTED;

        public boolean isOpen() {
            return this == PENDING || this == UNDER_REVIEW;
        }
    }

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "suspension_id", nullable = false)
    private Long suspensionId;

    @Column(name = "appeal_reason", nullable = false, length = 200)
    private String appealReason;

    @Column(name = "additional_context", columnDefinition = "TEXT")
    private String additionalContext;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AppealStatus status = AppealStatus.PENDING;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "admin_notes", length = 1000)
    private String adminNotes;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;
}
