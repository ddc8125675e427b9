package com.openforge.lexguard.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.util.Map;

/**
 * Append-only record of an administrator's moderation action.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Immutable
@Entity
@Table(
    name = "admin_audit_logs",
    indexes = @Index(name = "idx_audit_target", columnList = "target_user_id")
)
public class AdminAuditLog extends BaseEntity {

    public enum AdminAction {
        APPLY_STRIKE,
        REMOVE_STRIKE,
        FORCE_SUSPEND,
        FORCE_BAN,
        LIFT_SUSPENSION,
        LIFT_BAN,
        DELETE_ACCOUNT,
        APPEAL_REVIEW_STARTED,
        APPEAL_APPROVED,
        APPEAL_REJECTED
    }

    @Column(name = "admin_id", nullable = false)
    private Long adminId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AdminAction action;

    @Column(name = "target_user_id", nullable = false)
    private Long targetUserId;

    @Convert(converter = JsonConverters.ObjectMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> details;
}
