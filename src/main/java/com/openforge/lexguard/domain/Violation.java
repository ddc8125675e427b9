package com.openforge.lexguard.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.util.Map;

/**
 * One moderation decision against one piece of content.
 *
 * Written once and never updated; removed only when the owning account is
 * deleted. content_text is a snapshot, not a live reference to the post.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Immutable
@Entity
@Table(
    name = "user_violations",
    indexes = {
        @Index(name = "idx_violation_user", columnList = "user_id"),
        @Index(name = "idx_violation_dedup", columnList = "user_id, content_id, violation_type")
    }
)
public class Violation extends BaseEntity {

    public enum ViolationType {
        FORUM_POST,
        FORUM_REPLY,
        CHATBOT_PROMPT,
        ADMIN_ACTION
    }

    public enum ActionTaken {
        STRIKE_ADDED,
        SUSPENDED,
        BANNED
    }

    /** Which pipeline produced the record: the classifier or an administrator. */
    public enum Source {
        AUTOMATIC,
        ADMIN_OVERRIDE
    }

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "violation_type", nullable = false, length = 32)
    private ViolationType violationType;

    @Column(name = "content_id", length = 128)
    private String contentId;

    @Column(name = "content_text", columnDefinition = "TEXT")
    private String contentText;

    @Convert(converter = JsonConverters.BooleanMapConverter.class)
    @Column(name = "flagged_categories", columnDefinition = "TEXT")
    private Map<String, Boolean> flaggedCategories;

    @Convert(converter = JsonConverters.DoubleMapConverter.class)
    @Column(name = "category_scores", columnDefinition = "TEXT")
    private Map<String, Double> categoryScores;

    @Column(name = "violation_summary", length = 1000)
    private String violationSummary;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private Source source;

    /** Set when source = ADMIN_OVERRIDE. */
    @Column(name = "admin_id")
    private Long adminId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_taken", nullable = false, length = 16)
    private ActionTaken actionTaken;

    @Column(name = "strike_count_after", nullable = false)
    private int strikeCountAfter;

    @Column(name = "suspension_count_after", nullable = false)
    private int suspensionCountAfter;
}
