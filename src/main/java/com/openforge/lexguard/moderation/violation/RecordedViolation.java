package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Violation.Source;
import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.moderation.ModerationValidationException;

/**
 * A violation to be recorded, tagged by where it came from.
 *
 * Automatic: a classifier flagged user content. AdminOverride: an
 * administrator applied a strike by hand; stored as ADMIN_ACTION with the
 * acting admin's id.
 */
public sealed interface RecordedViolation
        permits RecordedViolation.Automatic, RecordedViolation.AdminOverride {

    Long userId();

    ViolationType violationType();

    String contentId();

    String contentText();

    ModerationVerdict verdict();

    Source source();

    /** Null for automatic violations. */
    Long adminId();

    record Automatic(
            Long              userId,
            ViolationType     violationType,
            String            contentId,
            String            contentText,
            ModerationVerdict verdict
    ) implements RecordedViolation {

        public Automatic {
            requireUser(userId);
            if (violationType == null || violationType == ViolationType.ADMIN_ACTION) {
                throw new ModerationValidationException("Automatic violations need a content type, got " + violationType);
            }
            if (verdict == null || !verdict.flagged()) {
                throw new ModerationValidationException("Only flagged content can be recorded as a violation");
            }
        }

        @Override
        public Source source() {
            return Source.AUTOMATIC;
        }

        @Override
        public Long adminId() {
            return null;
        }
    }

    record AdminOverride(
            Long   userId,
            Long   adminId,
            String contentId,
            String contentText,
            String reason
    ) implements RecordedViolation {

        public AdminOverride {
            requireUser(userId);
            if (adminId == null) {
                throw new ModerationValidationException("Admin actions must be attributed to an admin");
            }
            if (reason == null || reason.isBlank()) {
                throw new ModerationValidationException("Admin actions require a reason");
            }
        }

        @Override
        public ViolationType violationType() {
            return ViolationType.ADMIN_ACTION;
        }

        @Override
        public ModerationVerdict verdict() {
            return ModerationVerdict.adminAction(reason);
        }

        @Override
        public Source source() {
            return Source.ADMIN_OVERRIDE;
        }
    }

    private static void requireUser(Long userId) {
        if (userId == null) {
            throw new ModerationValidationException("userId is required");
        }
    }
}
