package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Violation;
import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.moderation.ModerationValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecordedViolation and enforcement messages")
class RecordedViolationTest {

    private static final ModerationVerdict FLAGGED =
            new ModerationVerdict(true, Map.of("hate", true), Map.of("hate", 0.8), "Flagged for: hate");

    @Test
    @DisplayName("unflagged verdicts are rejected")
    void unflaggedRejected() {
        ModerationVerdict clean = new ModerationVerdict(false, null, null, null);

        assertThatThrownBy(() -> new RecordedViolation.Automatic(1L, ViolationType.FORUM_POST, "p1", "text", clean))
                .isInstanceOf(ModerationValidationException.class);
    }

    @Test
    @DisplayName("automatic violations cannot claim the admin content type")
    void automaticCannotBeAdminAction() {
        assertThatThrownBy(() -> new RecordedViolation.Automatic(1L, ViolationType.ADMIN_ACTION, "p1", "t", FLAGGED))
                .isInstanceOf(ModerationValidationException.class);
    }

    @Test
    @DisplayName("admin overrides need an admin and a reason")
    void adminOverrideAttribution() {
        assertThatThrownBy(() -> new RecordedViolation.AdminOverride(1L, null, null, null, "spam"))
                .isInstanceOf(ModerationValidationException.class);
        assertThatThrownBy(() -> new RecordedViolation.AdminOverride(1L, 2L, null, null, "  "))
                .isInstanceOf(ModerationValidationException.class);
    }

    @Test
    @DisplayName("admin override is stored as ADMIN_ACTION with a synthetic verdict")
    void adminOverrideShape() {
        RecordedViolation report = new RecordedViolation.AdminOverride(1L, 2L, "p9", "text", "repeated spam");

        assertThat(report.violationType()).isEqualTo(ViolationType.ADMIN_ACTION);
        assertThat(report.source()).isEqualTo(Violation.Source.ADMIN_OVERRIDE);
        assertThat(report.adminId()).isEqualTo(2L);
        assertThat(report.verdict().categories()).containsEntry("admin_action", true);
        assertThat(report.verdict().summary()).isEqualTo("Admin action: repeated spam");
    }

    @Test
    @DisplayName("strike message counts down to the suspension")
    void strikeMessage() {
        String one = EnforcementMessages.forAction(Violation.ActionTaken.STRIKE_ADDED, 1, 0, null, 3);
        String two = EnforcementMessages.forAction(Violation.ActionTaken.STRIKE_ADDED, 2, 0, null, 3);

        assertThat(one).contains("1 strike.").contains("2 more");
        assertThat(two).contains("2 strikes.").contains("1 more");
    }

    @Test
    @DisplayName("suspension message carries the end date and the suspension number")
    void suspensionMessage() {
        String msg = EnforcementMessages.forAction(Violation.ActionTaken.SUSPENDED, 0, 2,
                LocalDateTime.of(2026, 3, 8, 9, 30), 3);

        assertThat(msg).contains("2026-03-08 09:30 UTC").contains("suspension #2");
    }

    @Test
    @DisplayName("ban message mentions the permanent ban")
    void banMessage() {
        assertThat(EnforcementMessages.forAction(Violation.ActionTaken.BANNED, 0, 3, null, 3))
                .contains("permanently banned");
    }
}
