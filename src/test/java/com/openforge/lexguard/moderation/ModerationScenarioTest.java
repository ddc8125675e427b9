package com.openforge.lexguard.moderation;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.domain.Violation.ActionTaken;
import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.moderation.admin.AdminOverrideGateway;
import com.openforge.lexguard.moderation.appeal.AppealWorkflow;
import com.openforge.lexguard.moderation.gate.GateCheck;
import com.openforge.lexguard.moderation.gate.GateResult;
import com.openforge.lexguard.moderation.violation.RecordOutcome;
import com.openforge.lexguard.repository.ViolationRepository;
import com.openforge.lexguard.support.ModerationIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/** User-visible journeys across the whole engine. */
@DisplayName("Moderation journeys")
class ModerationScenarioTest extends ModerationIntegrationSupport {

    @Autowired private GateCheck            gate;
    @Autowired private AdminOverrideGateway gateway;
    @Autowired private AppealWorkflow       appeals;
    @Autowired private ViolationRepository  violationRepository;

    @Test
    @DisplayName("three flagged posts suspend for a week, and the account heals itself afterwards")
    void suspendedThenSelfHealed() {
        Long userId = testAccounts.user();
        flag(userId);
        flag(userId);
        RecordOutcome third = flag(userId);

        assertThat(third.actionTaken()).isEqualTo(ActionTaken.SUSPENDED);
        assertThat(third.account().suspensionEnd())
                .isCloseTo(LocalDateTime.now(clock).plusDays(7), within(1, ChronoUnit.MINUTES));

        GateResult blocked = gate.checkCanPost(userId);
        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.restriction()).isEqualTo(GateResult.Restriction.TEMPORARY);

        clock.advance(Duration.ofDays(8));

        GateResult healed = gate.checkCanPost(userId);
        assertThat(healed.allowed()).isTrue();
        assertThat(ledger.get(third.suspension().getId()).getStatus()).isEqualTo(SuspensionStatus.EXPIRED);
        assertThat(accounts.getStatus(userId).status()).isEqualTo(AccountStatus.ACTIVE);
    }

    @Test
    @DisplayName("a manual ban blocks the account and leaves an admin violation behind")
    void manualBan() {
        Long userId = testAccounts.user();
        Long adminId = testAccounts.admin();

        gateway.forcePermanentBan(adminId, userId, "manual report", null, null);

        assertThat(accounts.getStatus(userId).status()).isEqualTo(AccountStatus.BANNED);
        assertThat(violationRepository.findByUserIdOrderByIdAsc(userId))
                .anySatisfy(v -> assertThat(v.getViolationType()).isEqualTo(ViolationType.ADMIN_ACTION));
        assertThat(gate.checkCanPost(userId).restriction()).isEqualTo(GateResult.Restriction.PERMANENT);
    }

    @Test
    @DisplayName("a suspension can only be appealed once")
    void secondAppealRejected() {
        Long userId = testAccounts.user();
        flag(userId);
        flag(userId);
        Suspension suspension = flag(userId).suspension();

        appeals.submit(userId, suspension.getId(), "It was a joke between friends", null);

        assertThatThrownBy(() -> appeals.submit(userId, suspension.getId(), "Please", null))
                .isInstanceOf(DuplicateAppealException.class);
    }
}
