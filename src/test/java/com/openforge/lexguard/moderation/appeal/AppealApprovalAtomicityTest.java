package com.openforge.lexguard.moderation.appeal;

import com.openforge.lexguard.domain.Appeal;
import com.openforge.lexguard.domain.Appeal.AppealStatus;
import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.support.ModerationIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

/**
 * A failure between the suspension write and the account write must leave
 * all three rows exactly as they were.
 */
@DisplayName("Appeal approval is all-or-nothing")
class AppealApprovalAtomicityTest extends ModerationIntegrationSupport {

    @SpyBean
    private AccountStatusStore accountSpy;

    @Autowired
    private AppealWorkflow appeals;

    @Test
    @DisplayName("a crash after lifting the suspension rolls the lift back")
    void crashMidApproval() {
        Long userId = testAccounts.user();
        Long adminId = testAccounts.admin();
        flag(userId);
        flag(userId);
        Suspension suspension = flag(userId).suspension();
        Appeal appeal = appeals.submit(userId, suspension.getId(), "please reconsider", null);

        doThrow(new IllegalStateException("simulated crash"))
                .when(accountSpy).liftSuspension(eq(userId), any(), anyString());

        assertThatThrownBy(() -> appeals.resolve(appeal.getId(), adminId, AppealOutcome.APPROVED, null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("simulated crash");

        assertThat(ledger.get(suspension.getId()).getStatus()).isEqualTo(SuspensionStatus.ACTIVE);
        assertThat(accounts.getStatus(userId).status()).isEqualTo(AccountStatus.SUSPENDED);
        assertThat(appeals.get(appeal.getId()).getStatus()).isEqualTo(AppealStatus.PENDING);
        assertThat(appeals.get(appeal.getId()).getReviewedAt()).isNull();
    }
}
