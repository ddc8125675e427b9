package com.openforge.lexguard.moderation.suspension;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.AlreadySuspendedException;
import com.openforge.lexguard.moderation.ModerationValidationException;
import com.openforge.lexguard.moderation.SuspensionNotActiveException;
import com.openforge.lexguard.moderation.SuspensionNotFoundException;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.support.ModerationIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SuspensionLedger against the database")
class SuspensionLedgerIntegrationTest extends ModerationIntegrationSupport {

    private Suspension suspend(Long userId) {
        flag(userId);
        flag(userId);
        return flag(userId).suspension();
    }

    @Test
    @DisplayName("expiring twice is a no-op the second time")
    void expireIsIdempotent() {
        Long userId = testAccounts.user();
        Suspension suspension = suspend(userId);
        clock.advance(Duration.ofDays(8));

        assertThat(ledger.expire(suspension.getId())).isTrue();
        AccountState afterFirst = accounts.getStatus(userId);

        assertThat(ledger.expire(suspension.getId())).isFalse();
        AccountState afterSecond = accounts.getStatus(userId);

        assertThat(afterFirst.status()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(afterSecond).isEqualTo(afterFirst);
        assertThat(ledger.get(suspension.getId()).getStatus()).isEqualTo(SuspensionStatus.EXPIRED);
    }

    @Test
    @DisplayName("a suspension is not expired before its end")
    void notDueYet() {
        Long userId = testAccounts.user();
        Suspension suspension = suspend(userId);
        clock.advance(Duration.ofDays(6));

        assertThat(ledger.expire(suspension.getId())).isFalse();
        assertThat(ledger.get(suspension.getId()).getStatus()).isEqualTo(SuspensionStatus.ACTIVE);
        assertThat(accounts.getStatus(userId).status()).isEqualTo(AccountStatus.SUSPENDED);
    }

    @Test
    @DisplayName("the sweep expires every due suspension and reactivates the accounts")
    void expireDueSweeps() {
        Long first = testAccounts.user();
        Long second = testAccounts.user();
        Suspension a = suspend(first);
        Suspension b = suspend(second);
        clock.advance(Duration.ofDays(7).plusSeconds(1));

        assertThat(ledger.expireDue()).isGreaterThanOrEqualTo(2);

        assertThat(ledger.get(a.getId()).getStatus()).isEqualTo(SuspensionStatus.EXPIRED);
        assertThat(ledger.get(b.getId()).getStatus()).isEqualTo(SuspensionStatus.EXPIRED);
        assertThat(accounts.getStatus(first).status()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(accounts.getStatus(second).strikeCount()).isZero();
        assertThat(accounts.getStatus(second).suspensionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("opening a second active suspension is rejected")
    void secondActiveRejected() {
        Long userId = testAccounts.user();
        Suspension existing = suspend(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        assertThatThrownBy(() -> ledger.open(userId, "again", List.of(1L), 2, 3, now, now.plusDays(1)))
                .isInstanceOf(AlreadySuspendedException.class);
        assertThat(ledger.getActive(userId)).map(Suspension::getId).contains(existing.getId());
    }

    @Test
    @DisplayName("open validates evidence and window")
    void openValidates() {
        Long userId = testAccounts.user();
        LocalDateTime now = LocalDateTime.now(clock);

        assertThatThrownBy(() -> ledger.open(userId, "r", List.of(), 1, 3, now, now.plusDays(1)))
                .isInstanceOf(ModerationValidationException.class);
        assertThatThrownBy(() -> ledger.open(userId, "r", List.of(1L), 1, 3, now, now.minusDays(1)))
                .isInstanceOf(ModerationValidationException.class);
    }

    @Test
    @DisplayName("lift closes an active suspension once")
    void liftOnce() {
        Long userId = testAccounts.user();
        Long adminId = testAccounts.admin();
        Suspension suspension = suspend(userId);

        Suspension lifted = ledger.lift(suspension.getId(), adminId, "mistake");

        assertThat(lifted.getStatus()).isEqualTo(SuspensionStatus.LIFTED);
        assertThat(lifted.getLiftedBy()).isEqualTo(adminId);
        assertThat(lifted.getLiftedReason()).isEqualTo("mistake");
        assertThat(lifted.getLiftedAt()).isNotNull();
        assertThatThrownBy(() -> ledger.lift(suspension.getId(), adminId, "again"))
                .isInstanceOf(SuspensionNotActiveException.class);
    }

    @Test
    @DisplayName("unknown suspension ids fail with SuspensionNotFound")
    void unknownSuspension() {
        assertThatThrownBy(() -> ledger.get(Long.MAX_VALUE)).isInstanceOf(SuspensionNotFoundException.class);
        assertThatThrownBy(() -> ledger.lift(Long.MAX_VALUE, 1L, "x")).isInstanceOf(SuspensionNotFoundException.class);
    }

    @Test
    @DisplayName("settleOverdue reactivates an account whose window passed")
    void settleOverdue() {
        Long userId = testAccounts.user();
        Suspension suspension = suspend(userId);
        clock.advance(Duration.ofDays(8));

        AccountState settled = ledger.settleOverdue(userId);

        assertThat(settled.status()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(settled.suspensionEnd()).isNull();
        assertThat(ledger.get(suspension.getId()).getStatus()).isEqualTo(SuspensionStatus.EXPIRED);
    }
}
