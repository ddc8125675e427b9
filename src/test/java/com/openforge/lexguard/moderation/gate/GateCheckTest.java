package com.openforge.lexguard.moderation.gate;

import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.AccountNotFoundException;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GateCheck Unit Tests")
class GateCheckTest {

    private static final Instant NOW_INSTANT = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private AccountStatusStore accounts;

    @Mock
    private SuspensionLedger ledger;

    private GateCheck gateCheck;

    @BeforeEach
    void setUp() {
        gateCheck = new GateCheck(accounts, ledger, Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
    }

    private static AccountState state(AccountStatus status, LocalDateTime suspensionEnd) {
        return new AccountState(7L, status, 0, 1, suspensionEnd, null, null, null);
    }

    @Test
    @DisplayName("active account may post")
    void activeAllowed() {
        when(accounts.getStatus(7L)).thenReturn(state(AccountStatus.ACTIVE, null));

        GateResult result = gateCheck.checkCanPost(7L);

        assertThat(result.allowed()).isTrue();
        assertThat(result.restriction()).isEqualTo(GateResult.Restriction.NONE);
        verify(ledger, never()).settleOverdue(7L);
    }

    @Test
    @DisplayName("running suspension blocks with TEMPORARY and the end time")
    void liveSuspensionBlocked() {
        LocalDateTime end = NOW.plusDays(3);
        when(accounts.getStatus(7L)).thenReturn(state(AccountStatus.SUSPENDED, end));

        GateResult result = gateCheck.checkCanPost(7L);

        assertThat(result.allowed()).isFalse();
        assertThat(result.restriction()).isEqualTo(GateResult.Restriction.TEMPORARY);
        assertThat(result.suspensionEnd()).isEqualTo(end);
        assertThat(result.message()).contains("suspended until");
        verify(ledger, never()).settleOverdue(7L);
    }

    @Test
    @DisplayName("banned account is blocked permanently")
    void bannedBlocked() {
        when(accounts.getStatus(7L)).thenReturn(state(AccountStatus.BANNED, null));

        GateResult result = gateCheck.checkCanPost(7L);

        assertThat(result.allowed()).isFalse();
        assertThat(result.restriction()).isEqualTo(GateResult.Restriction.PERMANENT);
        assertThat(result.suspensionEnd()).isNull();
    }

    @Test
    @DisplayName("suspension past its end is expired on the spot and the post is allowed")
    void overdueSuspensionSettled() {
        when(accounts.getStatus(7L)).thenReturn(state(AccountStatus.SUSPENDED, NOW.minusMinutes(1)));
        when(ledger.settleOverdue(7L)).thenReturn(state(AccountStatus.ACTIVE, null));

        GateResult result = gateCheck.checkCanPost(7L);

        assertThat(result.allowed()).isTrue();
        verify(ledger).settleOverdue(7L);
    }

    @Test
    @DisplayName("unknown account surfaces AccountNotFound")
    void unknownAccount() {
        when(accounts.getStatus(99L)).thenThrow(new AccountNotFoundException(99L));

        assertThatThrownBy(() -> gateCheck.checkCanPost(99L)).isInstanceOf(AccountNotFoundException.class);
    }
}
