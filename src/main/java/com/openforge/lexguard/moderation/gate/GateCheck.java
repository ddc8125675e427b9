package com.openforge.lexguard.moderation.gate;

import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Pre-posting check. Read-only on the hot path; the only write is the
 * opportunistic expiry of a suspension whose window has already passed,
 * which is idempotent and safe to race with the background sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GateCheck {

    private final AccountStatusStore accounts;
    private final SuspensionLedger   ledger;
    private final Clock              clock;

    public GateResult checkCanPost(Long userId) {
        AccountState state = accounts.getStatus(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (state.isSuspensionOver(now)) {
            log.debug("[Gate] user={} suspension window over, settling", userId);
            state = ledger.settleOverdue(userId);
        }

        if (state.isBanned()) {
            log.debug("[Gate] user={} blocked: banned", userId);
            return GateResult.banned();
        }
        if (state.isSuspended()) {
            log.debug("[Gate] user={} blocked until {}", userId, state.suspensionEnd());
            return GateResult.suspendedUntil(state.suspensionEnd());
        }
        return GateResult.allow();
    }
}
