package com.openforge.lexguard.moderation.suspension;

import com.openforge.lexguard.moderation.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background expiry of suspensions whose window has passed.
 * Cron comes from lexguard.moderation.sweep-cron; "-" disables it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuspensionExpirySweeper {

    private final SuspensionLedger ledger;

    @Scheduled(cron = "${lexguard.moderation.sweep-cron:0 * * * * *}")
    public void sweep() {
        try {
            int expired = ledger.expireDue();
            if (expired > 0) {
                log.info("[Sweeper] expired {} suspension(s)", expired);
            }
        } catch (StoreUnavailableException e) {
            log.warn("[Sweeper] moderation store unavailable, retrying on next run: {}", e.getMessage());
        }
    }
}
