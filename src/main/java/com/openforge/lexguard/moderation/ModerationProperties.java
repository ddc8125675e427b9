package com.openforge.lexguard.moderation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised enforcement-ladder configuration.
 *
 * Reads from application.yml under the "lexguard.moderation" prefix:
 *
 * lexguard:
 *   moderation:
 *     strikes-for-suspension: 3
 *     suspensions-for-ban: 3
 *     suspension-duration: 7d
 *     dedup-window: 10m
 *     content-snapshot-limit: 1000
 *     sweep-cron: "0 * * * * *"
 *     store-retry:
 *       max-attempts: 3
 *       wait-duration: 100ms
 */
@ConfigurationProperties(prefix = "lexguard.moderation")
public record ModerationProperties(
        @DefaultValue("3")     int      strikesForSuspension,
        @DefaultValue("3")     int      suspensionsForBan,
        @DefaultValue("7d")    Duration suspensionDuration,
        @DefaultValue("10m")   Duration dedupWindow,
        @DefaultValue("1000")  int      contentSnapshotLimit,
        @DefaultValue("0 * * * * *") String sweepCron,
        @DefaultValue          StoreRetry storeRetry
) {

    public record StoreRetry(
            @DefaultValue("3")     int      maxAttempts,
            @DefaultValue("100ms") Duration waitDuration
    ) {}

    /** Ladder constants used when no Spring context is around (unit tests, tooling). */
    public static ModerationProperties defaults() {
        return new ModerationProperties(3, 3, Duration.ofDays(7), Duration.ofMinutes(10), 1000,
                "0 * * * * *", new StoreRetry(3, Duration.ofMillis(100)));
    }
}
