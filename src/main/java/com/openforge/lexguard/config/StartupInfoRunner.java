package com.openforge.lexguard.config;

import com.openforge.lexguard.moderation.ModerationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Logs a startup summary once the context is ready: server, database
 * reachability and the enforcement ladder in effect.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource           dataSource;
    private final ModerationProperties moderation;
    private final Environment          env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              LexGuard  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Profiles       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Enforcement ladder                                      ║
                ║    Strikes → suspension : {}
                ║    Suspensions → ban    : {}
                ║    Suspension length    : {}
                ║    Dedup window         : {}
                ║    Expiry sweep cron    : {}
                ║    Store retry          : {} attempts, {} base wait
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                String.join(",", env.getActiveProfiles()),

                probeDatabase(),

                moderation.strikesForSuspension(),
                moderation.suspensionsForBan(),
                moderation.suspensionDuration(),
                moderation.dedupWindow(),
                moderation.sweepCron(),
                moderation.storeRetry().maxAttempts(),
                moderation.storeRetry().waitDuration()
        );
    }

    /** One-line reachability report; never fails startup. */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            log.warn("[Startup] database probe failed: {}", e.getMessage());
            return "✘ FAILED — " + e.getMessage();
        }
    }
}
