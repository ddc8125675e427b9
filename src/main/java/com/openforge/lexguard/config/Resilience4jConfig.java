package com.openforge.lexguard.config;

import com.openforge.lexguard.moderation.ModerationProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for the moderation store.
 *
 * One named instance, "moderationStore", guards every transactional unit of
 * work (see ModerationTransactions):
 *   • Retry:          re-runs the whole transaction on lock contention or a
 *                      transient store failure, with exponential back-off
 *   • CircuitBreaker: stops hammering a store that keeps failing, so callers
 *                      get StoreUnavailable immediately instead of piling up
 *
 * Domain exceptions (NotFound / Conflict / Validation) are never retried and
 * never count as failures.
 */
@Configuration
public class Resilience4jConfig {

    public static final String MODERATION_STORE = "moderationStore";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(15))
                // only store-level failures count
                .recordExceptions(
                        DataAccessResourceFailureException.class,
                        TransientDataAccessException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(MODERATION_STORE);
        return registry;
    }

    @Bean
    public CircuitBreaker moderationStoreCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(MODERATION_STORE);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(ModerationProperties properties) {
        ModerationProperties.StoreRetry retry = properties.storeRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.maxAttempts())
                // exponential back-off: wait → 2×wait → 4×wait …
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retry.waitDuration(), 2.0))
                // optimistic / pessimistic lock failures and deadlocks land here
                .retryExceptions(
                        ConcurrencyFailureException.class,
                        TransientDataAccessException.class,
                        DataAccessResourceFailureException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(MODERATION_STORE);
        return registry;
    }

    @Bean
    public Retry moderationStoreRetry(RetryRegistry registry) {
        return registry.retry(MODERATION_STORE);
    }
}
