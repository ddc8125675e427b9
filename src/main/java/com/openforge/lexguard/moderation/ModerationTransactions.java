package com.openforge.lexguard.moderation;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * The one transactional boundary of the enforcement engine.
 *
 * Call graph:
 *
 *   execute(operation, work)
 *     └─ moderationStore circuit breaker
 *           └─ moderationStore retry
 *                 └─ TransactionTemplate.execute(work)
 *
 * Every multi-entity write (violation + account + ledger, appeal + ledger +
 * account) runs inside one call, so either all rows commit or none do. The
 * retry re-runs the whole transaction, never half of it.
 *
 * Re-entrant calls (a component invoked from inside another component's unit
 * of work) join the running transaction and do not retry on their own; the
 * outermost call owns the retry.
 */
@Slf4j
@Component
public class ModerationTransactions {

    private final TransactionTemplate transactionTemplate;
    private final CircuitBreaker      circuitBreaker;
    private final Retry               retry;

    public ModerationTransactions(TransactionTemplate moderationTransactionTemplate,
                                  CircuitBreaker moderationStoreCircuitBreaker,
                                  Retry moderationStoreRetry) {
        this.transactionTemplate = moderationTransactionTemplate;
        this.circuitBreaker      = moderationStoreCircuitBreaker;
        this.retry               = moderationStoreRetry;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        Supplier<T> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, () -> transactionTemplate.execute(status -> work.get())));
        try {
            return decorated.get();
        } catch (ModerationException e) {
            throw e;
        } catch (CallNotPermittedException e) {
            log.warn("[Tx] {} rejected, moderation store circuit is OPEN", operation);
            throw new StoreUnavailableException(operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("[Tx] {} failed after retries: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
