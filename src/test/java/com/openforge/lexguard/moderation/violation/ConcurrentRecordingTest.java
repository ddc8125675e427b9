package com.openforge.lexguard.moderation.violation;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.InvalidTransitionException;
import com.openforge.lexguard.moderation.policy.AccountState;
import com.openforge.lexguard.repository.ViolationRepository;
import com.openforge.lexguard.support.ModerationIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Concurrent reports for one account")
class ConcurrentRecordingTest extends ModerationIntegrationSupport {

    private static final int THREADS = 6;

    @Autowired
    private ViolationRepository violationRepository;

    @Test
    @DisplayName("racing reports open exactly one suspension")
    void singleActiveSuspension() throws Exception {
        Long userId = testAccounts.user();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        List<Future<RecordOutcome>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < THREADS; i++) {
                String contentId = "race-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return flag(userId, contentId);
                }));
            }
            start.countDown();

            int recorded = 0;
            int rejected = 0;
            for (Future<RecordOutcome> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    recorded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InvalidTransitionException.class);
                    rejected++;
                }
            }
            assertThat(recorded).isEqualTo(3);
            assertThat(rejected).isEqualTo(THREADS - 3);
        } finally {
            pool.shutdownNow();
        }

        List<Suspension> history = ledger.listForUser(userId);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getStatus()).isEqualTo(SuspensionStatus.ACTIVE);
        assertThat(history.get(0).getViolationIds()).hasSize(3);

        AccountState account = accounts.getStatus(userId);
        assertThat(account.status()).isEqualTo(AccountStatus.SUSPENDED);
        assertThat(account.strikeCount()).isZero();
        assertThat(account.suspensionCount()).isEqualTo(1);
        assertThat(violationRepository.findByUserIdOrderByIdAsc(userId)).hasSize(3);
    }
}
