package com.openforge.lexguard.moderation.policy;

import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.moderation.ModerationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EnforcementPolicy")
class EnforcementPolicyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    private final EnforcementPolicy policy = new EnforcementPolicy(ModerationProperties.defaults());

    private static AccountState active(int strikes, int suspensions) {
        return new AccountState(1L, AccountStatus.ACTIVE, strikes, suspensions, null, null, null, null);
    }

    @Nested
    @DisplayName("strike ladder")
    class Ladder {

        @Test
        @DisplayName("first and second violations only add strikes")
        void strikesBelowThreshold() {
            Decision first = policy.decide(AccountState.fresh(1L), NOW);
            assertThat(first.action()).isEqualTo(EnforcementAction.STRIKE_ADDED);
            assertThat(first.strikeCountAfter()).isEqualTo(1);
            assertThat(first.suspensionCountAfter()).isZero();
            assertThat(first.suspensionEnd()).isNull();

            Decision second = policy.decide(active(1, 0), NOW);
            assertThat(second.action()).isEqualTo(EnforcementAction.STRIKE_ADDED);
            assertThat(second.strikeCountAfter()).isEqualTo(2);
        }

        @Test
        @DisplayName("third strike suspends for seven days and resets strikes to zero")
        void thirdStrikeSuspends() {
            Decision d = policy.decide(active(2, 0), NOW);

            assertThat(d.action()).isEqualTo(EnforcementAction.SUSPENDED);
            assertThat(d.strikeCountAfter()).isZero();
            assertThat(d.suspensionCountAfter()).isEqualTo(1);
            assertThat(d.strikesAtEscalation()).isEqualTo(3);
            assertThat(d.suspensionEnd()).isEqualTo(NOW.plusDays(7));
            assertThat(d.escalates()).isTrue();
        }

        @Test
        @DisplayName("second suspension is still temporary")
        void secondSuspensionTemporary() {
            Decision d = policy.decide(active(2, 1), NOW);

            assertThat(d.action()).isEqualTo(EnforcementAction.SUSPENDED);
            assertThat(d.suspensionCountAfter()).isEqualTo(2);
        }

        @Test
        @DisplayName("third suspension becomes a permanent ban with no end date")
        void thirdSuspensionBans() {
            Decision d = policy.decide(active(2, 2), NOW);

            assertThat(d.action()).isEqualTo(EnforcementAction.BANNED);
            assertThat(d.strikeCountAfter()).isZero();
            assertThat(d.suspensionCountAfter()).isEqualTo(3);
            assertThat(d.suspensionEnd()).isNull();
        }

        @Test
        @DisplayName("a strike never leaves the counter at or above the threshold")
        void strikeCountStaysBelowThreshold() {
            for (int strikes = 0; strikes < 3; strikes++) {
                for (int suspensions = 0; suspensions < 3; suspensions++) {
                    Decision d = policy.decide(active(strikes, suspensions), NOW);
                    assertThat(d.strikeCountAfter()).isBetween(0, 2);
                    assertThat(d.suspensionCountAfter()).isGreaterThanOrEqualTo(suspensions);
                }
            }
        }

        @Test
        @DisplayName("thresholds and duration follow configuration")
        void configurableLadder() {
            EnforcementPolicy strict = new EnforcementPolicy(new ModerationProperties(
                    2, 2, Duration.ofDays(1), Duration.ofMinutes(10), 1000, "-",
                    new ModerationProperties.StoreRetry(3, Duration.ofMillis(100))));

            assertThat(strict.decide(active(0, 0), NOW).action()).isEqualTo(EnforcementAction.STRIKE_ADDED);
            Decision suspended = strict.decide(active(1, 0), NOW);
            assertThat(suspended.action()).isEqualTo(EnforcementAction.SUSPENDED);
            assertThat(suspended.suspensionEnd()).isEqualTo(NOW.plusDays(1));
            assertThat(strict.decide(active(1, 1), NOW).action()).isEqualTo(EnforcementAction.BANNED);
        }
    }

    @Nested
    @DisplayName("strike removal")
    class Removal {

        @Test
        @DisplayName("decrements by one")
        void decrements() {
            assertThat(policy.strikesAfterRemoval(active(2, 1))).isEqualTo(1);
        }

        @Test
        @DisplayName("floors at zero")
        void floorsAtZero() {
            assertThat(policy.strikesAfterRemoval(active(0, 0))).isZero();
        }
    }

    @Test
    @DisplayName("a suspension whose end has passed is over, one still running is not")
    void suspensionOver() {
        AccountState suspended = new AccountState(1L, AccountStatus.SUSPENDED, 0, 1, NOW, NOW, null, null);

        assertThat(suspended.isSuspensionOver(NOW.minusSeconds(1))).isFalse();
        assertThat(suspended.isSuspensionOver(NOW)).isTrue();
        assertThat(active(1, 0).isSuspensionOver(NOW)).isFalse();
    }
}
