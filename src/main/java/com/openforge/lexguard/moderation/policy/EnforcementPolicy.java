package com.openforge.lexguard.moderation.policy;

import com.openforge.lexguard.moderation.ModerationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * The strike → suspension → ban ladder, as a pure function of the current
 * account state and the time of the violation.
 *
 * Ladder (defaults):
 *
 *   strike 1, strike 2            → STRIKE_ADDED
 *   strike 3                      → SUSPENDED for 7 days, strikes reset to 0
 *   strike 3 of the 3rd round     → BANNED, strikes reset to 0
 *
 * Strikes never accumulate past the threshold: the counter resets to 0 at
 * the very violation that triggers the escalation. No method here performs
 * I/O or throws; validating inputs is the caller's job.
 */
@Component
public class EnforcementPolicy {

    private final int      strikesForSuspension;
    private final int      suspensionsForBan;
    private final Duration suspensionDuration;

    public EnforcementPolicy(ModerationProperties properties) {
        this.strikesForSuspension = properties.strikesForSuspension();
        this.suspensionsForBan    = properties.suspensionsForBan();
        this.suspensionDuration   = properties.suspensionDuration();
    }

    /** Next state for one automatic (or admin-applied) strike. */
    public Decision decide(AccountState current, LocalDateTime now) {
        int newStrikes = current.strikeCount() + 1;

        if (newStrikes < strikesForSuspension) {
            return new Decision(EnforcementAction.STRIKE_ADDED,
                    newStrikes, current.suspensionCount(), newStrikes, null, now);
        }

        int newSuspensionCount = current.suspensionCount() + 1;
        if (newSuspensionCount < suspensionsForBan) {
            return new Decision(EnforcementAction.SUSPENDED,
                    0, newSuspensionCount, newStrikes, now.plus(suspensionDuration), now);
        }
        return new Decision(EnforcementAction.BANNED,
                0, newSuspensionCount, newStrikes, null, now);
    }

    /** Strike correction: decrement floored at 0. Never escalates, never touches suspensions. */
    public int strikesAfterRemoval(AccountState current) {
        return Math.max(0, current.strikeCount() - 1);
    }

    public int strikesForSuspension() {
        return strikesForSuspension;
    }

    public Duration suspensionDuration() {
        return suspensionDuration;
    }
}
