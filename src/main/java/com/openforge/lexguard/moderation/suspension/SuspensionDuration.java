package com.openforge.lexguard.moderation.suspension;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.lexguard.moderation.ModerationValidationException;

import java.time.LocalDateTime;
import java.time.Period;
import java.util.Arrays;

/**
 * Suspension lengths an administrator can pick. Accepts both the enum name
 * ("ONE_WEEK") and the short code ("1_week") on the wire.
 */
public enum SuspensionDuration {

    ONE_DAY("1_day", Period.ofDays(1)),
    THREE_DAYS("3_days", Period.ofDays(3)),
    ONE_WEEK("1_week", Period.ofWeeks(1)),
    TWO_WEEKS("2_weeks", Period.ofWeeks(2)),
    ONE_MONTH("1_month", Period.ofMonths(1)),
    THREE_MONTHS("3_months", Period.ofMonths(3)),
    SIX_MONTHS("6_months", Period.ofMonths(6)),
    ONE_YEAR("1_year", Period.ofYears(1));

    public static final SuspensionDuration DEFAULT = ONE_WEEK;

    private final String code;
    private final Period period;

    SuspensionDuration(String code, Period period) {
        this.code = code;
        this.period = period;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public LocalDateTime endFrom(LocalDateTime start) {
        return start.plus(period);
    }

    @JsonCreator
    public static SuspensionDuration from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return Arrays.stream(values())
                .filter(d -> d.code.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ModerationValidationException("Unknown suspension duration: " + value));
    }
}
