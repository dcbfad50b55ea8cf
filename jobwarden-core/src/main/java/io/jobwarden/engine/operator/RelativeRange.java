package io.jobwarden.engine.operator;

import io.jobwarden.core.JobConfigurationException;

import java.time.Duration;
import java.util.Locale;

/**
 * Units accepted in the {@code range} of relative date predicates.
 */
public enum RelativeRange {
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30)),
    YEAR(Duration.ofDays(365));

    private final Duration unit;

    RelativeRange(Duration unit) {
        this.unit = unit;
    }

    /**
     * @throws JobConfigurationException when the product does not fit a {@link Duration}
     */
    public Duration times(long amount) {
        try {
            return unit.multipliedBy(amount);
        } catch (ArithmeticException ex) {
            throw new JobConfigurationException("Relative offset out of range: " + amount + " " + name().toLowerCase(Locale.ROOT), ex);
        }
    }

    public static RelativeRange of(String range) {
        if (range == null || range.isBlank()) {
            throw new JobConfigurationException("relative predicate requires a range");
        }
        try {
            return valueOf(range.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new JobConfigurationException("Unknown relative range: " + range);
        }
    }
}
