package io.jobwarden.monitor;

import io.jobwarden.utils.IntervalParser;

import java.time.Duration;
import java.util.Objects;

/**
 * Trailing window and optional thresholds for {@link AmountChecker}.
 *
 * @param period      trailing window length
 * @param periodLabel how the window is named in messages, e.g. {@code "1h"}
 */
public record AmountCheckRequest(
        Duration period,
        String periodLabel,
        Long minWarning,
        Long minCritical,
        Long maxWarning,
        Long maxCritical
) {
    public AmountCheckRequest {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(periodLabel, "periodLabel must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration");
        }
    }

    /**
     * Build from a compact period such as {@code "1h"}; the raw string is kept as label.
     *
     * @throws IllegalArgumentException for a missing or malformed period
     */
    public static AmountCheckRequest parse(String periode, Long minWarning, Long minCritical, Long maxWarning, Long maxCritical) {
        Duration period = IntervalParser.parsePeriod(periode);
        return new AmountCheckRequest(period, periode.trim(), minWarning, minCritical, maxWarning, maxCritical);
    }

    public static AmountCheckRequest ofSeconds(long periodSeconds, Long minWarning, Long minCritical, Long maxWarning, Long maxCritical) {
        return new AmountCheckRequest(Duration.ofSeconds(periodSeconds), periodSeconds + "s",
                minWarning, minCritical, maxWarning, maxCritical);
    }
}
