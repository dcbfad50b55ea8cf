package io.jobwarden.monitor;

import java.time.Instant;
import java.util.Objects;

/**
 * Classifies how many records were created in a trailing window.
 *
 * <p>Precedence: min critical, min warning, max critical, max warning. Unset thresholds are skipped.
 * Both message shapes quote the actual count.
 */
public class AmountChecker {

    private final CreatedRecordCounter counter;

    public AmountChecker(CreatedRecordCounter counter) {
        this.counter = Objects.requireNonNull(counter, "counter must not be null");
    }

    public AmountCheckResult check(AmountCheckRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        long count = counter.countCreatedBetween(now.minus(request.period()), now);
        return classify(count, request);
    }

    static AmountCheckResult classify(long count, AmountCheckRequest r) {
        String period = r.periodLabel();

        if (r.minCritical() != null && count < r.minCritical()) {
            return new AmountCheckResult(AmountState.CRITICAL, undercut(r.minCritical(), count, period), count);
        }
        if (r.minWarning() != null && count < r.minWarning()) {
            return new AmountCheckResult(AmountState.WARNING, undercut(r.minWarning(), count, period), count);
        }
        if (r.maxCritical() != null && count > r.maxCritical()) {
            return new AmountCheckResult(AmountState.CRITICAL, exceeded(r.maxCritical(), count, period), count);
        }
        if (r.maxWarning() != null && count > r.maxWarning()) {
            return new AmountCheckResult(AmountState.WARNING, exceeded(r.maxWarning(), count, period), count);
        }
        return new AmountCheckResult(AmountState.OK, "", count);
    }

    private static String undercut(long min, long count, String period) {
        return "The minimum of " + min + " was undercut by " + count + " in the last " + period;
    }

    private static String exceeded(long max, long count, String period) {
        return "The limit of " + max + " was exceeded with " + count + " in the last " + period;
    }
}
