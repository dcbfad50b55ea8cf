package io.jobwarden.engine.operator;

import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.JobConfigurationException;
import io.jobwarden.utils.Values;

import java.time.Duration;
import java.time.Instant;

/**
 * Relative date predicates; the offset is {@code value * range} from the evaluation time.
 *
 * <ul>
 *   <li>{@code before (relative)}: t &lt; now - offset</li>
 *   <li>{@code after (relative)}: t &gt; now + offset</li>
 *   <li>{@code within last (relative)}: now - offset &lt;= t &lt;= now</li>
 *   <li>{@code within next (relative)}: now &lt;= t &lt;= now + offset</li>
 * </ul>
 * A record without a timestamp never matches.
 */
public final class RelativeTimeOperator implements ConditionOperator {

    public enum Mode {
        BEFORE("before (relative)"),
        AFTER("after (relative)"),
        WITHIN_LAST("within last (relative)"),
        WITHIN_NEXT("within next (relative)");

        private final String operatorName;

        Mode(String operatorName) {
            this.operatorName = operatorName;
        }
    }

    // keeps now +/- offset inside the Instant range
    private static final Duration MAX_OFFSET = Duration.ofDays(365L * 10_000);

    private final Mode mode;

    public RelativeTimeOperator(Mode mode) {
        this.mode = mode;
    }

    @Override
    public String name() {
        return mode.operatorName;
    }

    @Override
    public boolean matches(Object attributeValue, ConditionPredicate predicate, Instant now) {
        Duration offset = offset(predicate);
        Instant t = Values.asInstant(attributeValue);
        if (t == null) {
            return false;
        }
        return switch (mode) {
            case BEFORE -> t.isBefore(now.minus(offset));
            case AFTER -> t.isAfter(now.plus(offset));
            case WITHIN_LAST -> !t.isBefore(now.minus(offset)) && !t.isAfter(now);
            case WITHIN_NEXT -> !t.isBefore(now) && !t.isAfter(now.plus(offset));
        };
    }

    private Duration offset(ConditionPredicate predicate) {
        String raw = Values.asText(predicate.value());
        long amount;
        try {
            amount = Long.parseLong(raw == null ? "" : raw.trim());
        } catch (NumberFormatException ex) {
            throw new JobConfigurationException(
                    "'" + name() + "' on " + predicate.path() + " needs an integer value, got: " + raw);
        }
        if (amount < 0) {
            throw new JobConfigurationException(
                    "'" + name() + "' on " + predicate.path() + " needs a non-negative value, got: " + raw);
        }
        Duration offset = RelativeRange.of(predicate.range()).times(amount);
        if (offset.compareTo(MAX_OFFSET) > 0) {
            throw new JobConfigurationException(
                    "'" + name() + "' on " + predicate.path() + " reaches too far: " + raw + " " + predicate.range());
        }
        return offset;
    }
}
