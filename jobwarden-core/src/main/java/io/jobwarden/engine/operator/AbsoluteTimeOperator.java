package io.jobwarden.engine.operator;

import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.JobConfigurationException;
import io.jobwarden.utils.Values;

import java.time.Instant;

/**
 * {@code before (absolute)} / {@code after (absolute)} against an ISO-8601 instant or date operand.
 */
public final class AbsoluteTimeOperator implements ConditionOperator {

    private final boolean before;

    private AbsoluteTimeOperator(boolean before) {
        this.before = before;
    }

    public static AbsoluteTimeOperator before() {
        return new AbsoluteTimeOperator(true);
    }

    public static AbsoluteTimeOperator after() {
        return new AbsoluteTimeOperator(false);
    }

    @Override
    public String name() {
        return before ? "before (absolute)" : "after (absolute)";
    }

    @Override
    public boolean matches(Object attributeValue, ConditionPredicate predicate, Instant now) {
        Instant pivot;
        try {
            pivot = Values.asInstant(predicate.value());
        } catch (IllegalArgumentException ex) {
            throw new JobConfigurationException("'" + name() + "' on " + predicate.path() + ": " + ex.getMessage(), ex);
        }
        if (pivot == null) {
            throw new JobConfigurationException("'" + name() + "' on " + predicate.path() + " needs a value");
        }
        Instant t = Values.asInstant(attributeValue);
        if (t == null) {
            return false;
        }
        return before ? t.isBefore(pivot) : t.isAfter(pivot);
    }
}
