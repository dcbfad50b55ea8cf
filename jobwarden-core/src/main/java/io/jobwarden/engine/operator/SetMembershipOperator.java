package io.jobwarden.engine.operator;

import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.utils.Values;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * {@code is} / {@code is not}: attribute value (or any element of a multi-valued attribute)
 * in the operand set.
 *
 * <p>An empty operand (null, blank string, empty list) does not filter: every record matches.
 */
public final class SetMembershipOperator implements ConditionOperator {

    public static final String IS = "is";
    public static final String IS_NOT = "is not";

    private final String name;
    private final boolean negate;

    private SetMembershipOperator(String name, boolean negate) {
        this.name = name;
        this.negate = negate;
    }

    public static SetMembershipOperator is() {
        return new SetMembershipOperator(IS, false);
    }

    public static SetMembershipOperator isNot() {
        return new SetMembershipOperator(IS_NOT, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean matches(Object attributeValue, ConditionPredicate predicate, Instant now) {
        List<String> wanted = Values.asTextList(predicate.value());
        if (wanted.isEmpty()) {
            return true;
        }

        boolean contained;
        if (attributeValue instanceof Collection<?>) {
            contained = Values.asTextList(attributeValue).stream().anyMatch(wanted::contains);
        } else {
            String current = Values.asText(attributeValue);
            contained = current != null && wanted.contains(current);
        }
        return negate != contained;
    }
}
