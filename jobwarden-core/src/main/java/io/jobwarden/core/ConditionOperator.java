package io.jobwarden.core;

import java.time.Instant;

/**
 * A named predicate over one attribute value.
 */
public interface ConditionOperator {

    String name();

    /**
     * @param attributeValue current value of the predicate's path on the candidate record
     * @param predicate      the configured predicate (operand and range)
     * @param now            evaluation time for relative operators
     * @throws JobConfigurationException when the predicate's operand cannot be interpreted
     */
    boolean matches(Object attributeValue, ConditionPredicate predicate, Instant now);
}
