package io.jobwarden.core;

import java.util.Objects;

/**
 * One entry of a job condition: {@code path -> {operator, value, range}}.
 *
 * @param path     dotted attribute path
 * @param operator operator name, e.g. {@code "is"} or {@code "before (relative)"}
 * @param value    raw operand: a string, a list of strings, or null
 * @param range    unit for relative operators ({@code minute}, {@code hour}, {@code day}...); may be null
 */
public record ConditionPredicate(String path, String operator, Object value, String range) {

    public ConditionPredicate {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static ConditionPredicate of(String path, String operator, Object value) {
        return new ConditionPredicate(path, operator, value, null);
    }
}
