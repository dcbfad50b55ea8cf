package io.jobwarden.core;

import java.util.Objects;

/**
 * Attribute assignment applied to every record a job matches.
 */
public record PerformAction(String path, Object value) {

    public PerformAction {
        Objects.requireNonNull(path, "path must not be null");
    }
}
