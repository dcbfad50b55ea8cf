package io.jobwarden.core;

import java.util.Objects;

/**
 * Dotted attribute path split into entity and field, e.g. {@code ticket.state_id}.
 * The field part may itself be dotted for nested values.
 */
public record AttributePath(String entity, String field) {

    public AttributePath {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(field, "field must not be null");
    }

    public static AttributePath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new JobConfigurationException("attribute path must not be blank");
        }
        int dot = path.indexOf('.');
        if (dot <= 0 || dot == path.length() - 1) {
            throw new JobConfigurationException("attribute path must look like 'entity.field': " + path);
        }
        return new AttributePath(path.substring(0, dot), path.substring(dot + 1));
    }

    @Override
    public String toString() {
        return entity + "." + field;
    }
}
