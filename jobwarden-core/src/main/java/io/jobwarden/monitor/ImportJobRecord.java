package io.jobwarden.monitor;

import java.time.Duration;
import java.time.Instant;

/**
 * One run of an import backend (e.g. {@code Import::Ldap}).
 */
public record ImportJobRecord(
        String id,
        String name,
        boolean dryRun,
        Instant startedAt,
        Instant finishedAt,
        Instant updatedAt,
        String error
) {

    public boolean failed() {
        return finishedAt != null && error != null && !error.isBlank();
    }

    /**
     * Unfinished and not updated for at least {@code threshold}.
     */
    public boolean stuck(Instant now, Duration threshold) {
        return finishedAt == null && updatedAt != null && !updatedAt.isAfter(now.minus(threshold));
    }
}
