package io.jobwarden.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Who changes a record, when, and on behalf of which job.
 */
public record ChangeContext(
        String actorId,
        Instant at,
        boolean disableNotification,
        String jobName
) {
    public ChangeContext {
        Objects.requireNonNull(actorId, "actorId must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }

    public static ChangeContext forJob(AutomationJob job, String actorId, Instant at) {
        return new ChangeContext(actorId, at, job.disableNotification(), job.name());
    }
}
