package io.jobwarden.monitor;

import java.time.Instant;

/**
 * Entry of the delayed-execution queue.
 *
 * @param typeName payload type, used to group failures
 * @param attempts failed executions so far
 */
public record BackgroundJobRecord(
        String id,
        String typeName,
        int attempts,
        String lastError,
        Instant createdAt
) {
}
