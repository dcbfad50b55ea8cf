package io.jobwarden.monitor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of system usage figures returned by the monitoring status endpoint.
 *
 * @param agents        active users holding the agent role
 * @param lastLogin     most recent login over all users, if any
 * @param counts        record count per collection
 * @param lastCreatedAt newest creation time per collection; collections without records are absent
 * @param storageBytes  on-disk size of the database, or null where the store cannot report it
 */
public record SystemStatus(
        long agents,
        Instant lastLogin,
        Map<String, Long> counts,
        Map<String, Instant> lastCreatedAt,
        Long storageBytes
) {
    public SystemStatus {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
        lastCreatedAt = lastCreatedAt == null ? Map.of() : Map.copyOf(lastCreatedAt);
    }
}
