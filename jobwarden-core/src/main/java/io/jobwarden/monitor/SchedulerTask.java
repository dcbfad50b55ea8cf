package io.jobwarden.monitor;

import java.time.Duration;
import java.time.Instant;

/**
 * A periodic task whose {@code lastRun} is expected to advance at least every {@code period}.
 */
public record SchedulerTask(String method, boolean active, Duration period, Instant lastRun) {
}
