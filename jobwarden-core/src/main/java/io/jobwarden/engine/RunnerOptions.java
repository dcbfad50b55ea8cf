package io.jobwarden.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * @param cooldown minimum time since both the last run and the last edit of a job before it may run again
 */
public record RunnerOptions(Duration cooldown) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(10);

    public RunnerOptions {
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public static RunnerOptions defaults() {
        return new RunnerOptions(DEFAULT_COOLDOWN);
    }
}
