package io.jobwarden;

import io.jobwarden.core.RunSummary;
import io.jobwarden.monitor.HealthReport;

/**
 * Main entrypoint.
 *
 * <p>Once started, automation passes are triggered periodically; {@link #runNow()} triggers one
 * synchronously. Passes never overlap.
 */
public interface Jobwarden {
    void start();

    void stop();

    RunSummary runNow();

    HealthReport checkHealth();
}
