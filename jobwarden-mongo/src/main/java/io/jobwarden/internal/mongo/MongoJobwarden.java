package io.jobwarden.internal.mongo;

import io.jobwarden.Jobwarden;
import io.jobwarden.config.JobwardenProperties;
import io.jobwarden.core.RunSummary;
import io.jobwarden.engine.JobRunner;
import io.jobwarden.monitor.HealthAggregator;
import io.jobwarden.monitor.HealthReport;
import io.jobwarden.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Jobwarden backed by MongoDB: a poller thread triggers an automation pass on every tick of
 * {@code jobwarden.runner.run-every}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * jobwarden.start();
 * RunSummary summary = jobwarden.runNow();
 * HealthReport health = jobwarden.checkHealth();
 * jobwarden.stop();
 * }</pre>
 *
 * <p>Passes are serialized: a manual {@link #runNow()} waits for a running scheduled pass.
 */
public class MongoJobwarden implements Jobwarden {
    private static final Logger log = LoggerFactory.getLogger(MongoJobwarden.class);

    private static final int MAX_SYSTEM_FAILURES = 30;

    private final JobwardenProperties props;
    private final JobRunner runner;
    private final HealthAggregator healthAggregator;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ReentrantLock passLock = new ReentrantLock();

    private Thread pollerThread;
    private int systemErrorCount = 0;

    private final String workerId;

    public MongoJobwarden(JobwardenProperties props, JobRunner runner, HealthAggregator healthAggregator) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.healthAggregator = Objects.requireNonNull(healthAggregator, "healthAggregator must not be null");
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start the poller. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        String runEvery = Objects.requireNonNull(props.getRunner().getRunEvery(), "jobwarden.runner.runEvery must not be null");
        try {
            IntervalParser.parseDuration(runEvery, zoneId(), nowInstant());
        } catch (IllegalArgumentException e) {
            started.set(false);
            throw new IllegalArgumentException("jobwarden.runner.runEvery is invalid: " + e.getMessage(), e);
        }

        log.info("Jobwarden starting with runEvery={}, cooldown={}, zone={}, workerId={}",
                runEvery,
                props.getRunner().getCooldown(),
                zoneId(),
                workerId);

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("jobwarden.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Jobwarden started successfully.");
    }

    /**
     * Stop the poller; a pass in progress completes. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Jobwarden stopping...");
        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        log.info("Jobwarden stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    @Override
    public RunSummary runNow() {
        passLock.lock();
        try {
            return runner.runPass(nowInstant(), props.getRunner().getActorId());
        } finally {
            passLock.unlock();
        }
    }

    @Override
    public HealthReport checkHealth() {
        return healthAggregator.check(nowInstant());
    }

    /**
     * Current time source (overridable in tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private String zoneId() {
        return props.getRunner().resolveZone().getId();
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "jobwarden";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (java.io.IOException e) {
            log.debug("jobwarden cannot resolve host name msg={}", e.getMessage());
        }
        return host + "-" + ProcessHandle.current().pid();
    }

    private void pollerLoop() {
        Instant previousTick = null;
        while (started.get()) {
            Instant tick = IntervalParser.computeNextRunAt(
                    props.getRunner().getRunEvery(),
                    zoneId(),
                    previousTick,
                    nowInstant()
            );
            try {
                sleepUntil(tick);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!started.get()) {
                break;
            }
            previousTick = tick;

            try {
                RunSummary summary = runNow();
                systemErrorCount = 0;
                log.debug("Jobwarden pass completed workerId={} summary={}", workerId, summary);
            } catch (Exception e) {
                systemErrorCount++;
                log.error("jobwarden pass failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_FAILURES) {
                    log.error("Jobwarden stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private void sleepUntil(Instant tick) throws InterruptedException {
        long ms = Duration.between(nowInstant(), tick).toMillis();
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }

    // Exponential backoff for repeated pass failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
