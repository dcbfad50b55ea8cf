package io.jobwarden.monitor;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds used by {@link HealthAggregator}. Defaults reproduce the observed behavior of the
 * system being monitored; all of them are overridable.
 */
public final class HealthCheckOptions {

    private final long backlogCeiling;
    private final Duration backlogMinAge;
    private final int retryCeiling;
    private final int failedJobSampleSize;
    private final int failedJobDetailLimit;
    private final long failingJobsSummaryThreshold;
    private final Duration schedulerGrace;
    private final Duration schedulerMinPeriod;
    private final Duration channelFetchTolerance;
    private final Duration stuckImportThreshold;
    private final Duration importFailureWindow;
    private final Map<String, Boolean> importBackends;
    private final ZoneId zone;

    private HealthCheckOptions(Builder b) {
        this.backlogCeiling = b.backlogCeiling;
        this.backlogMinAge = Objects.requireNonNull(b.backlogMinAge, "backlogMinAge must not be null");
        this.retryCeiling = b.retryCeiling;
        this.failedJobSampleSize = b.failedJobSampleSize;
        this.failedJobDetailLimit = b.failedJobDetailLimit;
        this.failingJobsSummaryThreshold = b.failingJobsSummaryThreshold;
        this.schedulerGrace = Objects.requireNonNull(b.schedulerGrace, "schedulerGrace must not be null");
        this.schedulerMinPeriod = Objects.requireNonNull(b.schedulerMinPeriod, "schedulerMinPeriod must not be null");
        this.channelFetchTolerance = Objects.requireNonNull(b.channelFetchTolerance, "channelFetchTolerance must not be null");
        this.stuckImportThreshold = Objects.requireNonNull(b.stuckImportThreshold, "stuckImportThreshold must not be null");
        this.importFailureWindow = b.importFailureWindow;
        this.importBackends = Collections.unmodifiableMap(new LinkedHashMap<>(b.importBackends));
        this.zone = Objects.requireNonNull(b.zone, "zone must not be null");
        if (failedJobSampleSize <= 0 || failedJobDetailLimit <= 0) {
            throw new IllegalArgumentException("failedJobSampleSize and failedJobDetailLimit must be positive");
        }
    }

    public static HealthCheckOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long backlogCeiling() {
        return backlogCeiling;
    }

    /**
     * Queue entries younger than this are not counted as backlog.
     */
    public Duration backlogMinAge() {
        return backlogMinAge;
    }

    /**
     * An entry with more attempts than this is failing.
     */
    public int retryCeiling() {
        return retryCeiling;
    }

    public int failedJobSampleSize() {
        return failedJobSampleSize;
    }

    public int failedJobDetailLimit() {
        return failedJobDetailLimit;
    }

    public long failingJobsSummaryThreshold() {
        return failingJobsSummaryThreshold;
    }

    public Duration schedulerGrace() {
        return schedulerGrace;
    }

    /**
     * Tasks with a period up to this value are not checked for staleness.
     */
    public Duration schedulerMinPeriod() {
        return schedulerMinPeriod;
    }

    public Duration channelFetchTolerance() {
        return channelFetchTolerance;
    }

    public Duration stuckImportThreshold() {
        return stuckImportThreshold;
    }

    /**
     * Only failures finished within this window are reported; null reports every failure.
     */
    public Duration importFailureWindow() {
        return importFailureWindow;
    }

    /**
     * Import backend name to enabled flag, in check order.
     */
    public Map<String, Boolean> importBackends() {
        return importBackends;
    }

    public ZoneId zone() {
        return zone;
    }

    public static final class Builder {
        private long backlogCeiling = 8000;
        private Duration backlogMinAge = Duration.ofMinutes(15);
        private int retryCeiling = 0;
        private int failedJobSampleSize = 10;
        private int failedJobDetailLimit = 2;
        private long failingJobsSummaryThreshold = 10;
        private Duration schedulerGrace = Duration.ofMinutes(5);
        private Duration schedulerMinPeriod = Duration.ofMinutes(5);
        private Duration channelFetchTolerance = Duration.ofHours(1);
        private Duration stuckImportThreshold = Duration.ofMinutes(10);
        private Duration importFailureWindow;
        private final Map<String, Boolean> importBackends = new LinkedHashMap<>();
        private ZoneId zone = ZoneId.of("UTC");

        public Builder backlogCeiling(long backlogCeiling) {
            this.backlogCeiling = backlogCeiling;
            return this;
        }

        public Builder backlogMinAge(Duration backlogMinAge) {
            this.backlogMinAge = backlogMinAge;
            return this;
        }

        public Builder retryCeiling(int retryCeiling) {
            this.retryCeiling = retryCeiling;
            return this;
        }

        public Builder failedJobSampleSize(int failedJobSampleSize) {
            this.failedJobSampleSize = failedJobSampleSize;
            return this;
        }

        public Builder failedJobDetailLimit(int failedJobDetailLimit) {
            this.failedJobDetailLimit = failedJobDetailLimit;
            return this;
        }

        public Builder failingJobsSummaryThreshold(long failingJobsSummaryThreshold) {
            this.failingJobsSummaryThreshold = failingJobsSummaryThreshold;
            return this;
        }

        public Builder schedulerGrace(Duration schedulerGrace) {
            this.schedulerGrace = schedulerGrace;
            return this;
        }

        public Builder schedulerMinPeriod(Duration schedulerMinPeriod) {
            this.schedulerMinPeriod = schedulerMinPeriod;
            return this;
        }

        public Builder channelFetchTolerance(Duration channelFetchTolerance) {
            this.channelFetchTolerance = channelFetchTolerance;
            return this;
        }

        public Builder stuckImportThreshold(Duration stuckImportThreshold) {
            this.stuckImportThreshold = stuckImportThreshold;
            return this;
        }

        public Builder importFailureWindow(Duration importFailureWindow) {
            this.importFailureWindow = importFailureWindow;
            return this;
        }

        public Builder importBackend(String name, boolean enabled) {
            Objects.requireNonNull(name, "name must not be null");
            this.importBackends.put(name, enabled);
            return this;
        }

        public Builder importBackends(Map<String, Boolean> backends) {
            this.importBackends.clear();
            if (backends != null) {
                this.importBackends.putAll(backends);
            }
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public HealthCheckOptions build() {
            return new HealthCheckOptions(this);
        }
    }
}
