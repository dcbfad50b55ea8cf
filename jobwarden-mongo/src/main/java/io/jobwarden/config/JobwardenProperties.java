package io.jobwarden.config;

import io.jobwarden.engine.RunnerOptions;
import io.jobwarden.monitor.HealthCheckOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the automation runner and the health monitor.
 */
@ConfigurationProperties(prefix = "jobwarden")
public class JobwardenProperties {
    private boolean enabled = true;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private final Runner runner = new Runner();
    private final Monitoring monitoring = new Monitoring();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Runner getRunner() {
        return runner;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    public RunnerOptions toRunnerOptions() {
        return new RunnerOptions(runner.getCooldown());
    }

    public HealthCheckOptions toHealthCheckOptions() {
        return HealthCheckOptions.builder()
                .backlogCeiling(monitoring.getBacklogCeiling())
                .backlogMinAge(monitoring.getBacklogMinAge())
                .retryCeiling(monitoring.getRetryCeiling())
                .failedJobSampleSize(monitoring.getFailedJobSampleSize())
                .failedJobDetailLimit(monitoring.getFailedJobDetailLimit())
                .failingJobsSummaryThreshold(monitoring.getFailingJobsSummaryThreshold())
                .schedulerGrace(monitoring.getSchedulerGrace())
                .schedulerMinPeriod(monitoring.getSchedulerMinPeriod())
                .channelFetchTolerance(monitoring.getChannelFetchTolerance())
                .stuckImportThreshold(monitoring.getStuckImportThreshold())
                .importFailureWindow(monitoring.getImportFailureWindow())
                .importBackends(monitoring.getImportBackends())
                .zone(runner.resolveZone())
                .build();
    }

    public static class Runner {
        // interval ("10m", "600") or 5/6-field cron
        private String runEvery = "*/10 * * * *";
        private Duration cooldown = RunnerOptions.DEFAULT_COOLDOWN;
        private String zone;
        private String actorId = "1";
        private Map<String, String> entityCollections = new LinkedHashMap<>(Map.of("ticket", "tickets"));

        public String getRunEvery() {
            return runEvery;
        }

        public void setRunEvery(String runEvery) {
            this.runEvery = runEvery;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId resolveZone() {
            return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        }

        public String getActorId() {
            return actorId;
        }

        public void setActorId(String actorId) {
            this.actorId = actorId;
        }

        public Map<String, String> getEntityCollections() {
            return entityCollections;
        }

        public void setEntityCollections(Map<String, String> entityCollections) {
            this.entityCollections = entityCollections;
        }
    }

    public static class Monitoring {
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
        private Map<String, Boolean> importBackends = new LinkedHashMap<>();
        private Path unprocessableMailDir = Path.of("tmp", "unprocessable_mail");
        private String amountCheckCollection = "tickets";
        private List<String> statusCollections = new ArrayList<>(List.of("users", "groups", "tickets"));

        public long getBacklogCeiling() {
            return backlogCeiling;
        }

        public void setBacklogCeiling(long backlogCeiling) {
            this.backlogCeiling = backlogCeiling;
        }

        public Duration getBacklogMinAge() {
            return backlogMinAge;
        }

        public void setBacklogMinAge(Duration backlogMinAge) {
            this.backlogMinAge = backlogMinAge;
        }

        public int getRetryCeiling() {
            return retryCeiling;
        }

        public void setRetryCeiling(int retryCeiling) {
            this.retryCeiling = retryCeiling;
        }

        public int getFailedJobSampleSize() {
            return failedJobSampleSize;
        }

        public void setFailedJobSampleSize(int failedJobSampleSize) {
            this.failedJobSampleSize = failedJobSampleSize;
        }

        public int getFailedJobDetailLimit() {
            return failedJobDetailLimit;
        }

        public void setFailedJobDetailLimit(int failedJobDetailLimit) {
            this.failedJobDetailLimit = failedJobDetailLimit;
        }

        public long getFailingJobsSummaryThreshold() {
            return failingJobsSummaryThreshold;
        }

        public void setFailingJobsSummaryThreshold(long failingJobsSummaryThreshold) {
            this.failingJobsSummaryThreshold = failingJobsSummaryThreshold;
        }

        public Duration getSchedulerGrace() {
            return schedulerGrace;
        }

        public void setSchedulerGrace(Duration schedulerGrace) {
            this.schedulerGrace = schedulerGrace;
        }

        public Duration getSchedulerMinPeriod() {
            return schedulerMinPeriod;
        }

        public void setSchedulerMinPeriod(Duration schedulerMinPeriod) {
            this.schedulerMinPeriod = schedulerMinPeriod;
        }

        public Duration getChannelFetchTolerance() {
            return channelFetchTolerance;
        }

        public void setChannelFetchTolerance(Duration channelFetchTolerance) {
            this.channelFetchTolerance = channelFetchTolerance;
        }

        public Duration getStuckImportThreshold() {
            return stuckImportThreshold;
        }

        public void setStuckImportThreshold(Duration stuckImportThreshold) {
            this.stuckImportThreshold = stuckImportThreshold;
        }

        public Duration getImportFailureWindow() {
            return importFailureWindow;
        }

        public void setImportFailureWindow(Duration importFailureWindow) {
            this.importFailureWindow = importFailureWindow;
        }

        public Map<String, Boolean> getImportBackends() {
            return importBackends;
        }

        public void setImportBackends(Map<String, Boolean> importBackends) {
            this.importBackends = importBackends;
        }

        public Path getUnprocessableMailDir() {
            return unprocessableMailDir;
        }

        public void setUnprocessableMailDir(Path unprocessableMailDir) {
            this.unprocessableMailDir = unprocessableMailDir;
        }

        public String getAmountCheckCollection() {
            return amountCheckCollection;
        }

        public void setAmountCheckCollection(String amountCheckCollection) {
            this.amountCheckCollection = amountCheckCollection;
        }

        public List<String> getStatusCollections() {
            return statusCollections;
        }

        public void setStatusCollections(List<String> statusCollections) {
            this.statusCollections = statusCollections;
        }
    }
}
