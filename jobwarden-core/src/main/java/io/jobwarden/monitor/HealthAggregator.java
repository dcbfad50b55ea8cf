package io.jobwarden.monitor;

import io.jobwarden.utils.DurationHumanizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Folds the state of several independent subsystems into one verdict and one diagnostic message.
 *
 * <p>Checks run in a fixed order, each contributing zero or more issues:
 * <ol>
 *   <li>channels in error (inbound, outbound) or not fetched recently</li>
 *   <li>periodic tasks that stopped advancing</li>
 *   <li>background queue backlog</li>
 *   <li>unprocessable mails</li>
 *   <li>failing background jobs, skipped when the backlog check fired</li>
 *   <li>failed and stuck imports of enabled import backends</li>
 * </ol>
 * A check whose collaborator throws is reported under {@link HealthReport#unknown()} and does not
 * stop the remaining checks.
 */
public class HealthAggregator {
    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private static final List<String> INBOUND_OPTION_KEYS = List.of("host", "user", "uid");

    private final ChannelSource channels;
    private final SchedulerTaskSource schedulerTasks;
    private final BackgroundJobQueue jobQueue;
    private final MailSpool mailSpool;
    private final ImportJobSource importJobs;
    private final HealthCheckOptions options;
    private final DateTimeFormatter timestampFormat;

    public HealthAggregator(ChannelSource channels,
                            SchedulerTaskSource schedulerTasks,
                            BackgroundJobQueue jobQueue,
                            MailSpool mailSpool,
                            ImportJobSource importJobs,
                            HealthCheckOptions options) {
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.schedulerTasks = Objects.requireNonNull(schedulerTasks, "schedulerTasks must not be null");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue must not be null");
        this.mailSpool = Objects.requireNonNull(mailSpool, "mailSpool must not be null");
        this.importJobs = Objects.requireNonNull(importJobs, "importJobs must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(options.zone());
    }

    public HealthReport check(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Findings f = new Findings();

        guarded("channels", f, () -> checkChannels(now, f));
        guarded("scheduler", f, () -> checkScheduler(now, f));
        boolean backlog = guarded("backlog", f, () -> checkBacklog(now, f));
        guarded("unprocessable_mail", f, () -> checkMailSpool(f));
        if (!backlog) {
            guarded("failed_jobs", f, () -> checkFailedJobs(f));
        }
        guarded("import_jobs", f, () -> checkImports(now, f));

        HealthReport report = HealthReport.of(f.issues, f.actions, f.unknown);
        if (!report.healthy()) {
            log.debug("jobwarden health check failed issues={}", report.issues().size());
        }
        return report;
    }

    private boolean guarded(String name, Findings f, BooleanSupplier check) {
        try {
            return check.getAsBoolean();
        } catch (RuntimeException e) {
            f.unknown.add(name);
            log.warn("jobwarden health check degraded check={} msg={}", name, e.getMessage(), e);
            return false;
        }
    }

    private boolean checkChannels(Instant now, Findings f) {
        int before = f.issues.size();
        Instant fetchThreshold = now.minus(options.channelFetchTolerance());
        for (ChannelStatus channel : channels.findActive()) {
            if (!channel.active()) {
                continue;
            }
            String inbound = "Channel: " + channel.area() + " in ";
            if (channel.inboundFailing()) {
                StringBuilder message = new StringBuilder(inbound);
                for (String key : INBOUND_OPTION_KEYS) {
                    Object value = channel.options().get(key);
                    if (value != null && !value.toString().isBlank()) {
                        message.append(key).append(':').append(value).append(';');
                    }
                }
                f.issues.add(message + " " + nullToEmpty(channel.lastLogIn()));
            }
            if (channel.lastFetchAt() != null && channel.lastFetchAt().isBefore(fetchThreshold)) {
                f.issues.add(inbound + " channel is active but not fetched for " + plainHours(options.channelFetchTolerance()));
            }
            if (channel.outboundFailing()) {
                f.issues.add("Channel: " + channel.area() + " out " + " " + nullToEmpty(channel.lastLogOut()));
            }
        }
        return f.issues.size() > before;
    }

    private boolean checkScheduler(Instant now, Findings f) {
        List<SchedulerTask> tasks = schedulerTasks.findActive();
        boolean fired = false;
        boolean anyRan = false;
        for (SchedulerTask task : tasks) {
            if (!task.active() || task.lastRun() == null) {
                continue;
            }
            anyRan = true;
            if (task.period() == null || task.period().compareTo(options.schedulerMinPeriod()) <= 0) {
                continue;
            }
            Duration overdue = Duration.between(task.lastRun().plus(task.period()), now);
            if (overdue.compareTo(options.schedulerGrace()) <= 0) {
                continue;
            }
            f.issues.add("scheduler may not run (last execution of " + task.method() + " "
                    + DurationHumanizer.inWords(overdue) + " over) - please contact your system administrator");
            f.actions.add(HealthReport.ACTION_RESTART_FAILED_JOBS);
            fired = true;
        }
        if (!tasks.isEmpty() && !anyRan) {
            f.issues.add("scheduler not running");
            fired = true;
        }
        return fired;
    }

    private boolean checkBacklog(Instant now, Findings f) {
        long total = jobQueue.countCreatedBefore(now.minus(options.backlogMinAge()));
        if (total <= options.backlogCeiling()) {
            return false;
        }
        f.issues.add(total + " background jobs in queue");
        return true;
    }

    private boolean checkMailSpool(Findings f) {
        long count = mailSpool.countUnprocessable();
        if (count <= 0) {
            return false;
        }
        f.issues.add("unprocessable mails: " + count);
        return true;
    }

    private boolean checkFailedJobs(Findings f) {
        long total = jobQueue.countFailing(options.retryCeiling());
        if (total <= 0) {
            return false;
        }

        Map<String, FailureGroup> groups = new LinkedHashMap<>();
        for (BackgroundJobRecord job : jobQueue.findFailing(options.retryCeiling(), options.failedJobSampleSize())) {
            groups.computeIfAbsent(job.typeName(), FailureGroup::new).add(job);
        }
        List<FailureGroup> ranked = new ArrayList<>(groups.values());
        ranked.sort(Comparator.comparingInt(FailureGroup::count)
                .thenComparingLong(FailureGroup::attempts)
                .reversed());

        if (total > options.failingJobsSummaryThreshold() || ranked.size() > options.failedJobDetailLimit()) {
            f.issues.add(total + " failing background jobs");
        }
        int rank = 0;
        for (FailureGroup group : ranked) {
            if (rank == options.failedJobDetailLimit()) {
                break;
            }
            rank++;
            f.issues.add("Failed to run background job #" + rank + " '" + group.typeName + "' "
                    + group.count + " time(s) with " + group.attempts + " attempt(s).");
        }
        f.actions.add(HealthReport.ACTION_RESTART_FAILED_JOBS);
        return true;
    }

    private boolean checkImports(Instant now, Findings f) {
        List<String> enabled = new ArrayList<>();
        options.importBackends().forEach((name, on) -> {
            if (Boolean.TRUE.equals(on)) {
                enabled.add(name);
            }
        });
        if (enabled.isEmpty()) {
            return false;
        }

        Map<String, List<ImportJobRecord>> runs = new LinkedHashMap<>();
        for (String backend : enabled) {
            runs.put(backend, importJobs.findByName(backend).stream().filter(j -> !j.dryRun()).toList());
        }

        int before = f.issues.size();
        Instant failureCutoff = options.importFailureWindow() == null ? null : now.minus(options.importFailureWindow());
        runs.forEach((backend, jobs) -> {
            for (ImportJobRecord job : jobs) {
                if (!job.failed()) {
                    continue;
                }
                if (failureCutoff != null && job.finishedAt().isBefore(failureCutoff)) {
                    continue;
                }
                f.issues.add("Failed to run import backend '" + backend + "'. Cause: " + job.error());
            }
        });
        runs.forEach((backend, jobs) -> {
            for (ImportJobRecord job : jobs) {
                if (job.stuck(now, options.stuckImportThreshold())) {
                    f.issues.add("Stuck import backend '" + backend + "' detected. Last update: "
                            + timestampFormat.format(job.updatedAt()));
                }
            }
        });
        return f.issues.size() > before;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String plainHours(Duration d) {
        long hours = d.toHours();
        if (hours > 0 && d.equals(Duration.ofHours(hours))) {
            return hours == 1 ? "1 hour" : hours + " hours";
        }
        long minutes = d.toMinutes();
        return minutes == 1 ? "1 minute" : minutes + " minutes";
    }

    private static final class Findings {
        private final List<String> issues = new ArrayList<>();
        private final Set<String> actions = new LinkedHashSet<>();
        private final List<String> unknown = new ArrayList<>();
    }

    private static final class FailureGroup {
        private final String typeName;
        private int count;
        private long attempts;

        private FailureGroup(String typeName) {
            this.typeName = typeName;
        }

        private void add(BackgroundJobRecord job) {
            count++;
            attempts += job.attempts();
        }

        private int count() {
            return count;
        }

        private long attempts() {
            return attempts;
        }
    }
}
