package io.jobwarden.engine;

import io.jobwarden.AutomationJobStore;
import io.jobwarden.RecordStore;
import io.jobwarden.TargetRecord;
import io.jobwarden.core.AutomationJob;
import io.jobwarden.core.ChangeContext;
import io.jobwarden.core.JobConfigurationException;
import io.jobwarden.core.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs one automation pass over all active jobs.
 *
 * <p>Per job: inactive, cooling down, or outside its timeplan means skip; otherwise every candidate
 * record of the job's entity is evaluated, matches get the perform assignments, and the job's
 * {@code lastRunAt} is stamped.
 *
 * <p>Jobs run sequentially; changes written by one job are visible to the next. A failing record
 * is logged and skipped. When every matched record failed, {@code lastRunAt} is not stamped so the
 * job is retried on the next pass.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final long BUCKET_SECONDS = 600;

    private final AutomationJobStore jobStore;
    private final RecordStore recordStore;
    private final TimeWindowMatcher windowMatcher;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionApplier actionApplier;
    private final RunnerOptions options;

    public JobRunner(AutomationJobStore jobStore,
                     RecordStore recordStore,
                     TimeWindowMatcher windowMatcher,
                     ConditionEvaluator conditionEvaluator,
                     ActionApplier actionApplier,
                     RunnerOptions options) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.windowMatcher = Objects.requireNonNull(windowMatcher, "windowMatcher must not be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        this.actionApplier = Objects.requireNonNull(actionApplier, "actionApplier must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Cooldown guard: both the last run and the last edit lie at least {@code cooldown} in the past.
     *
     * <p>The last run is compared on 10-minute bucket starts: passes are stamped with their wake-up
     * time, and tick jitter must not push an every-bucket job into every other bucket.
     */
    public boolean isExecutable(AutomationJob job, Instant now) {
        if (!job.active()) {
            return false;
        }
        Instant threshold = now.minus(options.cooldown());
        if (job.updatedAt().isAfter(threshold)) {
            return false;
        }
        if (job.lastRunAt() == null) {
            return true;
        }
        Instant bucketThreshold = bucketStart(now).minus(options.cooldown());
        return !bucketStart(job.lastRunAt()).isAfter(bucketThreshold);
    }

    static Instant bucketStart(Instant at) {
        long seconds = at.getEpochSecond();
        return Instant.ofEpochSecond(seconds - Math.floorMod(seconds, BUCKET_SECONDS));
    }

    public boolean inTimeplan(AutomationJob job, Instant now) {
        return windowMatcher.inWindow(job.timeplan(), now);
    }

    public RunSummary runPass(Instant now, String actorId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(actorId, "actorId must not be null");

        List<AutomationJob> jobs = jobStore.findActive();
        log.debug("jobwarden pass started jobs={} at={}", jobs.size(), now);

        RunSummary total = RunSummary.empty();
        for (AutomationJob job : jobs) {
            total = total.plus(new RunSummary(1, 0, 0, 0, 0));

            if (!isExecutable(job, now)) {
                log.debug("jobwarden job skipped name={} reason=cooldown lastRunAt={} updatedAt={}",
                        job.name(), job.lastRunAt(), job.updatedAt());
                continue;
            }
            if (!inTimeplan(job, now)) {
                log.debug("jobwarden job skipped name={} reason=timeplan", job.name());
                continue;
            }

            try {
                total = total.plus(runJob(job, now, actorId));
            } catch (JobConfigurationException e) {
                log.error("jobwarden job misconfigured name={} msg={}", job.name(), e.getMessage());
            }
        }

        log.debug("jobwarden pass finished summary={}", total);
        return total;
    }

    /**
     * Evaluate and apply one job regardless of its guards.
     */
    public RunSummary runJob(AutomationJob job, Instant now, String actorId) {
        String entity = job.entity();
        List<TargetRecord> candidates = recordStore.findCandidates(entity);
        ConditionEvaluator.Selection selection = conditionEvaluator.select(job.condition(), candidates, now);

        ChangeContext context = ChangeContext.forJob(job, actorId, now);
        int changed = 0;
        int failures = selection.failures();
        int applyFailures = 0;
        for (TargetRecord record : selection.matched()) {
            try {
                if (actionApplier.apply(job.perform(), record, context)) {
                    changed++;
                }
            } catch (JobConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                applyFailures++;
                log.warn("jobwarden perform failed job={} record={} msg={}", job.name(), record.id(), e.getMessage());
            }
        }
        failures += applyFailures;

        int matched = selection.matched().size();
        if (matched > 0 && applyFailures == matched) {
            log.warn("jobwarden job failed for every matched record name={} matched={}; lastRunAt not stamped",
                    job.name(), matched);
        } else {
            jobStore.markRun(job.id(), now);
        }

        log.info("jobwarden job executed name={} entity={} candidates={} matched={} changed={} failures={}",
                job.name(), entity, candidates.size(), matched, changed, failures);
        return new RunSummary(0, 1, matched, changed, failures);
    }
}
