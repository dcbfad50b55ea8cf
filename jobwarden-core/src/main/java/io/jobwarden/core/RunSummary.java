package io.jobwarden.core;

/**
 * Outcome of one automation pass.
 *
 * jobsConsidered : active jobs seen
 * jobsExecuted   : jobs that passed cooldown and window and were evaluated
 * recordsMatched : records satisfying a job condition (summed over jobs)
 * recordsChanged : records actually written
 * recordFailures : records skipped because evaluating or applying failed
 */
public record RunSummary(
        int jobsConsidered,
        int jobsExecuted,
        int recordsMatched,
        int recordsChanged,
        int recordFailures
) {
    public static RunSummary empty() {
        return new RunSummary(0, 0, 0, 0, 0);
    }

    public RunSummary plus(RunSummary other) {
        return new RunSummary(
                jobsConsidered + other.jobsConsidered,
                jobsExecuted + other.jobsExecuted,
                recordsMatched + other.recordsMatched,
                recordsChanged + other.recordsChanged,
                recordFailures + other.recordFailures
        );
    }
}
