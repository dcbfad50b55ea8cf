package io.jobwarden;

import io.jobwarden.core.AutomationJob;

import java.time.Instant;
import java.util.List;

public interface AutomationJobStore {

    List<AutomationJob> findActive();

    /**
     * Stamp {@code lastRunAt} only. Must not touch the job's {@code updatedAt}.
     */
    void markRun(String jobId, Instant lastRunAt);
}
