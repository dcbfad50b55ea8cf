package io.jobwarden;

import io.jobwarden.core.ChangeContext;

import java.util.List;

/**
 * Source of candidate records for automation jobs.
 */
public interface RecordStore {

    /**
     * All records of the given entity that a job may evaluate.
     */
    List<TargetRecord> findCandidates(String entity);

    /**
     * Persist pending changes of {@code record}, stamping the change with the actor and time
     * carried by {@code context}.
     */
    void save(TargetRecord record, ChangeContext context);
}
