package io.jobwarden.monitor;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the delayed-execution queue, plus requeueing of failed entries.
 */
public interface BackgroundJobQueue {

    /**
     * Entries created strictly before {@code createdBefore}.
     */
    long countCreatedBefore(Instant createdBefore);

    /**
     * Entries whose attempts exceed {@code retryCeiling}.
     */
    long countFailing(int retryCeiling);

    /**
     * First {@code limit} failing entries in queue (id) order.
     */
    List<BackgroundJobRecord> findFailing(int retryCeiling, int limit);

    /**
     * Reset failing entries so they run again.
     *
     * @return entries requeued
     */
    long requeueFailing(int retryCeiling);
}
