package io.jobwarden.monitor;

import java.time.Instant;

public interface CreatedRecordCounter {

    /**
     * Records created within {@code [from, to]}.
     */
    long countCreatedBetween(Instant from, Instant to);
}
