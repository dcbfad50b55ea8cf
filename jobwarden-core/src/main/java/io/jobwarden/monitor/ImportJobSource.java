package io.jobwarden.monitor;

import java.util.List;

public interface ImportJobSource {

    /**
     * Non-dry runs of the named backend, oldest first.
     */
    List<ImportJobRecord> findByName(String backend);
}
