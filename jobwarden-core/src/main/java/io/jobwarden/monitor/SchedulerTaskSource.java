package io.jobwarden.monitor;

import java.util.List;

public interface SchedulerTaskSource {

    List<SchedulerTask> findActive();
}
