package io.jobwarden.config;

import io.jobwarden.Jobwarden;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the automation poller once the context is refreshed and stops it first on shutdown.
 */
public class JobwardenLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobwardenLifecycle.class);

    private final Jobwarden jobwarden;
    private volatile boolean running;

    public JobwardenLifecycle(Jobwarden jobwarden) {
        this.jobwarden = Objects.requireNonNull(jobwarden, "jobwarden must not be null");
    }

    @Override
    public void start() {
        jobwarden.start();
        running = true;
        log.debug("jobwarden lifecycle started");
    }

    @Override
    public void stop() {
        try {
            jobwarden.stop();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Highest phase: started last, stopped before the MongoTemplate users go away.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
