package com.dagflow.engine.retention;

import com.dagflow.core.repository.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes terminal runs, with their attempts, once they are older than the
 * retention period. Active runs are never touched.
 */
public class RetentionPurger {

    private static final Logger log = LoggerFactory.getLogger(RetentionPurger.class);

    private final RunStateStore store;
    private final Clock clock;
    private final Duration retention;
    private final Duration interval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RetentionPurger(RunStateStore store, Clock clock, Duration retention, Duration interval) {
        this.store = store;
        this.clock = clock;
        this.retention = retention;
        this.interval = interval;

        CustomizableThreadFactory threads = new CustomizableThreadFactory("dagflow-purge-");
        threads.setDaemon(true);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threads);
    }

    public void start() {
        if (running) {
            log.warn("Retention purger already running");
            return;
        }
        running = true;
        scheduler.scheduleWithFixedDelay(
            this::purgeSafely,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Retention purger started: retention {}, every {}", retention, interval);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Retention purger stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Purge once, now.
     *
     * @return Number of runs deleted
     */
    public int purgeNow() {
        Instant cutoff = clock.instant().minus(retention);
        int purged = store.purgeTerminatedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} runs completed before {}", purged, cutoff);
        } else {
            log.debug("No runs completed before {}", cutoff);
        }
        return purged;
    }

    private void purgeSafely() {
        try {
            purgeNow();
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next pass retries
            log.error("Retention purge failed", e);
        }
    }
}
