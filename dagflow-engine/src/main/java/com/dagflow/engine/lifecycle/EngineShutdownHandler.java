package com.dagflow.engine.lifecycle;

import com.dagflow.engine.coordinator.RunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown of the engine.
 *
 * On context close:
 * 1. Stops accepting new runs
 * 2. Waits for active run loops, up to the shutdown timeout
 * 3. Drains the worker pool
 *
 * Runs still active when the timeout expires keep their stored state and are not cancelled.
 */
public class EngineShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineShutdownHandler.class);

    private final RunCoordinator coordinator;
    private final Duration timeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public EngineShutdownHandler(RunCoordinator coordinator, Duration timeout) {
        this.coordinator = coordinator;
        this.timeout = timeout;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown ({} active runs, timeout {})",
            coordinator.activeRunCount(), timeout);

        coordinator.shutdown(timeout);

        if (coordinator.activeRunCount() > 0) {
            log.warn("Shutdown finished with runs still active: {}", coordinator.activeRunIds());
        } else {
            log.info("Graceful shutdown complete");
        }
    }
}
