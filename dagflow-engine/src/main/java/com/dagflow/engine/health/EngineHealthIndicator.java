package com.dagflow.engine.health;

import com.dagflow.engine.config.EngineProperties;
import com.dagflow.engine.coordinator.RunCoordinator;
import com.dagflow.engine.lifecycle.EngineShutdownHandler;
import com.dagflow.engine.metrics.EngineMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the engine.
 * Reports DOWN once shutdown has begun, UP with run and attempt counts otherwise.
 */
public class EngineHealthIndicator implements HealthIndicator {

    private final RunCoordinator coordinator;
    private final EngineMetrics metrics;
    private final EngineShutdownHandler shutdownHandler;
    private final EngineProperties properties;

    public EngineHealthIndicator(
            RunCoordinator coordinator,
            EngineMetrics metrics,
            EngineShutdownHandler shutdownHandler,
            EngineProperties properties) {
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.shutdownHandler = shutdownHandler;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", properties.getStore().name().toLowerCase());
        details.put("activeRuns", coordinator.activeRunCount());
        details.put("inFlightAttempts", metrics.getInFlightAttempts());

        if (shutdownHandler.isShuttingDown() || !coordinator.isAccepting()) {
            details.put("reason", "shutting down");
            return Health.down()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
