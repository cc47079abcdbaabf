package com.dagflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings, bound from {@code dagflow.engine.*}.
 *
 * <pre>
 * dagflow.engine.worker-pool-size=8
 * dagflow.engine.coordinator-pool-size=4
 * dagflow.engine.store=jdbc
 * dagflow.engine.retention=7d
 * </pre>
 */
@ConfigurationProperties(prefix = "dagflow.engine")
public class EngineProperties {

    public enum Store {
        MEMORY,
        JDBC
    }

    /**
     * Worker threads shared by all runs; caps in-flight task attempts.
     */
    private int workerPoolSize = 8;

    /**
     * Threads driving run loops; caps concurrently progressing runs. Further runs stay
     * PENDING until a loop thread frees up.
     */
    private int coordinatorPoolSize = 4;

    /**
     * Timeout for tasks that declare none.
     */
    private Duration defaultTaskTimeout = Duration.ofMinutes(5);

    private Store store = Store.MEMORY;

    /**
     * Create the JDBC tables on startup when the JDBC store is selected.
     */
    private boolean initializeSchema = true;

    /**
     * How long terminal runs are kept before purge.
     */
    private Duration retention = Duration.ofDays(7);

    private Duration purgeInterval = Duration.ofHours(1);

    /**
     * How long shutdown waits for run loops before interrupting them.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Settings with every default, for use without Spring.
     */
    public static EngineProperties defaults() {
        return new EngineProperties();
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public int getCoordinatorPoolSize() {
        return coordinatorPoolSize;
    }

    public void setCoordinatorPoolSize(int coordinatorPoolSize) {
        this.coordinatorPoolSize = coordinatorPoolSize;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) {
        this.defaultTaskTimeout = defaultTaskTimeout;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getPurgeInterval() {
        return purgeInterval;
    }

    public void setPurgeInterval(Duration purgeInterval) {
        this.purgeInterval = purgeInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
