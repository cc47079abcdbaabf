package com.dagflow.engine.config;

import com.dagflow.core.repository.RunStateStore;
import com.dagflow.core.repository.WorkflowDefinitionRepository;
import com.dagflow.engine.coordinator.RunCoordinator;
import com.dagflow.engine.executor.PooledTaskExecutor;
import com.dagflow.engine.executor.TaskExecutor;
import com.dagflow.engine.executor.TaskHandlerRegistry;
import com.dagflow.engine.health.EngineHealthIndicator;
import com.dagflow.engine.lifecycle.EngineShutdownHandler;
import com.dagflow.engine.metrics.EngineMetrics;
import com.dagflow.engine.persistence.InMemoryRunStateStore;
import com.dagflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.dagflow.engine.persistence.jdbc.JdbcRunStateStore;
import com.dagflow.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.dagflow.engine.registry.WorkflowRegistry;
import com.dagflow.engine.retention.RetentionPurger;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Wires the engine from {@link EngineProperties}.
 *
 * {@code dagflow.engine.store=memory} (the default) keeps everything in process;
 * {@code dagflow.engine.store=jdbc} persists definitions, runs and attempts through the
 * application's DataSource.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    public static final String SCHEMA_LOCATION = "db/dagflow-schema.sql";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public EngineMetrics engineMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        EngineMetrics metrics = new EngineMetrics();
        meterRegistry.ifAvailable(metrics::bindTo);
        return metrics;
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskHandlerRegistry taskHandlerRegistry() {
        return new TaskHandlerRegistry();
    }

    @Bean
    public PooledTaskExecutor taskExecutor(TaskHandlerRegistry handlers, EngineProperties properties) {
        return new PooledTaskExecutor(handlers, properties.getWorkerPoolSize(), properties.getDefaultTaskTimeout());
    }

    @Bean
    public WorkflowRegistry workflowRegistry(WorkflowDefinitionRepository definitions, Clock clock) {
        return new WorkflowRegistry(definitions, clock);
    }

    @Bean
    public RunCoordinator runCoordinator(
            WorkflowRegistry registry,
            RunStateStore store,
            TaskExecutor executor,
            EngineMetrics metrics,
            EngineProperties properties,
            Clock clock,
            ObjectMapper objectMapper) {
        return new RunCoordinator(registry, store, executor, metrics, properties, clock, objectMapper);
    }

    @Bean
    public EngineShutdownHandler engineShutdownHandler(RunCoordinator coordinator, EngineProperties properties) {
        return new EngineShutdownHandler(coordinator, properties.getShutdownTimeout());
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(
            RunCoordinator coordinator,
            EngineMetrics metrics,
            EngineShutdownHandler shutdownHandler,
            EngineProperties properties) {
        return new EngineHealthIndicator(coordinator, metrics, shutdownHandler, properties);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RetentionPurger retentionPurger(RunStateStore store, Clock clock, EngineProperties properties) {
        return new RetentionPurger(store, clock, properties.getRetention(), properties.getPurgeInterval());
    }

    // ========== Stores ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "dagflow.engine", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfiguration {

        @Bean
        public InMemoryWorkflowDefinitionRepository workflowDefinitionRepository() {
            return new InMemoryWorkflowDefinitionRepository();
        }

        @Bean
        public InMemoryRunStateStore runStateStore() {
            return new InMemoryRunStateStore();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "dagflow.engine", name = "store", havingValue = "jdbc")
    static class JdbcStoreConfiguration {

        @Bean
        public JdbcTemplate dagflowJdbcTemplate(DataSource dataSource, EngineProperties properties) {
            if (properties.isInitializeSchema()) {
                log.info("Initializing engine schema from {}", SCHEMA_LOCATION);
                new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION)).execute(dataSource);
            }
            return new JdbcTemplate(dataSource);
        }

        @Bean
        public TransactionTemplate dagflowTransactionTemplate(DataSource dataSource) {
            return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        }

        @Bean
        public JdbcWorkflowDefinitionRepository workflowDefinitionRepository(
                JdbcTemplate dagflowJdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcWorkflowDefinitionRepository(dagflowJdbcTemplate, objectMapper);
        }

        @Bean
        public JdbcRunStateStore runStateStore(
                JdbcTemplate dagflowJdbcTemplate,
                TransactionTemplate dagflowTransactionTemplate,
                ObjectMapper objectMapper) {
            return new JdbcRunStateStore(dagflowJdbcTemplate, dagflowTransactionTemplate, objectMapper);
        }
    }
}
