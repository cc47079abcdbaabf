package com.dagflow.engine.config;

import com.dagflow.core.model.RunStatus;
import com.dagflow.core.model.TaskSpec;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.model.WorkflowRun;
import com.dagflow.core.repository.RunStateStore;
import com.dagflow.core.repository.WorkflowDefinitionRepository;
import com.dagflow.engine.coordinator.RunCoordinator;
import com.dagflow.engine.executor.TaskHandlerRegistry;
import com.dagflow.engine.health.EngineHealthIndicator;
import com.dagflow.engine.lifecycle.EngineShutdownHandler;
import com.dagflow.engine.persistence.InMemoryRunStateStore;
import com.dagflow.engine.persistence.jdbc.JdbcRunStateStore;
import com.dagflow.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.dagflow.engine.retention.RetentionPurger;
import com.fasterxml.jackson.databind.node.IntNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class EngineConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(EngineConfiguration.class);

    private static DataSource emptyH2() {
        return new DriverManagerDataSource("jdbc:h2:mem:dagflow-cfg-" + UUID.randomUUID()
            + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", "sa", "");
    }

    @Test
    void defaults_shouldWireInMemoryEngine() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(RunCoordinator.class);
            assertThat(ctx).hasSingleBean(RetentionPurger.class);
            assertThat(ctx.getBean(RunStateStore.class)).isInstanceOf(InMemoryRunStateStore.class);
            assertThat(ctx).doesNotHaveBean(JdbcRunStateStore.class);
            assertThat(ctx.getBean(RetentionPurger.class).isRunning()).isTrue();
        });
    }

    @Test
    void properties_shouldBind() {
        runner.withPropertyValues(
                "dagflow.engine.worker-pool-size=2",
                "dagflow.engine.coordinator-pool-size=3",
                "dagflow.engine.default-task-timeout=45s",
                "dagflow.engine.retention=3d",
                "dagflow.engine.shutdown-timeout=5s")
            .run(ctx -> {
                EngineProperties properties = ctx.getBean(EngineProperties.class);
                assertThat(properties.getWorkerPoolSize()).isEqualTo(2);
                assertThat(properties.getCoordinatorPoolSize()).isEqualTo(3);
                assertThat(properties.getDefaultTaskTimeout()).isEqualTo(Duration.ofSeconds(45));
                assertThat(properties.getRetention()).isEqualTo(Duration.ofDays(3));
                assertThat(properties.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(5));
                assertThat(properties.getStore()).isEqualTo(EngineProperties.Store.MEMORY);
            });
    }

    @Test
    void jdbcStore_shouldCreateSchemaAndRunWorkflow() {
        runner.withPropertyValues("dagflow.engine.store=jdbc")
            .withBean(DataSource.class, EngineConfigurationTest::emptyH2)
            .run(ctx -> {
                assertThat(ctx.getBean(RunStateStore.class)).isInstanceOf(JdbcRunStateStore.class);
                assertThat(ctx.getBean(WorkflowDefinitionRepository.class))
                    .isInstanceOf(JdbcWorkflowDefinitionRepository.class);

                ctx.getBean(TaskHandlerRegistry.class)
                    .register("one", c -> IntNode.valueOf(1))
                    .register("two", c -> IntNode.valueOf(c.getUpstreamResult("first").asInt() + 1));
                RunCoordinator engine = ctx.getBean(RunCoordinator.class);
                WorkflowDefinition def = engine.register(WorkflowDefinition.builder()
                    .name("persisted")
                    .task(TaskSpec.of("first", "one"))
                    .task(TaskSpec.of("second", "two"))
                    .edge("first", "second")
                    .build());

                UUID runId = engine.start(def.id(), Map.of("k", "v"));
                WorkflowRun run = engine.await(runId, Duration.ofSeconds(10));

                assertThat(run.status()).isEqualTo(RunStatus.SUCCEEDED);
                assertThat(run.parameters()).containsEntry("k", "v");
                assertThat(engine.describe(runId).latestAttempt("second").orElseThrow().result())
                    .isEqualTo(IntNode.valueOf(2));
            });
    }

    @Test
    void meterRegistry_shouldReceiveEngineGauges() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(ctx -> {
                MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                assertThat(registry.find("dagflow.runs.active").gauge()).isNotNull();
                assertThat(registry.find("dagflow.attempts.in_flight").gauge()).isNotNull();
            });
    }

    @Test
    void health_shouldReportUpThenDownOnShutdown() {
        runner.run(ctx -> {
            EngineHealthIndicator health = ctx.getBean(EngineHealthIndicator.class);
            assertThat(health.health().getStatus()).isEqualTo(Status.UP);
            assertThat(health.health().getDetails())
                .containsEntry("store", "memory")
                .containsEntry("activeRuns", 0);

            ctx.getBean(EngineShutdownHandler.class).shutdown();

            assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
            assertThat(ctx.getBean(RunCoordinator.class).isAccepting()).isFalse();
        });
    }
}
