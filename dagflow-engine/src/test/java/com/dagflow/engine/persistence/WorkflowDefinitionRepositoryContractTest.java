package com.dagflow.engine.persistence;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.model.*;
import com.dagflow.core.repository.WorkflowDefinitionRepository;
import com.dagflow.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Behavior every {@link WorkflowDefinitionRepository} must share.
 */
public abstract class WorkflowDefinitionRepositoryContractTest {

    protected final TimeController time = TimeController.frozen();
    protected WorkflowDefinitionRepository repository;

    protected abstract WorkflowDefinitionRepository createRepository();

    @BeforeEach
    protected void setUpRepository() {
        repository = createRepository();
    }

    private WorkflowDefinition definition(String name, int version) {
        return WorkflowDefinition.builder()
            .name(name)
            .task(TaskSpec.of("extract", "etl.extract"))
            .task(TaskSpec.of("load", "etl.load"))
            .edge("extract", "load")
            .build()
            .asRegistered(version, time.instant());
    }

    @Test
    void save_shouldRoundTripEveryField() {
        RetryPolicy taskPolicy = RetryPolicy.builder()
            .maxAttempts(4)
            .initialBackoff(Duration.ofMillis(250))
            .maxBackoff(Duration.ofSeconds(20))
            .backoffMultiplier(3.0)
            .jitterFactor(0.2)
            .retryableErrors(Set.of("IO", "THROTTLED"))
            .build();
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("ingest")
            .description("Nightly ingestion")
            .labels(Map.of("team", "data", "tier", "1"))
            .failurePolicy(FailurePolicy.FAIL_FAST)
            .defaultRetryPolicy(RetryPolicy.noRetry())
            .task(TaskSpec.builder()
                .name("fetch")
                .executableRef("ingest.fetch")
                .description("Download the feed")
                .timeout(Duration.ofSeconds(90))
                .retryPolicy(taskPolicy)
                .build())
            .task(TaskSpec.of("parse", "ingest.parse"))
            .task(TaskSpec.of("store", "ingest.store"))
            .edge("fetch", "parse")
            .edge("parse", "store")
            .build()
            .asRegistered(1, time.instant());

        repository.save(definition);

        assertThat(repository.find(definition.id())).contains(definition);
    }

    @Test
    void save_shouldRejectExistingVersion() {
        repository.save(definition("etl", 1));

        assertThatThrownBy(() -> repository.save(definition("etl", 1)))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void findLatest_shouldReturnHighestVersion() {
        repository.save(definition("etl", 1));
        repository.save(definition("etl", 3));
        repository.save(definition("etl", 2));

        assertThat(repository.findLatest("etl")).map(WorkflowDefinition::version).contains(3);
        assertThat(repository.findLatest("missing")).isEmpty();
        assertThat(repository.listVersions("etl")).extracting(WorkflowDefinition::version)
            .containsExactly(3, 2, 1);
    }

    @Test
    void listLatest_shouldReturnOneVersionPerName() {
        repository.save(definition("etl", 1));
        repository.save(definition("etl", 2));
        repository.save(definition("report", 1));

        assertThat(repository.listLatest())
            .extracting(WorkflowDefinition::id)
            .containsExactly(DefinitionId.of("etl", 2), DefinitionId.of("report", 1));
    }

    @Test
    void markDeprecated_shouldFlagOnlyThatVersion() {
        repository.save(definition("etl", 1));
        repository.save(definition("etl", 2));

        assertThat(repository.markDeprecated(DefinitionId.of("etl", 1))).isTrue();
        assertThat(repository.markDeprecated(DefinitionId.of("etl", 9))).isFalse();

        assertThat(repository.find(DefinitionId.of("etl", 1)).orElseThrow().deprecated()).isTrue();
        assertThat(repository.find(DefinitionId.of("etl", 2)).orElseThrow().deprecated()).isFalse();
    }

    @Test
    void getNextVersion_shouldFollowHighestVersion() {
        assertThat(repository.getNextVersion("etl")).isEqualTo(1);

        repository.save(definition("etl", 1));
        repository.save(definition("etl", 4));

        assertThat(repository.getNextVersion("etl")).isEqualTo(5);
    }
}
