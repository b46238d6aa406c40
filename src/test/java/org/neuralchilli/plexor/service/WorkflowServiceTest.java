package org.neuralchilli.plexor.service;

import com.hazelcast.core.HazelcastInstance;
import io.vertx.mutiny.core.eventbus.EventBus;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.config.TestHazelcast;
import org.neuralchilli.plexor.domain.RunStatus;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.reconcile.StateReconciler;
import org.neuralchilli.plexor.store.HazelcastStateStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class WorkflowServiceTest {

    private static final Instant NOW = Instant.parse("2025-07-01T09:30:00Z");

    private static HazelcastInstance hazelcast;
    private static HazelcastStateStore store;

    private EventBus eventBus;
    private WorkflowService service;

    @BeforeAll
    static void setupClass() {
        hazelcast = TestHazelcast.newInstance();
        store = new HazelcastStateStore(hazelcast);
        store.saveWorkflow(Workflow.builder("etl")
                .params(Map.of("region", "us"))
                .tasks(List.of(
                        TaskDefinition.builder("extract").command("echo").build(),
                        TaskDefinition.builder("load").command("echo").dependsOn(List.of("extract")).build()))
                .build());
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        eventBus = mock(EventBus.class);
        service = new WorkflowService(store, eventBus, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreatePendingInstancesOnTrigger() {
        // Given
        Map<String, Object> params = new HashMap<>();
        params.put("region", "eu");
        params.put("unset", null);

        // When
        WorkflowRun run = service.trigger("etl", params, "alice");

        // Then
        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.startedAt()).isEqualTo(NOW);
        assertThat(run.triggeredBy()).isEqualTo("alice");
        assertThat(run.params()).containsOnly(entry("region", "eu"));

        assertThat(service.tasksOf(run.id()))
                .extracting(TaskInstance::taskId, TaskInstance::state, TaskInstance::attempt)
                .containsExactly(
                        tuple("extract", TaskState.PENDING, 1),
                        tuple("load", TaskState.PENDING, 1));
        assertThat(service.activeRuns()).extracting(WorkflowRun::id).contains(run.id());
        verify(eventBus).publish(StateReconciler.RUN_CHANGED, run.id().toString());
    }

    @Test
    void shouldNotFindUnknownWorkflowToTrigger() {
        assertThatThrownBy(() -> service.trigger("nope", Map.of(), "alice"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void shouldNotFindUnknownRun() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> service.getRun(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.tasksOf(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.attemptHistory(missing, "extract"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(service.findRun(missing)).isEmpty();
    }

    @Test
    void shouldFlagEveryUnfinishedTaskOnCancelRun() {
        // Given
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");
        store.update(TaskInstanceKey.of(run.id(), "extract"),
                inst -> inst.queue("local", NOW).succeed(Map.of(), NOW));

        // When
        int flagged = service.cancelRun(run.id());

        // Then
        assertThat(flagged).isEqualTo(1);
        assertThat(service.tasksOf(run.id()))
                .extracting(TaskInstance::taskId, TaskInstance::cancelRequested)
                .containsExactly(tuple("extract", false), tuple("load", true));

        // Flagging again changes nothing
        assertThat(service.cancelRun(run.id())).isZero();
    }

    @Test
    void shouldRejectCancelOfFinishedRun() {
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");
        store.updateRun(run.id(), current -> current.succeed(NOW));

        assertThatThrownBy(() -> service.cancelRun(run.id()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("already finished");
    }

    @Test
    void shouldFlagOnlyOneTaskOnCancelTask() {
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");

        TaskInstance flagged = service.cancelTask(run.id(), "load");

        assertThat(flagged.cancelRequested()).isTrue();
        assertThat(flagged.state()).isEqualTo(TaskState.PENDING);
        assertThat(store.findInstance(TaskInstanceKey.of(run.id(), "extract")).orElseThrow().cancelRequested())
                .isFalse();
    }

    @Test
    void shouldRejectCancelOfUnknownAndFinishedTasks() {
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");
        store.update(TaskInstanceKey.of(run.id(), "extract"), inst -> inst.skip("test", NOW));

        assertThatThrownBy(() -> service.cancelTask(run.id(), "ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.cancelTask(run.id(), "extract"))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void shouldPauseAndResumeRun() {
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");

        assertThat(service.pauseRun(run.id()).status()).isEqualTo(RunStatus.PAUSED);
        assertThatThrownBy(() -> service.pauseRun(run.id()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("PAUSED");

        assertThat(service.resumeRun(run.id()).status()).isEqualTo(RunStatus.RUNNING);
        assertThatThrownBy(() -> service.resumeRun(run.id()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void shouldHaveEmptyAttemptHistoryForFreshTask() {
        WorkflowRun run = service.trigger("etl", Map.of(), "alice");

        assertThat(service.attemptHistory(run.id(), "extract")).isEmpty();
        assertThatThrownBy(() -> service.attemptHistory(run.id(), "ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void shouldListWorkflows() {
        assertThat(service.workflows()).extracting(Workflow::name).contains("etl");
        assertThat(service.getWorkflow("etl").params()).containsEntry("region", "us");
    }
}
