package org.neuralchilli.plexor.scheduler;

import com.hazelcast.core.HazelcastInstance;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.config.TestHazelcast;
import org.neuralchilli.plexor.core.DagService;
import org.neuralchilli.plexor.domain.RunStatus;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.TaskNode;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.store.HazelcastStateStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.*;

class RunEvaluatorTest {

    private static final Instant T0 = Instant.parse("2025-05-01T00:00:00Z");

    private static HazelcastInstance hazelcast;
    private static HazelcastStateStore store;

    private SchedulerMetrics metrics;
    private RunEvaluator evaluator;

    @BeforeAll
    static void setupClass() {
        hazelcast = TestHazelcast.newInstance();
        store = new HazelcastStateStore(hazelcast);
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        metrics = new SchedulerMetrics();
        evaluator = new RunEvaluator(store, new DagService(), metrics);
    }

    private static TaskDefinition task(String name, String... dependsOn) {
        return TaskDefinition.builder(name).command("echo").dependsOn(List.of(dependsOn)).build();
    }

    /**
     * Save a uniquely named workflow
     */
    private Workflow workflow(TaskDefinition... tasks) {
        Workflow workflow = Workflow.builder("eval-" + UUID.randomUUID().toString().substring(0, 8))
                .tasks(List.of(tasks))
                .build();
        store.saveWorkflow(workflow);
        return workflow;
    }

    private WorkflowRun start(Workflow workflow) {
        WorkflowRun run = WorkflowRun.create(workflow.name(), Map.of(), "test", T0);
        List<TaskInstance> instances = new ArrayList<>();
        for (TaskDefinition task : workflow.tasks()) {
            instances.add(TaskInstance.create(run.id(), task));
        }
        store.createRun(run, instances);
        return run;
    }

    private TaskInstance set(WorkflowRun run, String taskId, UnaryOperator<TaskInstance> fn) {
        return store.update(TaskInstanceKey.of(run.id(), taskId), fn).orElseThrow();
    }

    private TaskInstance succeed(WorkflowRun run, String taskId) {
        return set(run, taskId, inst -> inst.queue("local", T0).succeed(Map.of(), T0));
    }

    private TaskInstance failed(WorkflowRun run, String taskId) {
        return set(run, taskId, inst -> inst.queue("local", T0).fail("boom", T0));
    }

    private TaskState stateOf(WorkflowRun run, String taskId) {
        return store.findInstance(TaskInstanceKey.of(run.id(), taskId)).orElseThrow().state();
    }

    @Test
    void shouldMakeRootTasksReadyFirst() {
        // Given
        Workflow workflow = workflow(task("extract"), task("notify"), task("load", "extract"));
        WorkflowRun run = start(workflow);

        // When
        RunEvaluation evaluation = evaluator.evaluate(run, T0);

        // Then
        assertThat(evaluation.workflow()).isEqualTo(workflow);
        assertThat(evaluation.ready()).extracting(TaskInstance::taskId)
                .containsExactlyInAnyOrder("extract", "notify");
    }

    @Test
    void shouldMakeDependentReadyOnceUpstreamSucceeds() {
        Workflow workflow = workflow(task("extract"), task("load", "extract"), task("report", "load"));
        WorkflowRun run = start(workflow);
        succeed(run, "extract");

        RunEvaluation evaluation = evaluator.evaluate(run, T0);

        assertThat(evaluation.ready()).extracting(TaskInstance::taskId).containsExactly("load");
    }

    @Test
    void shouldNotTreatInFlightTasksAsReady() {
        Workflow workflow = workflow(task("only"));
        WorkflowRun run = start(workflow);
        set(run, "only", inst -> inst.queue("local", T0));

        assertThat(evaluator.evaluate(run, T0).ready()).isEmpty();
    }

    @Test
    void shouldSkipDependentsAndFailRunOnUpstreamFailure() {
        // Given
        Workflow workflow = workflow(task("a"), task("b", "a"), task("c", "b"));
        WorkflowRun run = start(workflow);
        failed(run, "a");

        // When
        RunEvaluation evaluation = evaluator.evaluate(run, T0);
        WorkflowRun finished = evaluator.finalizeRun(run, T0).orElseThrow();

        // Then
        assertThat(evaluation.skipped()).isEqualTo(2);
        assertThat(evaluation.ready()).isEmpty();
        assertThat(stateOf(run, "b")).isEqualTo(TaskState.SKIPPED);
        assertThat(stateOf(run, "c")).isEqualTo(TaskState.SKIPPED);

        assertThat(finished.status()).isEqualTo(RunStatus.FAILED);
        assertThat(finished.error()).isEqualTo("Failed tasks: a");
        assertThat(finished.endedAt()).isEqualTo(T0);
        assertThat(metrics.getReport().tasksSkipped()).isEqualTo(2);
    }

    @Test
    void shouldNotSkipDependentsOfRetryingUpstream() {
        Workflow workflow = workflow(task("a"), task("b", "a"));
        WorkflowRun run = start(workflow);
        set(run, "a", inst -> inst.queue("local", T0).failForRetry("boom", T0));

        RunEvaluation evaluation = evaluator.evaluate(run, T0);

        assertThat(evaluation.skipped()).isZero();
        assertThat(stateOf(run, "b")).isEqualTo(TaskState.PENDING);
    }

    @Test
    void shouldMakeRetryReadyOnlyOnceDelayElapsed() {
        Workflow workflow = workflow(TaskDefinition.builder("flaky").command("echo")
                .retries(1).retryDelaySeconds(30).build());
        WorkflowRun run = start(workflow);
        set(run, "flaky", inst -> inst.queue("local", T0).failForRetry("boom", T0));

        assertThat(evaluator.evaluate(run, T0.plusSeconds(29)).ready()).isEmpty();
        assertThat(evaluator.evaluate(run, T0.plusSeconds(30)).ready())
                .extracting(TaskInstance::taskId).containsExactly("flaky");
    }

    @Test
    void shouldGivePausedRunNoReadyTasks() {
        Workflow workflow = workflow(task("a"));
        WorkflowRun run = start(workflow);
        WorkflowRun paused = store.updateRun(run.id(), WorkflowRun::pause).orElseThrow();

        assertThat(evaluator.evaluate(paused, T0).ready()).isEmpty();
    }

    @Test
    void shouldCancelTaskFlaggedBeforeDispatch() {
        // Given
        Workflow workflow = workflow(task("a"), task("b", "a"));
        WorkflowRun run = start(workflow);
        set(run, "a", TaskInstance::requestCancel);

        // When
        RunEvaluation evaluation = evaluator.evaluate(run, T0);
        WorkflowRun finished = evaluator.finalizeRun(run, T0).orElseThrow();

        // Then
        assertThat(evaluation.cancelled()).isEqualTo(1);
        assertThat(evaluation.skipped()).isEqualTo(1);
        assertThat(evaluation.ready()).isEmpty();
        assertThat(stateOf(run, "a")).isEqualTo(TaskState.CANCELLED);
        assertThat(finished.status()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void shouldLetFailureWinOverCancellation() {
        Workflow workflow = workflow(task("a"), task("b"));
        WorkflowRun run = start(workflow);
        failed(run, "a");
        set(run, "b", inst -> inst.cancel("stop", T0));

        assertThat(evaluator.finalizeRun(run, T0).orElseThrow().status()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void shouldSucceedRunWhenEveryTaskSucceeded() {
        Workflow workflow = workflow(task("a"), task("b", "a"));
        WorkflowRun run = start(workflow);
        succeed(run, "a");

        assertThat(evaluator.finalizeRun(run, T0)).isEmpty();

        succeed(run, "b");
        WorkflowRun finished = evaluator.finalizeRun(run, T0.plusSeconds(3)).orElseThrow();

        assertThat(finished.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(finished.endedAt()).isEqualTo(T0.plusSeconds(3));
        assertThat(evaluator.finalizeRun(finished, T0.plusSeconds(4))).isEmpty();
    }

    @Test
    void shouldFailRunWithMissingDefinition() {
        WorkflowRun run = WorkflowRun.create("vanished-" + UUID.randomUUID(), Map.of(), "test", T0);
        store.createRun(run, List.of());

        RunEvaluation evaluation = evaluator.evaluate(run, T0);

        assertThat(evaluation.workflow()).isNull();
        WorkflowRun failed = store.findRun(run.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.error()).contains("no longer defined");
    }

    @Test
    void shouldCacheDagUntilDefinitionChanges() {
        // Given
        Workflow workflow = workflow(task("a"), task("b", "a"));

        // When
        DirectedAcyclicGraph<TaskNode, DefaultEdge> first = evaluator.dagFor(workflow);
        DirectedAcyclicGraph<TaskNode, DefaultEdge> second = evaluator.dagFor(workflow);
        Workflow changed = Workflow.builder(workflow.name())
                .tasks(List.of(task("a"), task("b", "a"), task("c", "b")))
                .build();
        DirectedAcyclicGraph<TaskNode, DefaultEdge> third = evaluator.dagFor(changed);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(third).isNotSameAs(first);
        assertThat(third.vertexSet()).hasSize(3);
        assertThat(metrics.getDagCacheHitRate()).isCloseTo(33.3, within(0.1));
        assertThat(evaluator.cachedDags()).isEqualTo(1);

        evaluator.invalidate(workflow.name());
        assertThat(evaluator.cachedDags()).isZero();
    }
}
