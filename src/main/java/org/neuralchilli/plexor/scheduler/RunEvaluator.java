package org.neuralchilli.plexor.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.plexor.core.DagService;
import org.neuralchilli.plexor.domain.RunStatus;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskNode;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Decides what happens next in a workflow run: which pending tasks are
 * cancelled or skipped, which are ready to dispatch, and when the run as a
 * whole is finished.
 * <p>
 * DAGs are built once per workflow definition and cached until the
 * definition changes.
 */
@ApplicationScoped
public class RunEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RunEvaluator.class);

    private final StateStore store;
    private final DagService dagService;
    private final SchedulerMetrics metrics;

    private final Map<String, CachedDag> dagCache = new ConcurrentHashMap<>();

    @Inject
    public RunEvaluator(StateStore store, DagService dagService, SchedulerMetrics metrics) {
        this.store = store;
        this.dagService = dagService;
        this.metrics = metrics;
    }

    /**
     * Cancel and skip pending instances as needed and collect the ready ones.
     * A paused run gets no ready instances.
     */
    public RunEvaluation evaluate(WorkflowRun run, Instant now) {
        Optional<Workflow> definition = store.findWorkflow(run.workflowName());
        if (definition.isEmpty()) {
            log.error("Workflow {} of run {} is no longer defined, failing the run", run.workflowName(), run.id());
            store.updateRun(run.id(), current -> current.isFinished()
                    ? current
                    : current.fail("Workflow " + run.workflowName() + " is no longer defined", now));
            return RunEvaluation.none();
        }

        Workflow workflow = definition.get();
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = dagFor(workflow);

        Map<String, TaskInstance> instances = byTask(store.instancesOf(run.id()));
        int cancelled = 0;
        int skipped = 0;

        // Cancellation requested before dispatch
        for (TaskInstance instance : List.copyOf(instances.values())) {
            if (instance.cancelRequested() && instance.state().isDispatchable()) {
                Optional<TaskInstance> updated = apply(instance, inst -> inst.cancel("Cancelled by request", now));
                if (updated.isPresent()) {
                    instances.put(instance.taskId(), updated.get());
                    metrics.recordCancelled();
                    cancelled++;
                }
            }
        }

        // Upstream failure
        Map<TaskNode, TaskState> states = statesOf(dag, instances);
        for (TaskNode node : dagService.getTopologicalOrder(dag)) {
            TaskInstance instance = instances.get(node.taskName());
            if (instance == null || instance.state() != TaskState.PENDING) {
                continue;
            }
            if (dagService.isBlockedByFailure(dag, node, states)) {
                Optional<TaskInstance> updated = apply(instance, inst -> inst.skip("Upstream task did not succeed", now));
                if (updated.isPresent()) {
                    instances.put(instance.taskId(), updated.get());
                    states.put(node, TaskState.SKIPPED);
                    metrics.recordSkipped();
                    skipped++;
                    log.info("Skipped task {} of run {}", node.taskName(), run.id());
                }
            }
        }

        if (cancelled > 0 || skipped > 0) {
            log.debug("Run {}: {} cancelled, {} skipped", run.id(), cancelled, skipped);
        }

        if (run.status() != RunStatus.RUNNING) {
            return new RunEvaluation(workflow, List.of(), cancelled, skipped);
        }

        List<TaskInstance> ready = new ArrayList<>();
        Set<TaskNode> readyNodes = dagService.findReadyTasks(dag, states);
        for (TaskNode node : dagService.getTopologicalOrder(dag)) {
            TaskInstance instance = instances.get(node.taskName());
            if (instance == null || instance.cancelRequested()) {
                continue;
            }
            if (readyNodes.contains(node) || instance.isRetryDue(now)) {
                ready.add(instance);
            }
        }

        return new RunEvaluation(workflow, ready, cancelled, skipped);
    }

    /**
     * Close the run if every task instance is finished: {@code FAILED} if any
     * task failed, {@code CANCELLED} if any was cancelled, otherwise
     * {@code SUCCESS}.
     *
     * @return the closed run, or empty if it is still going
     */
    public Optional<WorkflowRun> finalizeRun(WorkflowRun run, Instant now) {
        if (run.isFinished()) {
            return Optional.empty();
        }

        List<TaskInstance> instances = store.instancesOf(run.id());
        if (instances.isEmpty() || !instances.stream().allMatch(TaskInstance::isFinished)) {
            return Optional.empty();
        }

        List<String> failed = instances.stream()
                .filter(instance -> instance.state() == TaskState.FAILED)
                .map(TaskInstance::taskId)
                .toList();
        boolean anyCancelled = instances.stream()
                .anyMatch(instance -> instance.state() == TaskState.CANCELLED);

        Optional<WorkflowRun> closed = store.updateRun(run.id(), current -> {
            if (current.isFinished()) {
                return current;
            }
            if (!failed.isEmpty()) {
                return current.fail("Failed tasks: " + String.join(", ", failed), now);
            }
            if (anyCancelled) {
                return current.cancel(now);
            }
            return current.succeed(now);
        });

        closed.ifPresent(finished -> log.info("Run {} of {} finished: {}",
                finished.id(), finished.workflowName(), finished.status()));
        return closed.filter(WorkflowRun::isFinished);
    }

    /**
     * DAG of a workflow, rebuilt only when the definition changed
     */
    public DirectedAcyclicGraph<TaskNode, DefaultEdge> dagFor(Workflow workflow) {
        CachedDag cached = dagCache.get(workflow.name());
        if (cached != null && cached.workflow().equals(workflow)) {
            metrics.recordDagCacheHit();
            return cached.dag();
        }

        metrics.recordDagCacheMiss();
        log.debug("Building DAG for workflow: {}", workflow.name());
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = dagService.buildDAG(workflow);
        dagCache.put(workflow.name(), new CachedDag(workflow, dag));
        return dag;
    }

    /**
     * Drop the cached DAG of a workflow
     */
    public void invalidate(String workflowName) {
        if (dagCache.remove(workflowName) != null) {
            log.debug("Invalidated cached DAG of {}", workflowName);
        }
    }

    public int cachedDags() {
        return dagCache.size();
    }

    private Optional<TaskInstance> apply(TaskInstance expected, UnaryOperator<TaskInstance> fn) {
        TaskInstance next = fn.apply(expected);
        return store.compareAndSet(expected, next) ? Optional.of(next) : Optional.empty();
    }

    private Map<String, TaskInstance> byTask(List<TaskInstance> instances) {
        Map<String, TaskInstance> byTask = new LinkedHashMap<>();
        for (TaskInstance instance : instances) {
            byTask.put(instance.taskId(), instance);
        }
        return byTask;
    }

    private Map<TaskNode, TaskState> statesOf(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            Map<String, TaskInstance> instances
    ) {
        Map<TaskNode, TaskState> states = new HashMap<>();
        for (TaskNode node : dag.vertexSet()) {
            TaskInstance instance = instances.get(node.taskName());
            if (instance != null) {
                states.put(node, instance.state());
            }
        }
        return states;
    }

    private record CachedDag(Workflow workflow, DirectedAcyclicGraph<TaskNode, DefaultEdge> dag) {
    }
}
