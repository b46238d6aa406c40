package org.neuralchilli.plexor.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskNode;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and queries workflow DAGs using JGraphT.
 * Edges point from a dependency to the task that depends on it.
 */
@ApplicationScoped
public class DagService {

    private static final Logger log = LoggerFactory.getLogger(DagService.class);

    /**
     * Build a DAG from a workflow definition.
     *
     * @throws CycleDetectedException if the dependencies form a cycle
     * @throws IllegalStateException if a task depends on an unknown task
     */
    public DirectedAcyclicGraph<TaskNode, DefaultEdge> buildDAG(Workflow workflow) {
        log.debug("Building DAG for workflow: {}", workflow.name());

        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        Map<String, TaskNode> nodeMap = new HashMap<>();
        for (TaskDefinition task : workflow.tasks()) {
            TaskNode node = TaskNode.of(task);
            if (!dag.addVertex(node)) {
                throw new IllegalStateException("Duplicate task '" + task.name() + "' in workflow " + workflow.name());
            }
            nodeMap.put(task.name(), node);
        }

        for (TaskDefinition task : workflow.tasks()) {
            TaskNode target = nodeMap.get(task.name());

            for (String dependencyName : task.dependsOn()) {
                TaskNode source = nodeMap.get(dependencyName);
                if (source == null) {
                    throw new IllegalStateException(
                            "Task '" + task.name() + "' depends on '" + dependencyName +
                                    "' which does not exist in the workflow"
                    );
                }

                try {
                    dag.addEdge(source, target);
                    log.trace("Added edge: {} -> {}", dependencyName, task.name());
                } catch (IllegalArgumentException e) {
                    // JGraphT refuses edges that would close a cycle
                    throw new CycleDetectedException(
                            "Adding dependency '" + dependencyName + "' -> '" + task.name() +
                                    "' would create a cycle in workflow " + workflow.name()
                    );
                }
            }
        }

        log.debug("DAG built: {} vertices, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Pending tasks whose dependencies have all succeeded
     */
    public Set<TaskNode> findReadyTasks(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            Map<TaskNode, TaskState> currentState
    ) {
        Set<TaskNode> ready = new LinkedHashSet<>();
        for (TaskNode node : getTopologicalOrder(dag)) {
            TaskState state = currentState.getOrDefault(node, TaskState.PENDING);
            if (state == TaskState.PENDING && allDependenciesSucceeded(dag, node, currentState)) {
                ready.add(node);
            }
        }
        return ready;
    }

    private boolean allDependenciesSucceeded(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            TaskNode node,
            Map<TaskNode, TaskState> currentState
    ) {
        for (TaskNode dependency : getDependencies(dag, node)) {
            if (currentState.getOrDefault(dependency, TaskState.PENDING) != TaskState.SUCCESS) {
                return false;
            }
        }
        return true;
    }

    /**
     * Check if any transitive dependency ended without succeeding
     * ({@code FAILED}, {@code SKIPPED} or {@code CANCELLED}).
     */
    public boolean isBlockedByFailure(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            TaskNode node,
            Map<TaskNode, TaskState> currentState
    ) {
        Queue<TaskNode> queue = new ArrayDeque<>(getDependencies(dag, node));
        Set<TaskNode> visited = new HashSet<>();

        while (!queue.isEmpty()) {
            TaskNode dependency = queue.poll();
            if (!visited.add(dependency)) {
                continue;
            }

            TaskState state = currentState.getOrDefault(dependency, TaskState.PENDING);
            if (state.isTerminal() && state != TaskState.SUCCESS) {
                return true;
            }

            queue.addAll(getDependencies(dag, dependency));
        }

        return false;
    }

    /**
     * Immediate predecessors
     */
    public Set<TaskNode> getDependencies(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag, TaskNode node) {
        return dag.incomingEdgesOf(node).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toSet());
    }

    /**
     * Immediate successors
     */
    public Set<TaskNode> getDependents(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag, TaskNode node) {
        return dag.outgoingEdgesOf(node).stream()
                .map(dag::getEdgeTarget)
                .collect(Collectors.toSet());
    }

    public List<TaskNode> getTopologicalOrder(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag) {
        List<TaskNode> order = new ArrayList<>();
        TopologicalOrderIterator<TaskNode, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    public Set<TaskNode> getRootTasks(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.incomingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    public Set<TaskNode> getLeafTasks(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.outgoingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Group tasks into levels that could run in parallel.
     * Each level depends only on earlier levels.
     */
    public List<Set<TaskNode>> getExecutionLevels(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag) {
        List<Set<TaskNode>> levels = new ArrayList<>();
        Set<TaskNode> processed = new HashSet<>();
        Set<TaskNode> remaining = new HashSet<>(dag.vertexSet());

        while (!remaining.isEmpty()) {
            Set<TaskNode> currentLevel = new HashSet<>();
            for (TaskNode node : remaining) {
                if (processed.containsAll(getDependencies(dag, node))) {
                    currentLevel.add(node);
                }
            }

            if (currentLevel.isEmpty()) {
                throw new IllegalStateException("Could not determine execution levels");
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }

        return levels;
    }

    public Optional<TaskNode> findNode(DirectedAcyclicGraph<TaskNode, DefaultEdge> dag, String taskName) {
        TaskNode lookup = TaskNode.named(taskName);
        return dag.containsVertex(lookup)
                ? dag.vertexSet().stream().filter(lookup::equals).findFirst()
                : Optional.empty();
    }
}
