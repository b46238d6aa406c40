package org.neuralchilli.plexor.core;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskNode;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.service.CycleDetectedException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class DagServiceTest {

    @Inject
    DagService service;

    private static TaskDefinition task(String name, String... dependsOn) {
        return TaskDefinition.builder(name).command("echo").dependsOn(List.of(dependsOn)).build();
    }

    private static Workflow workflow(TaskDefinition... tasks) {
        return Workflow.builder("dag-test").tasks(List.of(tasks)).build();
    }

    // a -> b -> d, a -> c -> d
    private DirectedAcyclicGraph<TaskNode, DefaultEdge> diamond() {
        return service.buildDAG(workflow(
                task("a"),
                task("b", "a"),
                task("c", "a"),
                task("d", "b", "c")
        ));
    }

    private static Map<TaskNode, TaskState> states(Object... pairs) {
        Map<TaskNode, TaskState> states = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            states.put(TaskNode.named((String) pairs[i]), (TaskState) pairs[i + 1]);
        }
        return states;
    }

    @Test
    void shouldBuildDiamondDAG() {
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = diamond();

        assertThat(dag.vertexSet()).hasSize(4);
        assertThat(dag.edgeSet()).hasSize(4);
        assertThat(service.getRootTasks(dag)).extracting(TaskNode::taskName).containsExactly("a");
        assertThat(service.getLeafTasks(dag)).extracting(TaskNode::taskName).containsExactly("d");

        List<TaskNode> order = service.getTopologicalOrder(dag);
        assertThat(order.get(0).taskName()).isEqualTo("a");
        assertThat(order.get(3).taskName()).isEqualTo("d");
    }

    @Test
    void shouldGroupExecutionLevels() {
        List<Set<TaskNode>> levels = service.getExecutionLevels(diamond());

        assertThat(levels).hasSize(3);
        assertThat(levels.get(1)).extracting(TaskNode::taskName).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void shouldDetectCycle() {
        assertThatThrownBy(() -> service.buildDAG(workflow(
                task("a", "c"),
                task("b", "a"),
                task("c", "b")
        )))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void shouldRejectUnknownDependency() {
        assertThatThrownBy(() -> service.buildDAG(workflow(task("a", "ghost"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldFindReadyTasksWhoseDependenciesSucceeded() {
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = diamond();

        assertThat(service.findReadyTasks(dag, states()))
                .extracting(TaskNode::taskName).containsExactly("a");

        assertThat(service.findReadyTasks(dag, states("a", TaskState.SUCCESS)))
                .extracting(TaskNode::taskName).containsExactlyInAnyOrder("b", "c");

        assertThat(service.findReadyTasks(dag, states(
                "a", TaskState.SUCCESS, "b", TaskState.SUCCESS, "c", TaskState.RUNNING)))
                .isEmpty();

        assertThat(service.findReadyTasks(dag, states(
                "a", TaskState.SUCCESS, "b", TaskState.SUCCESS, "c", TaskState.SUCCESS)))
                .extracting(TaskNode::taskName).containsExactly("d");
    }

    @Test
    void shouldNotBlockOnRetryingDependency() {
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = diamond();
        TaskNode d = TaskNode.named("d");

        assertThat(service.isBlockedByFailure(dag, d, states("a", TaskState.SUCCESS, "b", TaskState.RETRYING)))
                .isFalse();
        assertThat(service.isBlockedByFailure(dag, d, states("a", TaskState.SUCCESS, "b", TaskState.FAILED)))
                .isTrue();
    }

    @Test
    void shouldBlockTransitiveDependentsOnFailure() {
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = diamond();

        assertThat(service.isBlockedByFailure(dag, TaskNode.named("d"), states("a", TaskState.CANCELLED)))
                .isTrue();
        assertThat(service.isBlockedByFailure(dag, TaskNode.named("a"), states("a", TaskState.FAILED)))
                .isFalse();
    }

    @Test
    void shouldFindNodesByName() {
        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = diamond();

        assertThat(service.findNode(dag, "c")).isPresent();
        assertThat(service.findNode(dag, "z")).isEmpty();
        assertThat(service.getDependents(dag, TaskNode.named("a")))
                .extracting(TaskNode::taskName).containsExactlyInAnyOrder("b", "c");
    }
}
