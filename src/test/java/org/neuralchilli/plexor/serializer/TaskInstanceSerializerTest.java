package org.neuralchilli.plexor.serializer;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.config.TestHazelcast;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.WorkflowRun;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Round trips through a real member, where the custom serializers are registered.
 */
class TaskInstanceSerializerTest {

    private static HazelcastInstance hazelcast;

    @BeforeAll
    static void setupClass() {
        hazelcast = TestHazelcast.newInstance();
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @Test
    void shouldRoundTripFullTaskInstance() {
        IMap<TaskInstanceKey, TaskInstance> map = hazelcast.getMap("serializer-instances");
        Instant now = Instant.parse("2025-03-01T10:15:30.123456789Z");

        TaskInstance original = TaskInstance.builder(UUID.randomUUID(), "train")
                .attempt(2)
                .state(TaskState.RETRYING)
                .queue("gpu-large")
                .maxRetries(3)
                .retryDelaySeconds(45)
                .executor("k8s")
                .queuedAt(now)
                .startedAt(now.plusSeconds(1))
                .endedAt(now.plusSeconds(2))
                .nextRetryAt(now.plusSeconds(47))
                .error("OOMKilled")
                .result(Map.of(
                        "loss", 0.25,
                        "epochs", 3,
                        "rows", 12_000_000_000L,
                        "ok", false,
                        "tags", List.of("a", "b"),
                        "nested", Map.of("k", "v")))
                .cancelRequested(true)
                .version(7)
                .build();

        map.put(original.key(), original);

        assertThat(map.get(original.key())).isEqualTo(original);
    }

    @Test
    void shouldCompareEqualInstancesByValueRegardlessOfMapOrder() {
        IMap<TaskInstanceKey, TaskInstance> map = hazelcast.getMap("serializer-cas");

        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", 1);
        forward.put("b", 2);
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("b", 2);
        backward.put("a", 1);

        UUID runId = UUID.randomUUID();
        TaskInstance stored = TaskInstance.builder(runId, "t").state(TaskState.SUCCESS).result(forward).build();
        TaskInstance expected = TaskInstance.builder(runId, "t").state(TaskState.SUCCESS).result(backward).build();
        TaskInstance next = expected.toBuilder().version(1).build();

        map.put(stored.key(), stored);

        assertThat(map.replace(stored.key(), expected, next)).isTrue();
        assertThat(map.get(stored.key()).version()).isEqualTo(1);
    }

    @Test
    void shouldRoundTripRunAndAssignment() {
        IMap<UUID, WorkflowRun> runs = hazelcast.getMap("serializer-runs");
        IMap<TaskInstanceKey, ExecutorAssignment> assignments = hazelcast.getMap("serializer-assignments");
        Instant now = Instant.parse("2025-03-01T10:15:30Z");

        WorkflowRun run = WorkflowRun.create("nightly", Map.of("region", "eu", "limit", 5), "cron", now)
                .fail("Failed tasks: load", now.plusSeconds(60));
        runs.put(run.id(), run);
        assertThat(runs.get(run.id())).isEqualTo(run);

        ExecutorAssignment assignment = ExecutorAssignment.claim(
                        new TaskAttemptId(run.id(), "load", 3), "celery", "scheduler-a", now)
                .bind("plexor-work:celery/x", now.plusSeconds(1))
                .markCancelSent();
        assignments.put(assignment.key(), assignment);
        assertThat(assignments.get(assignment.key())).isEqualTo(assignment);
    }
}
