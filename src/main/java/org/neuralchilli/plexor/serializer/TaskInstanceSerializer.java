package org.neuralchilli.plexor.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskState;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.neuralchilli.plexor.serializer.SerializerSupport.*;

/**
 * Compact binary serializer for TaskInstance, the most frequently
 * rewritten value in the cluster.
 */
public class TaskInstanceSerializer implements StreamSerializer<TaskInstance> {

    private static final int TYPE_ID = 1001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, TaskInstance instance) throws IOException {
        // Identity
        writeUuid(out, instance.runId());
        out.writeString(instance.taskId());
        out.writeInt(instance.attempt());

        // State (ordinal for efficiency)
        out.writeInt(instance.state().ordinal());

        // Routing and retry policy
        out.writeString(instance.queue());
        out.writeInt(instance.maxRetries());
        out.writeLong(instance.retryDelaySeconds());
        writeStringOrNull(out, instance.executor());

        // Timestamps
        writeInstantOrNull(out, instance.queuedAt());
        writeInstantOrNull(out, instance.startedAt());
        writeInstantOrNull(out, instance.endedAt());
        writeInstantOrNull(out, instance.nextRetryAt());

        // Outcome
        writeStringOrNull(out, instance.error());
        writeStringObjectMap(out, instance.result());

        out.writeBoolean(instance.cancelRequested());
        out.writeLong(instance.version());
    }

    @Override
    public TaskInstance read(ObjectDataInput in) throws IOException {
        UUID runId = readUuid(in);
        String taskId = in.readString();
        int attempt = in.readInt();

        TaskState state = TaskState.values()[in.readInt()];

        String queue = in.readString();
        int maxRetries = in.readInt();
        long retryDelaySeconds = in.readLong();
        String executor = readStringOrNull(in);

        Instant queuedAt = readInstantOrNull(in);
        Instant startedAt = readInstantOrNull(in);
        Instant endedAt = readInstantOrNull(in);
        Instant nextRetryAt = readInstantOrNull(in);

        String error = readStringOrNull(in);
        Map<String, Object> result = readStringObjectMap(in);

        boolean cancelRequested = in.readBoolean();
        long version = in.readLong();

        return new TaskInstance(
                runId,
                taskId,
                attempt,
                state,
                queue,
                maxRetries,
                retryDelaySeconds,
                executor,
                queuedAt,
                startedAt,
                endedAt,
                nextRetryAt,
                error,
                result,
                cancelRequested,
                version
        );
    }
}
