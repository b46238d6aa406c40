package org.neuralchilli.plexor.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskAttemptId;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

import static org.neuralchilli.plexor.serializer.SerializerSupport.*;

/**
 * Compact binary serializer for ExecutorAssignment.
 */
public class ExecutorAssignmentSerializer implements StreamSerializer<ExecutorAssignment> {

    private static final int TYPE_ID = 1003;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, ExecutorAssignment assignment) throws IOException {
        TaskAttemptId attemptId = assignment.attemptId();
        writeUuid(out, attemptId.runId());
        out.writeString(attemptId.taskId());
        out.writeInt(attemptId.attempt());

        out.writeString(assignment.executor());
        writeStringOrNull(out, assignment.externalId());
        out.writeString(assignment.schedulerId());

        writeInstantOrNull(out, assignment.assignedAt());
        writeInstantOrNull(out, assignment.lastHeartbeat());

        out.writeBoolean(assignment.cancelSent());
    }

    @Override
    public ExecutorAssignment read(ObjectDataInput in) throws IOException {
        UUID runId = readUuid(in);
        String taskId = in.readString();
        int attempt = in.readInt();

        String executor = in.readString();
        String externalId = readStringOrNull(in);
        String schedulerId = in.readString();

        Instant assignedAt = readInstantOrNull(in);
        Instant lastHeartbeat = readInstantOrNull(in);

        boolean cancelSent = in.readBoolean();

        return new ExecutorAssignment(
                new TaskAttemptId(runId, taskId, attempt),
                executor,
                externalId,
                schedulerId,
                assignedAt,
                lastHeartbeat,
                cancelSent
        );
    }
}
