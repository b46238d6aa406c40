package org.neuralchilli.plexor.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.plexor.domain.RunStatus;
import org.neuralchilli.plexor.domain.WorkflowRun;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.neuralchilli.plexor.serializer.SerializerSupport.*;

/**
 * Compact binary serializer for WorkflowRun.
 */
public class WorkflowRunSerializer implements StreamSerializer<WorkflowRun> {

    private static final int TYPE_ID = 1002;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, WorkflowRun run) throws IOException {
        writeUuid(out, run.id());
        out.writeString(run.workflowName());
        writeStringOrNull(out, run.triggeredBy());

        out.writeInt(run.status().ordinal());

        writeInstantOrNull(out, run.startedAt());
        writeInstantOrNull(out, run.endedAt());

        writeStringOrNull(out, run.error());
        writeStringObjectMap(out, run.params());
    }

    @Override
    public WorkflowRun read(ObjectDataInput in) throws IOException {
        UUID id = readUuid(in);
        String workflowName = in.readString();
        String triggeredBy = readStringOrNull(in);

        RunStatus status = RunStatus.values()[in.readInt()];

        Instant startedAt = readInstantOrNull(in);
        Instant endedAt = readInstantOrNull(in);

        String error = readStringOrNull(in);
        Map<String, Object> params = readStringObjectMap(in);

        return new WorkflowRun(
                id,
                workflowName,
                params,
                status,
                triggeredBy,
                startedAt,
                endedAt,
                error
        );
    }
}
