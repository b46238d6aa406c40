package org.neuralchilli.plexor.api;

import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.neuralchilli.plexor.routing.ExecutorType;

public record ExecutorResponse(
        String name,
        ExecutorType type,
        int inFlight
) {
    public static ExecutorResponse from(ExecutorAdapter adapter) {
        return new ExecutorResponse(adapter.name(), adapter.type(), adapter.inFlight());
    }
}
