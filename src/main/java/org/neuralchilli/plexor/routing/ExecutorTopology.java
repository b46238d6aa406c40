package org.neuralchilli.plexor.routing;

import java.util.List;

/**
 * Executors and routing rules as declared in the executor configuration file.
 */
public record ExecutorTopology(
        List<ExecutorSpec> executors,
        RoutingTable routing
) {

    public ExecutorTopology {
        executors = executors != null ? List.copyOf(executors) : List.of();
        if (routing == null) {
            routing = RoutingTable.empty();
        }
    }
}
