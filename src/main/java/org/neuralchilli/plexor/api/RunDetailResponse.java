package org.neuralchilli.plexor.api;

import java.util.List;

/**
 * A run with the current instance of each of its tasks.
 */
public record RunDetailResponse(
        RunResponse run,
        List<TaskResponse> tasks
) {
}
