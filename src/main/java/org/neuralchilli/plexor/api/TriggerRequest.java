package org.neuralchilli.plexor.api;

import java.util.Map;

/**
 * Body of a trigger request. Both fields are optional.
 */
public record TriggerRequest(
        Map<String, Object> params,
        String triggeredBy
) {
}
