package org.neuralchilli.plexor.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.routing.ExecutorSpec;
import org.neuralchilli.plexor.routing.ExecutorTopology;
import org.neuralchilli.plexor.routing.ExecutorType;
import org.neuralchilli.plexor.routing.RoutingRule;
import org.neuralchilli.plexor.routing.RoutingTable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses workflow files and the executor topology file.
 */
@ApplicationScoped
public class YamlParser {

    private static final Pattern DURATION = Pattern.compile("^(\\d+)\\s*(s|m|h)?$");

    /**
     * Parse a workflow definition from a YAML string
     */
    public Workflow parseWorkflow(String yamlContent) {
        return parseWorkflowFromMap(load(yamlContent));
    }

    /**
     * Parse a workflow definition from an InputStream
     */
    public Workflow parseWorkflow(InputStream inputStream) {
        return parseWorkflowFromMap(load(inputStream));
    }

    /**
     * Parse executors and routing rules from a YAML string
     */
    public ExecutorTopology parseTopology(String yamlContent) {
        return parseTopologyFromMap(load(yamlContent));
    }

    /**
     * Parse executors and routing rules from an InputStream
     */
    public ExecutorTopology parseTopology(InputStream inputStream) {
        return parseTopologyFromMap(load(inputStream));
    }

    private Yaml yaml() {
        // Yaml instances are not thread-safe
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private Map<String, Object> load(String yamlContent) {
        return asMap(yaml().load(yamlContent), "document");
    }

    private Map<String, Object> load(InputStream inputStream) {
        return asMap(yaml().load(inputStream), "document");
    }

    @SuppressWarnings("unchecked")
    private Workflow parseWorkflowFromMap(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String description = getString(data, "description", false);
        Map<String, String> env = getStringMap(data, "env", Map.of());
        Map<String, Object> params = getObjectMap(data, "params");

        Object tasksValue = data.get("tasks");
        if (!(tasksValue instanceof List) || ((List<?>) tasksValue).isEmpty()) {
            throw new IllegalArgumentException("Workflow must have at least one task");
        }

        List<TaskDefinition> tasks = new ArrayList<>();
        for (Object taskValue : (List<Object>) tasksValue) {
            tasks.add(parseTaskFromMap(asMap(taskValue, "task")));
        }

        return new Workflow(name, description, params, env, tasks);
    }

    private TaskDefinition parseTaskFromMap(Map<String, Object> data) {
        return TaskDefinition.builder(getString(data, "name", true))
                .command(getString(data, "command", true))
                .args(getStringList(data, "args", List.of()))
                .env(getStringMap(data, "env", Map.of()))
                .queue(getString(data, "queue", false))
                .image(getString(data, "image", false))
                .retries(getInt(data, "retries", 0))
                .retryDelaySeconds(getDurationSeconds(data, "retry_delay", TaskDefinition.DEFAULT_RETRY_DELAY_SECONDS))
                .timeoutSeconds(getDurationSeconds(data, "timeout", TaskDefinition.DEFAULT_TIMEOUT_SECONDS))
                .dependsOn(getStringList(data, "depends_on", List.of()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private ExecutorTopology parseTopologyFromMap(Map<String, Object> data) {
        List<ExecutorSpec> executors = new ArrayList<>();
        Object executorsValue = data.get("executors");
        if (executorsValue != null) {
            if (!(executorsValue instanceof List)) {
                throw new IllegalArgumentException("Field 'executors' must be a list");
            }
            for (Object executorValue : (List<Object>) executorsValue) {
                Map<String, Object> executor = asMap(executorValue, "executor");
                executors.add(new ExecutorSpec(
                        getString(executor, "name", true),
                        ExecutorType.parse(getString(executor, "type", true)),
                        getObjectMap(executor, "options")
                ));
            }
        }

        RoutingTable routing = RoutingTable.empty();
        if (data.get("routing") != null) {
            Map<String, Object> routingData = asMap(data.get("routing"), "routing");
            List<RoutingRule> rules = new ArrayList<>();
            Object rulesValue = routingData.get("rules");
            if (rulesValue != null) {
                if (!(rulesValue instanceof List)) {
                    throw new IllegalArgumentException("Field 'routing.rules' must be a list");
                }
                for (Object ruleValue : (List<Object>) rulesValue) {
                    Map<String, Object> rule = asMap(ruleValue, "routing rule");
                    rules.add(new RoutingRule(getString(rule, "queue", true), getString(rule, "executor", true)));
                }
            }
            routing = new RoutingTable(rules, getString(routingData, "default", false));
        }

        return new ExecutorTopology(executors, routing);
    }

    // Helper methods for type-safe extraction

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping for " + what + ", got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + key + " must be an integer, got: " + value, e);
        }
    }

    /**
     * Seconds from a number, or a string such as {@code 90}, {@code 30s}, {@code 5m}, {@code 1h}
     */
    private long getDurationSeconds(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        Matcher matcher = DURATION.matcher(value.toString().trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Field " + key + " must be a duration like 30s, 5m or 1h, got: " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2);
        if ("m".equals(unit)) {
            return amount * 60;
        }
        if ("h".equals(unit)) {
            return amount * 3600;
        }
        return amount;
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        throw new IllegalArgumentException("Field " + key + " must be a list, got: " + value);
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key, Map<String, String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map) {
            Map<String, String> result = new HashMap<>();
            ((Map<?, ?>) value).forEach((k, v) ->
                    result.put(k.toString(), v != null ? v.toString() : "")
            );
            return result;
        }
        throw new IllegalArgumentException("Field " + key + " must be a mapping, got: " + value);
    }

    /**
     * A mapping of scalar or nested values; null entries are dropped
     */
    private Map<String, Object> getObjectMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> {
                if (v != null) {
                    result.put(k.toString(), v);
                }
            });
            return result;
        }
        throw new IllegalArgumentException("Field " + key + " must be a mapping, got: " + value);
    }
}
