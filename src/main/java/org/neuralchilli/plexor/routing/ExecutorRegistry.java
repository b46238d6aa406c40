package org.neuralchilli.plexor.routing;

import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The executor adapters of this scheduler process, by name.
 */
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final Map<String, ExecutorAdapter> adapters;

    public ExecutorRegistry(List<ExecutorAdapter> executorAdapters) {
        Map<String, ExecutorAdapter> byName = new LinkedHashMap<>();
        for (ExecutorAdapter adapter : executorAdapters) {
            if (byName.putIfAbsent(adapter.name(), adapter) != null) {
                throw new ConfigurationException("Duplicate executor name: " + adapter.name());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
    }

    public Optional<ExecutorAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public boolean contains(String name) {
        return adapters.containsKey(name);
    }

    public Collection<ExecutorAdapter> all() {
        return adapters.values();
    }

    public void startAll() {
        for (ExecutorAdapter adapter : adapters.values()) {
            adapter.start();
        }
        log.info("Started {} executors: {}", adapters.size(), adapters.keySet());
    }

    /**
     * Stop every adapter in reverse start order, continuing past failures
     */
    public void stopAll() {
        List<ExecutorAdapter> reversed = new ArrayList<>(adapters.values());
        Collections.reverse(reversed);
        for (ExecutorAdapter adapter : reversed) {
            try {
                adapter.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping executor {}", adapter.name(), e);
            }
        }
    }
}
