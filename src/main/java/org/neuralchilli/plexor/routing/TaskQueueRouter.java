package org.neuralchilli.plexor.routing;

import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves the executor that owns a queue.
 * <p>
 * The table is validated on construction, and the bean is created eagerly,
 * so a rule naming an unknown executor stops the application from booting.
 */
@Startup
@ApplicationScoped
public class TaskQueueRouter {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueRouter.class);

    private final RoutingTable table;
    private final ExecutorRegistry registry;

    @Inject
    public TaskQueueRouter(ExecutorTopology topology, ExecutorRegistry registry) {
        this(topology.routing(), registry);
    }

    public TaskQueueRouter(RoutingTable table, ExecutorRegistry registry) {
        this.table = table;
        this.registry = registry;
        validate();
        log.info("Routing {} rules (default: {}) over executors {}",
                table.rules().size(), table.defaultExecutor().orElse("none"), registry.all().stream()
                        .map(ExecutorAdapter::name)
                        .toList());
    }

    private void validate() {
        for (RoutingRule rule : table.rules()) {
            if (!registry.contains(rule.executor())) {
                throw new ConfigurationException(
                        "Routing rule " + rule.queuePattern() + " names unknown executor: " + rule.executor());
            }
        }
        table.defaultExecutor().ifPresent(executor -> {
            if (!registry.contains(executor)) {
                throw new ConfigurationException("Default route names unknown executor: " + executor);
            }
        });
    }

    /**
     * Executor owning the queue.
     *
     * @throws ConfigurationException if no rule matches and there is no default
     */
    public ExecutorAdapter route(String queue) {
        return find(queue).orElseThrow(() ->
                new ConfigurationException("No executor routes queue: " + queue));
    }

    public Optional<ExecutorAdapter> find(String queue) {
        return table.resolve(queue).flatMap(registry::find);
    }

    public boolean canRoute(String queue) {
        return find(queue).isPresent();
    }

    public RoutingTable table() {
        return table;
    }
}
