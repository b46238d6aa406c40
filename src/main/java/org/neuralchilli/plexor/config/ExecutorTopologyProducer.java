package org.neuralchilli.plexor.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.neuralchilli.plexor.executor.ExecutorFactory;
import org.neuralchilli.plexor.routing.ExecutorRegistry;
import org.neuralchilli.plexor.routing.ExecutorSpec;
import org.neuralchilli.plexor.routing.ExecutorTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the executor topology file and produces the executor registry.
 * Adapters are started when the registry is created and stopped on shutdown.
 */
@ApplicationScoped
public class ExecutorTopologyProducer {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTopologyProducer.class);

    @ConfigProperty(name = "plexor.config.executors", defaultValue = "config/executors.yaml")
    String executorsPath;

    @Produces
    @Singleton
    public ExecutorTopology executorTopology(YamlParser yamlParser) {
        log.info("Loading executor topology from: {}", executorsPath);

        try (InputStream in = open(executorsPath)) {
            ExecutorTopology topology = yamlParser.parseTopology(in);
            if (topology.executors().isEmpty()) {
                throw new ConfigurationException("No executors declared in " + executorsPath);
            }
            log.info("Loaded {} executors and {} routing rules",
                    topology.executors().size(), topology.routing().rules().size());
            return topology;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read executor topology " + executorsPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid executor topology " + executorsPath + ": " + e.getMessage(), e);
        }
    }

    @Produces
    @Singleton
    public ExecutorRegistry executorRegistry(ExecutorTopology topology, ExecutorFactory factory) {
        List<ExecutorAdapter> adapters = new ArrayList<>();
        for (ExecutorSpec spec : topology.executors()) {
            adapters.add(factory.create(spec));
        }
        ExecutorRegistry registry = new ExecutorRegistry(adapters);
        registry.startAll();
        return registry;
    }

    void stopExecutors(@Disposes ExecutorRegistry registry) {
        log.info("Stopping executors");
        registry.stopAll();
    }

    /**
     * A file path, falling back to a classpath resource of the same name
     */
    private InputStream open(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.exists(path)) {
            return Files.newInputStream(path);
        }
        InputStream resource = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (resource == null) {
            throw new ConfigurationException("Executor topology not found: " + location);
        }
        return resource;
    }
}
