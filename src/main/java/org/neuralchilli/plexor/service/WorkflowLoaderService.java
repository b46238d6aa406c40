package org.neuralchilli.plexor.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.config.YamlParser;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.scheduler.RunEvaluator;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from YAML files into the shared store.
 * Handles the initial load on startup and reloads of single files.
 */
@ApplicationScoped
public class WorkflowLoaderService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoaderService.class);

    private final YamlParser yamlParser;
    private final WorkflowValidatorService validator;
    private final StateStore store;
    private final RunEvaluator runEvaluator;
    private final String workflowsPath;

    @Inject
    public WorkflowLoaderService(
            YamlParser yamlParser,
            WorkflowValidatorService validator,
            StateStore store,
            RunEvaluator runEvaluator,
            @ConfigProperty(name = "plexor.config.workflows", defaultValue = "config/workflows") String workflowsPath
    ) {
        this.yamlParser = yamlParser;
        this.validator = validator;
        this.store = store;
        this.runEvaluator = runEvaluator;
        this.workflowsPath = workflowsPath;
    }

    void onStart(@Observes StartupEvent event) {
        log.info("Loading workflows from: {}", workflowsPath);
        logResults(loadAll());
    }

    public Path workflowsDirectory() {
        return Path.of(workflowsPath);
    }

    /**
     * Load every YAML file under the workflows directory
     */
    public List<LoadResult> loadAll() {
        Path workflowsDir = workflowsDirectory();
        if (!Files.exists(workflowsDir)) {
            log.warn("Workflows directory does not exist: {}", workflowsPath);
            return new ArrayList<>();
        }
        return loadDirectory(workflowsDir);
    }

    /**
     * Load every YAML file under a directory, recursively
     */
    public List<LoadResult> loadDirectory(Path dir) {
        List<LoadResult> results = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.filter(Files::isRegularFile)
                    .filter(WorkflowLoaderService::isYamlFile)
                    .sorted()
                    .forEach(path -> results.add(loadWorkflow(path)));
        } catch (IOException e) {
            log.error("Error scanning workflows directory: {}", dir, e);
        }
        return results;
    }

    /**
     * Load a single workflow file
     */
    public LoadResult loadWorkflow(Path path) {
        String fileName = path.getFileName().toString();
        try {
            log.debug("Loading workflow from: {}", path);
            return load(Files.readString(path), fileName);
        } catch (IOException e) {
            log.error("✗ Failed to read workflow file: {}", path, e);
            return LoadResult.failure(fileName, e);
        }
    }

    /**
     * Parse, validate and store a workflow
     *
     * @param source where the YAML came from, reported on failure
     */
    public LoadResult load(String yaml, String source) {
        try {
            Workflow workflow = yamlParser.parseWorkflow(yaml);
            validator.validate(workflow);

            store.saveWorkflow(workflow);
            runEvaluator.invalidate(workflow.name());

            log.info("✓ Loaded workflow: {} ({} tasks)", workflow.name(), workflow.tasks().size());
            return LoadResult.success(workflow.name());

        } catch (ValidationException | CycleDetectedException | IllegalArgumentException | IllegalStateException e) {
            log.error("✗ Failed to load workflow from {}: {}", source, e.getMessage());
            return LoadResult.failure(source, e);
        } catch (RuntimeException e) {
            // SnakeYAML syntax errors
            log.error("✗ Failed to parse workflow from {}", source, e);
            return LoadResult.failure(source, e);
        }
    }

    /**
     * Reload a workflow (for hot reload)
     */
    public LoadResult reloadWorkflow(Path path) {
        log.info("Reloading workflow: {}", path);
        return loadWorkflow(path);
    }

    static boolean isYamlFile(Path path) {
        String fileName = path.toString().toLowerCase();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} workflows: {} successful, {} failed", results.size(), successful, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} workflows: all successful", results.size());
        }
    }
}
