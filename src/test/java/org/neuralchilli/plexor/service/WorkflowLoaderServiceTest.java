package org.neuralchilli.plexor.service;

import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.plexor.config.TestHazelcast;
import org.neuralchilli.plexor.config.YamlParser;
import org.neuralchilli.plexor.core.DagService;
import org.neuralchilli.plexor.core.ExpressionEvaluator;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.executor.FakeExecutorAdapter;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.routing.ExecutorRegistry;
import org.neuralchilli.plexor.routing.RoutingTable;
import org.neuralchilli.plexor.routing.TaskQueueRouter;
import org.neuralchilli.plexor.scheduler.RunEvaluator;
import org.neuralchilli.plexor.store.HazelcastStateStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowLoaderServiceTest {

    private static HazelcastInstance hazelcast;
    private static HazelcastStateStore store;

    @TempDir
    Path workflowsDir;

    private RunEvaluator runEvaluator;
    private WorkflowLoaderService loader;

    @BeforeAll
    static void setupClass() {
        hazelcast = TestHazelcast.newInstance();
        store = new HazelcastStateStore(hazelcast);
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        DagService dagService = new DagService();
        TaskQueueRouter router = new TaskQueueRouter(
                new RoutingTable(List.of(), "local"),
                new ExecutorRegistry(List.of(new FakeExecutorAdapter("local"))));
        runEvaluator = new RunEvaluator(store, dagService, new SchedulerMetrics());
        loader = new WorkflowLoaderService(
                new YamlParser(),
                new WorkflowValidatorService(dagService, router, new ExpressionEvaluator()),
                store,
                runEvaluator,
                workflowsDir.toString());
    }

    private Path write(String fileName, String yaml) throws IOException {
        Path file = workflowsDir.resolve(fileName);
        Files.createDirectories(file.getParent());
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void shouldLoadEveryYamlFile() throws IOException {
        // Given
        write("daily.yaml", """
                name: daily
                tasks:
                  - name: extract
                    command: echo
                  - name: load
                    command: echo
                    depends_on: [extract]
                """);
        write("nested/hourly.yml", """
                name: hourly
                tasks:
                  - name: ping
                    command: echo
                """);
        write("notes.txt", "not a workflow");

        // When
        List<LoadResult> results = loader.loadAll();

        // Then
        assertThat(results).hasSize(2).allMatch(LoadResult::isSuccess);
        assertThat(results).extracting(LoadResult::name).containsExactlyInAnyOrder("daily", "hourly");
        assertThat(store.findWorkflow("daily").orElseThrow().taskNames()).containsExactly("extract", "load");
        assertThat(store.findWorkflow("hourly")).isPresent();
    }

    @Test
    void shouldReportInvalidFileAndStillLoadOthers() throws IOException {
        write("good.yaml", """
                name: good
                tasks:
                  - name: only
                    command: echo
                """);
        write("cyclic.yaml", """
                name: cyclic
                tasks:
                  - name: a
                    command: echo
                    depends_on: [b]
                  - name: b
                    command: echo
                    depends_on: [a]
                """);
        write("garbage.yaml", "name: [unterminated");

        List<LoadResult> results = loader.loadAll();

        assertThat(results).hasSize(3);
        assertThat(results).filteredOn(LoadResult::isSuccess).extracting(LoadResult::name).containsExactly("good");
        assertThat(results).filteredOn(result -> !result.isSuccess())
                .extracting(LoadResult::name)
                .containsExactlyInAnyOrder("cyclic.yaml", "garbage.yaml");
        assertThat(store.findWorkflow("cyclic")).isEmpty();
    }

    @Test
    void shouldCarryValidationErrorsInFailure() {
        LoadResult result = loader.load("""
                name: orphaned
                tasks:
                  - name: a
                    command: echo
                    depends_on: [ghost]
                """, "inline");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.name()).isEqualTo("inline");
        assertThat(result.error()).hasValueSatisfying(error -> assertThat(error).contains("ghost"));
    }

    @Test
    void shouldReplaceDefinitionAndInvalidateDagOnReload() throws IOException {
        // Given
        Path file = write("evolving.yaml", """
                name: evolving
                tasks:
                  - name: first
                    command: echo
                """);
        loader.loadWorkflow(file);
        Workflow original = store.findWorkflow("evolving").orElseThrow();
        runEvaluator.dagFor(original);
        assertThat(runEvaluator.cachedDags()).isEqualTo(1);

        // When
        write("evolving.yaml", """
                name: evolving
                tasks:
                  - name: first
                    command: echo
                  - name: second
                    command: echo
                    depends_on: [first]
                """);
        LoadResult result = loader.reloadWorkflow(file);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(store.findWorkflow("evolving").orElseThrow().taskNames()).containsExactly("first", "second");
        assertThat(runEvaluator.cachedDags()).isZero();
    }

    @Test
    void shouldLoadNothingFromMissingDirectory() {
        WorkflowLoaderService elsewhere = new WorkflowLoaderService(
                new YamlParser(), null, store, runEvaluator, workflowsDir.resolve("absent").toString());

        assertThat(elsewhere.loadAll()).isEmpty();
    }

    @Test
    void shouldReportMissingFileAsFailure() {
        LoadResult result = loader.loadWorkflow(workflowsDir.resolve("nope.yaml"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.name()).isEqualTo("nope.yaml");
    }
}
