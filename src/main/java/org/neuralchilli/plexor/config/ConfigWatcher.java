package org.neuralchilli.plexor.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.service.LoadResult;
import org.neuralchilli.plexor.service.WorkflowLoaderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the workflows directory, subdirectories included, and reloads files
 * as they change. Enabled with {@code plexor.config.watch}.
 */
@ApplicationScoped
public class ConfigWatcher {

    private static final Logger log = LoggerFactory.getLogger(ConfigWatcher.class);

    private final WorkflowLoaderService loader;
    private final boolean watchEnabled;

    private WatchService watchService;
    private Path root;
    private ExecutorService executor;
    private volatile boolean running = false;

    @Inject
    public ConfigWatcher(
            WorkflowLoaderService loader,
            @ConfigProperty(name = "plexor.config.watch", defaultValue = "false") boolean watchEnabled
    ) {
        this.loader = loader;
        this.watchEnabled = watchEnabled;
    }

    void onStart(@Observes StartupEvent event) {
        if (!watchEnabled) {
            log.info("Config watching is disabled");
            return;
        }

        try {
            startWatching();
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stopWatching();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void startWatching() throws IOException {
        if (running) {
            return;
        }

        Path workflowsDir = loader.workflowsDirectory();
        if (!Files.isDirectory(workflowsDir)) {
            log.warn("Workflows directory does not exist, not watching: {}", workflowsDir);
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        root = workflowsDir;
        int directories = registerTree(workflowsDir);
        log.info("Watching workflows directory: {} ({} directories)", workflowsDir, directories);

        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::watchLoop);
    }

    private void watchLoop() {
        while (running) {
            try {
                WatchKey key = watchService.poll(1, TimeUnit.SECONDS);
                if (key == null) {
                    continue;
                }

                for (WatchEvent<?> event : key.pollEvents()) {
                    WatchEvent.Kind<?> kind = event.kind();
                    if (kind == OVERFLOW) {
                        log.warn("Watch event overflow - some changes may have been missed");
                        continue;
                    }

                    @SuppressWarnings("unchecked")
                    WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                    Path changed = ((Path) key.watchable()).resolve(pathEvent.context());
                    if (kind == ENTRY_CREATE && Files.isDirectory(changed)) {
                        handleNewDirectory(changed);
                    } else if (isYamlFile(changed)) {
                        handleFileChange(kind, changed);
                    }
                }

                if (!key.reset()) {
                    if (root.equals(key.watchable())) {
                        log.warn("Workflows directory no longer accessible, stopping watcher");
                        break;
                    }
                    log.debug("Stopped watching removed directory {}", key.watchable());
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (RuntimeException e) {
                log.error("Error in watch loop", e);
            }
        }
        log.debug("Watch loop stopped");
    }

    private int registerTree(Path dir) throws IOException {
        List<Path> directories;
        try (Stream<Path> paths = Files.walk(dir)) {
            directories = paths.filter(Files::isDirectory).toList();
        }
        for (Path directory : directories) {
            directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        }
        return directories.size();
    }

    private void handleNewDirectory(Path dir) {
        try {
            registerTree(dir);
            log.info("Watching new workflows directory: {}", root.relativize(dir));
        } catch (IOException e) {
            log.error("Failed to watch new directory {}", dir, e);
            return;
        }

        // Files may have landed before the directory was registered
        for (LoadResult result : loader.loadDirectory(dir)) {
            if (result.isSuccess()) {
                log.info("✓ Loaded from new directory: {}", result.name());
            } else {
                log.error("✗ Failed to load {}: {}", result.name(), result.error().orElse("unknown error"));
            }
        }
    }

    private void handleFileChange(WatchEvent.Kind<?> kind, Path path) {
        if (kind == ENTRY_DELETE) {
            // Runs in progress still need the definition
            log.info("Workflow file deleted: {} (definition kept)", path.getFileName());
            return;
        }

        LoadResult result = loader.reloadWorkflow(path);
        if (result.isSuccess()) {
            log.info("✓ Successfully reloaded: {}", result.name());
        } else {
            log.error("✗ Failed to reload {}: {}", result.name(), result.error().orElse("unknown error"));
        }
    }

    private boolean isYamlFile(Path path) {
        String fileName = path.toString().toLowerCase();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    public synchronized void stopWatching() {
        if (!running) {
            return;
        }

        log.info("Stopping config watcher");
        running = false;

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            watchService.close();
        } catch (IOException e) {
            log.error("Error closing watch service", e);
        }
    }
}
