package org.neuralchilli.plexor.executor.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.executor.ProcessOutput;
import org.neuralchilli.plexor.executor.TaskRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs task commands as local processes and captures their output.
 * Supports trial-run mode, which logs the command instead of running it.
 * <p>
 * If the last line of output is a JSON object it becomes the task result,
 * so tasks can pass structured data to downstream tasks.
 */
@ApplicationScoped
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final boolean trialRun;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Inject
    public CommandRunner(@ConfigProperty(name = "plexor.worker.trial-run", defaultValue = "false") boolean trialRun) {
        this.trialRun = trialRun;
    }

    public boolean isTrialRun() {
        return trialRun;
    }

    /**
     * Run a task to completion.
     *
     * @param run     the rendered task run
     * @param onStart receives the process once started, so callers can kill it
     */
    public CommandResult run(TaskRun run, Consumer<Process> onStart) {
        if (trialRun) {
            return trialRun(run);
        }

        List<String> commandLine = run.commandLine();
        log.debug("Executing command: {}", String.join(" ", commandLine));

        Process process;
        try {
            process = launch(commandLine, run.env());
        } catch (IOException e) {
            return CommandResult.failure("Failed to start process: " + e.getMessage());
        }
        onStart.accept(process);

        ProcessOutput collector = ProcessOutput.collect(process, run.attemptId().toString());
        try {
            boolean completed = process.waitFor(run.timeoutSeconds(), TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                collector.await();
                return CommandResult.failure("Task timed out after " + run.timeoutSeconds() + " seconds");
            }

            collector.await();
            int exitCode = process.exitValue();
            String output = collector.text();

            if (exitCode == 0) {
                return CommandResult.success(parseResult(output));
            }
            return CommandResult.failure("Task exited with code " + exitCode + "\n" + output.trim(), exitCode);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.failure("Task interrupted");
        }
    }

    /**
     * Start a process with stderr merged into stdout
     */
    public Process launch(List<String> commandLine, Map<String, String> env) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.environment().putAll(env);
        pb.redirectErrorStream(true);
        return pb.start();
    }

    /**
     * Parse the last line of output as JSON.
     * Anything else becomes {@code {"output": <trimmed output>}}.
     */
    public Map<String, Object> parseResult(String output) {
        String trimmed = output == null ? "" : output.trim();
        if (trimmed.isEmpty()) {
            return Map.of("output", "");
        }

        String[] lines = trimmed.split("\n");
        String lastLine = lines[lines.length - 1].trim();

        if (lastLine.startsWith("{") && lastLine.endsWith("}")) {
            try {
                return objectMapper.readValue(lastLine, new TypeReference<Map<String, Object>>() {});
            } catch (IOException e) {
                log.trace("Last line is not valid JSON: {}", e.getMessage());
            }
        }

        return Map.of("output", trimmed);
    }

    private CommandResult trialRun(TaskRun run) {
        String commandStr = String.join(" ", run.commandLine());

        log.info("TRIAL RUN - would execute:");
        log.info("  Task: {}", run.attemptId());
        log.info("  Command: {}", commandStr);
        log.info("  Timeout: {}s", run.timeoutSeconds());
        run.env().forEach((k, v) -> log.info("  Env {}={}", k, v));

        return CommandResult.success(Map.of(
                "trial_run", true,
                "command", commandStr,
                "timeout", run.timeoutSeconds(),
                "attempt", run.attemptId().attempt()
        ));
    }
}
