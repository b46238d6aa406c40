package org.neuralchilli.plexor.executor.queue;

import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.executor.TaskRun;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CommandRunnerTest {

    private final CommandRunner runner = new CommandRunner(false);

    private TaskRun run(String command, List<String> args, Map<String, String> env, long timeoutSeconds) {
        return new TaskRun(new TaskAttemptId(UUID.randomUUID(), "task", 1), "default", command, args, env, null, timeoutSeconds);
    }

    @Test
    void shouldCaptureOutput() {
        AtomicReference<Process> started = new AtomicReference<>();

        CommandResult result = runner.run(run("echo", List.of("hello world"), Map.of(), 10), started::set);

        assertThat(result.success()).isTrue();
        assertThat(result.exitCode()).isZero();
        assertThat(result.data()).containsEntry("output", "hello world");
        assertThat(started.get()).isNotNull();
    }

    @Test
    void shouldParseJsonFromLastLine() {
        CommandResult result = runner.run(
                run("sh", List.of("-c", "echo working; echo '{\"rows\": 42, \"table\": \"sales\"}'"), Map.of(), 10),
                process -> { });

        assertThat(result.success()).isTrue();
        assertThat(result.data()).containsEntry("rows", 42).containsEntry("table", "sales");
    }

    @Test
    void shouldPassEnvironment() {
        CommandResult result = runner.run(
                run("sh", List.of("-c", "echo $REGION"), Map.of("REGION", "eu-west"), 10),
                process -> { });

        assertThat(result.data()).containsEntry("output", "eu-west");
    }

    @Test
    void shouldReportNonZeroExit() {
        CommandResult result = runner.run(run("sh", List.of("-c", "echo oops; exit 3"), Map.of(), 10), process -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.error()).contains("exited with code 3").contains("oops");
    }

    @Test
    void shouldKillOnTimeout() {
        CommandResult result = runner.run(run("sleep", List.of("10"), Map.of(), 1), process -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("timed out after 1 seconds");
    }

    @Test
    void shouldReportMissingCommand() {
        CommandResult result = runner.run(run("plexor-no-such-binary", List.of(), Map.of(), 5), process -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Failed to start process");
    }

    @Test
    void shouldNotExecuteDuringTrialRun() {
        CommandRunner trial = new CommandRunner(true);

        CommandResult result = trial.run(run("rm", List.of("-rf", "/nope"), Map.of(), 30), process -> {
            throw new AssertionError("no process expected");
        });

        assertThat(trial.isTrialRun()).isTrue();
        assertThat(result.success()).isTrue();
        assertThat(result.data())
                .containsEntry("trial_run", true)
                .containsEntry("command", "rm -rf /nope");
    }
}
