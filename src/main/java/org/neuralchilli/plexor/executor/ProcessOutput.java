package org.neuralchilli.plexor.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Drains a process's output on its own thread so a chatty process cannot
 * block on a full pipe. Only the tail of the output is kept.
 */
public final class ProcessOutput {

    private static final Logger log = LoggerFactory.getLogger(ProcessOutput.class);
    private static final int MAX_CAPTURED_CHARS = 64 * 1024;

    private final StringBuilder buffer = new StringBuilder();
    private final Thread thread;

    private ProcessOutput(InputStream stream, String label) {
        this.thread = new Thread(() -> drain(stream, label), "plexor-output-" + label);
        this.thread.setDaemon(true);
    }

    public static ProcessOutput collect(Process process, String label) {
        ProcessOutput output = new ProcessOutput(process.getInputStream(), label);
        output.thread.start();
        return output;
    }

    private void drain(InputStream stream, String label) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", label, line);
                synchronized (buffer) {
                    buffer.append(line).append('\n');
                    if (buffer.length() > MAX_CAPTURED_CHARS) {
                        buffer.delete(0, buffer.length() - MAX_CAPTURED_CHARS);
                    }
                }
            }
        } catch (IOException e) {
            log.debug("[{}] Output stream closed: {}", label, e.getMessage());
        }
    }

    /**
     * Wait briefly for the stream to reach end of file
     */
    public void await() throws InterruptedException {
        thread.join(TimeUnit.SECONDS.toMillis(5));
    }

    public boolean isComplete() {
        return !thread.isAlive();
    }

    public String text() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }
}
