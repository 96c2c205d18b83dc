package io.contimg.pipeline.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs external command-line tools (the imaging/calibration engine) with a hard timeout and bounded
 * capture of their output streams.
 */
@Component
@Slf4j
public class ProcessExecutor {

    /**
     * Upper bound on captured stdout/stderr. Engine responses are small JSON documents; anything
     * beyond this is log noise.
     */
    private static final int MAX_CAPTURE_BYTES = 256 * 1024;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command     The command and its arguments to execute.
     * @param contextInfo A string for logging context (e.g., the group id).
     * @param timeout     The maximum time to wait for the process to complete.
     * @param processName A descriptive name for the process.
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws ProcessTimeoutException if the process does not finish within the timeout.
     * @throws IOException             if the process cannot be started.
     * @throws InterruptedException    if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, Duration timeout, String processName)
            throws IOException, InterruptedException {

        log.debug("[{}] Starting {}: {}", contextInfo, processName, command);
        Process process = new ProcessBuilder(command).start();
        StringBuilder stdoutCapture = new StringBuilder();
        StringBuilder stderrCapture = new StringBuilder();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(
                        processName + " process timed out after " + timeout.toSeconds() + " seconds.");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    /**
     * Consumes an InputStream, captures its content up to a limit and optionally logs each line.
     * Draining both streams concurrently keeps the child from blocking on a full pipe.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * Raised when an external process overruns its timeout and has been killed.
     */
    public static class ProcessTimeoutException extends IOException {
        private static final long serialVersionUID = 1L;

        public ProcessTimeoutException(String message) {
            super(message);
        }
    }

    /**
     * The result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
