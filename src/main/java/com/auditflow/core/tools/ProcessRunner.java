package com.auditflow.core.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external analyzer commands with a timeout.
 * <p>
 * Both output streams are drained on background threads so a chatty process
 * never blocks on a full pipe. The child process is destroyed when the timeout
 * elapses or the calling thread is interrupted, which is how cancellation of an
 * audit reaches external analyzers.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final long DRAIN_GRACE_SECONDS = 5;

    /**
     * Runs {@code command} in {@code workDir}.
     *
     * @return the captured result; {@link ProcessResult#timedOut()} is set if the timeout elapsed
     * @throws IOException          if the process could not be started
     * @throws InterruptedException if the calling thread was interrupted; the process is destroyed first
     */
    public ProcessResult run(List<String> command, Path workDir, Duration timeout)
            throws IOException, InterruptedException {
        log.debug("Running: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(false)
                .start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = drain(process.getInputStream(), "stdout");
        CompletableFuture<String> stderr = drain(process.getErrorStream(), "stderr");

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for {}; destroying process", command.get(0));
            destroy(process);
            throw e;
        }

        if (!finished) {
            log.warn("Command {} timed out after {}s; destroying process", command.get(0), timeout.toSeconds());
            destroy(process);
            return new ProcessResult(-1, collect(stdout), collect(stderr), true);
        }
        return new ProcessResult(process.exitValue(), collect(stdout), collect(stderr), false);
    }

    private static CompletableFuture<String> drain(InputStream stream, String name) {
        var future = new CompletableFuture<String>();
        Thread reader = new Thread(() -> {
            try (stream) {
                var buffer = new ByteArrayOutputStream();
                stream.transferTo(buffer);
                future.complete(buffer.toString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                future.completeExceptionally(e);
            }
        }, "process-" + name);
        reader.setDaemon(true);
        reader.start();
        return future;
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.debug("Failed to read process output: {}", e.getCause().getMessage());
            return "";
        } catch (TimeoutException e) {
            log.debug("Process output still open after exit; returning empty output");
            return "";
        }
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
