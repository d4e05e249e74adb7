package com.auditflow.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    @TempDir
    Path workDir;

    ProcessRunner runner = new ProcessRunner();

    @Test
    @DisplayName("captures stdout, stderr and exit code")
    void capturesOutput() throws Exception {
        ProcessResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"),
                workDir, Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
        assertFalse(result.timedOut());
    }

    @Test
    @DisplayName("runs in the given working directory")
    void usesWorkDir() throws Exception {
        ProcessResult result = runner.run(List.of("pwd"), workDir, Duration.ofSeconds(10));

        assertEquals(workDir.toRealPath().toString(), result.stdout().strip());
    }

    @Test
    @DisplayName("destroys the process when the timeout elapses")
    void timesOut() throws Exception {
        long start = System.nanoTime();
        ProcessResult result = runner.run(List.of("sleep", "30"), workDir, Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 20);
    }

    @Test
    @DisplayName("interrupting the caller destroys the process and rethrows")
    void interruptDestroysProcess() throws Exception {
        var caller = new CompletableFuture<Throwable>();
        Thread thread = new Thread(() -> {
            try {
                runner.run(List.of("sleep", "30"), workDir, Duration.ofSeconds(60));
                caller.complete(null);
            } catch (Throwable t) {
                caller.complete(t);
            }
        });
        thread.start();
        Thread.sleep(300);
        thread.interrupt();

        assertInstanceOf(InterruptedException.class, caller.get(10, TimeUnit.SECONDS));
    }
}
