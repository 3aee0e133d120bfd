package com.github.revdownloader.service.backend;

import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.service.coordinator.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YtDlpProcessExecutor")
@EnabledOnOs({OS.LINUX, OS.MAC})
@Timeout(20)
class YtDlpProcessExecutorTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    private final YtDlpProcessExecutor executor = new YtDlpProcessExecutor();

    private static List<String> shell(String script) {
        return List.of("sh", "-c", script);
    }

    @Test
    @DisplayName("should stream every output line")
    void shouldStreamLines() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();

        ProcessOutput output = executor.run(shell("echo one; echo two 1>&2"), URL, "s1:1",
                new CancellationToken(), Duration.ofSeconds(10), lines::add);

        assertTrue(output.isSuccess());
        assertEquals(List.of("one", "two"), lines);
        assertEquals(0, executor.getRunningProcessCount());
    }

    @Test
    @DisplayName("non-zero exit should report the ERROR lines")
    void shouldReportErrors() {
        BackendException e = assertThrows(BackendException.class, () -> executor.run(
                shell("echo '[youtube] abc: Downloading'; echo 'ERROR: Private video'; exit 1"),
                URL, "s1:1", new CancellationToken(), Duration.ofSeconds(10), line -> { }));

        assertEquals("ERROR: Private video", e.getMessage());
        assertEquals(1, e.getExitCode());
        assertEquals(URL, e.getUrl());
    }

    @Test
    @DisplayName("missing executable should fail to start")
    void shouldFailToStart() {
        BackendException e = assertThrows(BackendException.class, () -> executor.run(
                List.of("/nonexistent/yt-dlp"), URL, "s1:1", new CancellationToken(), Duration.ofSeconds(10),
                line -> { }));

        assertTrue(e.getMessage().startsWith("Failed to start /nonexistent/yt-dlp"));
        assertNull(e.getExitCode());
    }

    @Test
    @DisplayName("should kill processes that exceed the timeout")
    void shouldTimeOut() {
        long start = System.nanoTime();

        BackendException e = assertThrows(BackendException.class, () -> executor.run(
                shell("sleep 30"), URL, "s1:1", new CancellationToken(), Duration.ofMillis(300), line -> { }));

        assertTrue(e.getMessage().startsWith("Backend timed out"));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(10));
    }

    @Test
    @DisplayName("cancelling the session should kill its processes")
    void shouldCancelSession() throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<Throwable> failure = CompletableFuture.supplyAsync(() -> {
            try {
                executor.run(shell("echo started; sleep 30"), URL, YtDlpProcessExecutor.processKey("s9", 3),
                        token, Duration.ofSeconds(60), line -> { });
                return null;
            } catch (Exception e) {
                return e;
            }
        });
        while (executor.getRunningProcessCount() == 0) {
            Thread.sleep(10);
        }

        assertEquals(0, executor.cancelSession("other"));
        token.cancel();
        Throwable thrown = failure.get(10, TimeUnit.SECONDS);

        assertInstanceOf(BackendException.class, thrown);
        assertEquals("Cancelled", thrown.getMessage());
        assertEquals(0, executor.getRunningProcessCount());
    }

    @Test
    @DisplayName("cancelled token should prevent the start")
    void shouldNotStartWhenCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(BackendException.class, () -> executor.run(shell("echo hi"), URL, "s1:1", token,
                Duration.ofSeconds(10), line -> fail("process should not run")));
    }

    @Test
    @DisplayName("process keys should join session and suffix")
    void processKey() {
        assertEquals("s1:resolve", YtDlpProcessExecutor.processKey("s1", "resolve"));
    }
}
