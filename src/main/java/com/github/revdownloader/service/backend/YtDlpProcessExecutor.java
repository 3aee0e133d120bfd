package com.github.revdownloader.service.backend;

import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.service.coordinator.CancellationToken;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs yt-dlp subprocesses and keeps track of them so a session can kill
 * everything it started. A process is killed, together with its descendants,
 * when its cancellation token fires or its timeout elapses.
 */
@Slf4j
@Service
public class YtDlpProcessExecutor {

    // Track running processes per session and item
    private final ConcurrentHashMap<String, Process> runningProcesses = new ConcurrentHashMap<>();

    public static String processKey(String sessionId, Object suffix) {
        return sessionId + DownloadConstants.PROCESS_KEY_SEPARATOR + suffix;
    }

    /**
     * Run a command to completion.
     *
     * @param command Command and arguments
     * @param url URL the command works on, for error reporting
     * @param processKey Key identifying the process ({@code sessionId:suffix})
     * @param cancellation Kills the process when cancelled
     * @param timeout Kills the process when exceeded
     * @param lineConsumer Receives every output line (stdout and stderr merged)
     * @return Output of a process that exited with code 0
     * @throws BackendException if the process cannot start, is killed or exits with an error
     * @throws InterruptedException if the calling thread is interrupted
     */
    public ProcessOutput run(@NonNull List<String> command, @NonNull String url, @NonNull String processKey,
                             @NonNull CancellationToken cancellation, @NonNull Duration timeout,
                             @NonNull Consumer<String> lineConsumer) throws InterruptedException {
        if (cancellation.isCancelled()) {
            throw new BackendException("Cancelled before start", url);
        }

        log.debug("Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            process = processBuilder.start();
        } catch (IOException e) {
            throw new BackendException("Failed to start " + command.get(0) + ": " + e.getMessage(), e, url);
        }

        runningProcesses.put(processKey, process);
        AtomicBoolean timedOut = new AtomicBoolean(false);
        CancellationToken.Registration registration = cancellation.onCancel(() -> destroy(processKey, process));
        CompletableFuture<Void> watchdog = CompletableFuture.runAsync(() -> {
            timedOut.set(true);
            log.warn("Process {} exceeded {}s, killing it", processKey, timeout.toSeconds());
            destroy(processKey, process);
        }, CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));

        Deque<String> tail = new ArrayDeque<>();
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String clean = FormatUtils.sanitize(line);
                    log.trace("yt-dlp [{}]: {}", processKey, clean);
                    tail.addLast(clean);
                    if (tail.size() > DownloadConstants.BACKEND_ERROR_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    lineConsumer.accept(clean);
                }
            } catch (IOException e) {
                // The stream closes under us when the process is killed
                if (!cancellation.isCancelled() && !timedOut.get()) {
                    throw new BackendException("Failed reading backend output: " + e.getMessage(), e, url);
                }
            }

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                destroy(processKey, process);
                throw e;
            }

            if (cancellation.isCancelled()) {
                throw new BackendException("Cancelled", url, exitCode);
            }
            if (timedOut.get()) {
                throw new BackendException("Backend timed out after " + timeout.toSeconds() + "s", url, exitCode);
            }

            ProcessOutput output = ProcessOutput.builder()
                    .exitCode(exitCode)
                    .tail(new ArrayList<>(tail))
                    .build();
            if (!output.isSuccess()) {
                log.debug("Process {} exited with code {}", processKey, exitCode);
                throw new BackendException(output.errorText(), url, exitCode);
            }
            return output;
        } finally {
            watchdog.cancel(false);
            registration.remove();
            runningProcesses.remove(processKey, process);
        }
    }

    /**
     * Kill every process started for a session.
     *
     * @return number of processes killed
     */
    public int cancelSession(@NonNull String sessionId) {
        String prefix = sessionId + DownloadConstants.PROCESS_KEY_SEPARATOR;
        int killed = 0;
        for (Map.Entry<String, Process> entry : runningProcesses.entrySet()) {
            if (entry.getKey().startsWith(prefix) && destroy(entry.getKey(), entry.getValue())) {
                killed++;
            }
        }
        return killed;
    }

    public int getRunningProcessCount() {
        return runningProcesses.size();
    }

    @PreDestroy
    public void shutdown() {
        runningProcesses.forEach(this::destroy);
    }

    private boolean destroy(String processKey, Process process) {
        if (!process.isAlive()) {
            return false;
        }
        log.debug("Killing process and descendants for: {}", processKey);
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        return true;
    }
}
