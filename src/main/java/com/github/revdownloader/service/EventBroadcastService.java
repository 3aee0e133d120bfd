package com.github.revdownloader.service;

import com.github.revdownloader.model.LogEntry;
import com.github.revdownloader.model.LogLevel;
import com.github.revdownloader.model.ProgressSnapshot;
import com.github.revdownloader.model.SessionResult;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Publishes log entries, progress snapshots and session results. Publishing
 * only enqueues; delivery to SSE clients and listeners happens on the single
 * event executor thread, so workers never touch subscriber state.
 */
@Slf4j
@Service
public class EventBroadcastService {

    private final Executor eventExecutor;
    private final Clock clock;

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<SessionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<LogEntry> history = new ArrayDeque<>();

    public EventBroadcastService(@Qualifier("eventExecutor") Executor eventExecutor, Clock clock) {
        this.eventExecutor = eventExecutor;
        this.clock = clock;
    }

    /**
     * Register a new SSE emitter
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());
        return emitter;
    }

    public void registerListener(SessionEventListener listener) {
        listeners.add(listener);
        log.debug("Event listener registered. Total: {}", listeners.size());
    }

    public void unregisterListener(SessionEventListener listener) {
        listeners.remove(listener);
        log.debug("Event listener unregistered. Remaining: {}", listeners.size());
    }

    /**
     * Publish a user-facing log line and mirror it to the application log.
     */
    public void log(String sessionId, LogLevel level, String message) {
        String clean = FormatUtils.sanitize(message);
        switch (level) {
            case ERROR -> log.error("[{}] {}", sessionId, clean);
            case WARNING -> log.warn("[{}] {}", sessionId, clean);
            default -> log.info("[{}] {}", sessionId, clean);
        }

        LogEntry entry = LogEntry.builder()
                .sessionId(sessionId)
                .level(level)
                .message(clean)
                .timestamp(LocalDateTime.now(clock))
                .build();

        synchronized (history) {
            history.addLast(entry);
            while (history.size() > DownloadConstants.LOG_HISTORY_SIZE) {
                history.removeFirst();
            }
        }

        dispatch("log", entry, listener -> listener.onLog(entry));
    }

    public void broadcastProgress(ProgressSnapshot snapshot) {
        log.debug("Broadcasting progress for session {}: {}", snapshot.getSessionId(),
                FormatUtils.formatPercentage(snapshot.getPercent()));
        dispatch("progress", snapshot, listener -> listener.onProgress(snapshot));
    }

    public void broadcastResult(SessionResult result) {
        dispatch("result", result, listener -> listener.onResult(result));
    }

    /**
     * Most recent log entries, oldest first.
     */
    public List<LogEntry> getRecentLog() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public int getActiveConnections() {
        return emitters.size();
    }

    private void dispatch(String eventName, Object payload, Consumer<SessionEventListener> delivery) {
        try {
            eventExecutor.execute(() -> {
                broadcastToSse(eventName, payload);
                broadcastToListeners(delivery);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Event queue full, dropping {} event", eventName);
        }
    }

    private void broadcastToSse(String eventName, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(eventName)
                        .data(payload));
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }
    }

    private void broadcastToListeners(Consumer<SessionEventListener> delivery) {
        for (SessionEventListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (Exception e) {
                log.error("Error in event listener: {}", e.getMessage(), e);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }
}
