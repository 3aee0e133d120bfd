package com.github.revdownloader.service.session;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.DownloadException;
import com.github.revdownloader.exception.MetadataResolutionException;
import com.github.revdownloader.exception.SessionNotFoundException;
import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.model.DownloadSession;
import com.github.revdownloader.model.DownloadType;
import com.github.revdownloader.model.LogLevel;
import com.github.revdownloader.model.SessionOutcome;
import com.github.revdownloader.model.SessionResult;
import com.github.revdownloader.service.EventBroadcastService;
import com.github.revdownloader.service.PlatformDetector;
import com.github.revdownloader.service.backend.YtDlpProcessExecutor;
import com.github.revdownloader.service.coordinator.ConcurrencyCoordinator;
import com.github.revdownloader.service.coordinator.DownloadPlan;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs download sessions end to end: preconditions, metadata resolution, the
 * concurrent download and the final report. At most one session is active at a
 * time; it runs on the session executor while the caller gets its id back.
 */
@Slf4j
@Service
public class SessionController {

    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern(DownloadConstants.SESSION_ID_PATTERN);

    private final SessionPreconditions preconditions;
    private final MetadataResolver metadataResolver;
    private final ConcurrencyCoordinator coordinator;
    private final EventBroadcastService eventBroadcastService;
    private final YtDlpProcessExecutor processExecutor;
    private final PlatformDetector platformDetector;
    private final DownloaderProperties properties;
    private final Clock clock;
    private final Executor sessionExecutor;

    private final AtomicReference<DownloadSession> activeSession = new AtomicReference<>();
    private final Map<String, DownloadSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, SessionResult> results = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();
    private Instant lastStart;

    public SessionController(SessionPreconditions preconditions,
                             MetadataResolver metadataResolver,
                             ConcurrencyCoordinator coordinator,
                             EventBroadcastService eventBroadcastService,
                             YtDlpProcessExecutor processExecutor,
                             PlatformDetector platformDetector,
                             DownloaderProperties properties,
                             Clock clock,
                             @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.preconditions = preconditions;
        this.metadataResolver = metadataResolver;
        this.coordinator = coordinator;
        this.eventBroadcastService = eventBroadcastService;
        this.processExecutor = processExecutor;
        this.platformDetector = platformDetector;
        this.properties = properties;
        this.clock = clock;
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Start a session in the background.
     *
     * @param url URL as entered by the user; the scheme may be missing
     * @param requestedOptions Format choices, null for defaults
     * @return Id of the new session
     * @throws com.github.revdownloader.exception.SessionRejectedException if a precondition fails
     */
    public synchronized String startSession(String url, DownloadOptions requestedOptions) {
        DownloadOptions options = requestedOptions != null ? requestedOptions : DownloadOptions.builder().build();
        Path outputDirectory = outputDirectory(options);
        Instant now = clock.instant();

        String normalizedUrl = preconditions.check(url, outputDirectory, activeSession.get() != null, lastStart, now);
        lastStart = now;

        DownloadSession session = DownloadSession.builder()
                .sessionId(newSessionId())
                .url(normalizedUrl)
                .platform(platformDetector.platformName(normalizedUrl))
                .build();
        session.setStartTime(LocalDateTime.now(clock));

        sessions.put(session.getSessionId(), session);
        activeSession.set(session);
        log.info("Session {} created for {}", session.getSessionId(), normalizedUrl);
        eventBroadcastService.log(session.getSessionId(), LogLevel.DOWNLOAD,
                String.format("[%s] Starting download...", session.getPlatform()));

        try {
            sessionExecutor.execute(() -> runSession(session, options, outputDirectory));
        } catch (RejectedExecutionException e) {
            activeSession.compareAndSet(session, null);
            sessions.remove(session.getSessionId());
            throw new DownloadException(DownloadErrorType.ALREADY_DOWNLOADING, "Session executor is busy", e);
        }
        return session.getSessionId();
    }

    /**
     * Cancel a session. Safe to call any number of times.
     *
     * @return true if this call cancelled the session, false if it was already
     *         cancelled or has already finished
     * @throws SessionNotFoundException if no such session exists
     */
    public boolean cancel(@NonNull String sessionId) {
        DownloadSession session = getSession(sessionId);
        synchronized (finished) {
            if (results.containsKey(sessionId)) {
                log.debug("Session {} already finished, nothing to cancel", sessionId);
                return false;
            }
            if (!session.getCancellation().cancel()) {
                log.debug("Session {} already cancelled", sessionId);
                return false;
            }
        }
        eventBroadcastService.log(sessionId, LogLevel.WARNING, "Cancelling download...");
        int killed = processExecutor.cancelSession(sessionId);
        log.info("Session {} cancelled, {} backend process(es) killed", sessionId, killed);
        return true;
    }

    public DownloadSession getSession(@NonNull String sessionId) {
        DownloadSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Final result of a session, empty while it is still running.
     */
    public Optional<SessionResult> getResult(@NonNull String sessionId) {
        getSession(sessionId);
        return Optional.ofNullable(results.get(sessionId));
    }

    public Optional<DownloadSession> getActiveSession() {
        return Optional.ofNullable(activeSession.get());
    }

    public boolean isActive(@NonNull String sessionId) {
        DownloadSession active = activeSession.get();
        return active != null && active.getSessionId().equals(sessionId);
    }

    private void runSession(DownloadSession session, DownloadOptions options, Path outputDirectory) {
        try {
            ResolvedMedia media = metadataResolver.resolve(session, options);
            session.getItems().addAll(media.getItems());

            int concurrency = options.getConcurrency() != null
                    ? options.getConcurrency()
                    : properties.getDownload().getConcurrency();
            logSettings(session, options, concurrency);
            if (media.isPlaylist()) {
                eventBroadcastService.log(session.getSessionId(), LogLevel.INFO,
                        String.format("Playlist: %s (%d items)",
                                FormatUtils.truncate(media.getPlaylistTitle(), DownloadConstants.TITLE_DISPLAY_LENGTH),
                                media.getItems().size()));
            }

            DownloadPlan plan = DownloadPlan.builder()
                    .options(options)
                    .concurrency(concurrency)
                    .outputDirectory(outputDirectory)
                    .playlistTitle(media.getPlaylistTitle())
                    .itemTimeout(Duration.ofSeconds(properties.getDownload().getItemTimeoutSeconds()))
                    .build();
            coordinator.run(session, plan);

            finish(session, options);
        } catch (MetadataResolutionException e) {
            if (e.getErrorType() == DownloadErrorType.CANCELLED || session.isCancelled()) {
                finish(session, options);
            } else {
                fail(session, e.getErrorType(), e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Session {} failed: {}", session.getSessionId(), e.getMessage(), e);
            fail(session, DownloadErrorType.BACKEND_ERROR, e.getMessage());
        } finally {
            activeSession.compareAndSet(session, null);
        }
    }

    private void finish(DownloadSession session, DownloadOptions options) {
        session.setEndTime(LocalDateTime.now(clock));
        SessionOutcome outcome = classify(session);
        SessionResult result = SessionResult.of(session, outcome);
        String sessionId = session.getSessionId();

        switch (outcome) {
            case CANCELLED -> eventBroadcastService.log(sessionId, LogLevel.WARNING,
                    String.format("Download cancelled (%d completed, %d failed)", result.getCompleted(), result.getFailed()));
            case ALL_SUCCEEDED -> eventBroadcastService.log(sessionId, LogLevel.SUCCESS,
                    String.format(Locale.ROOT, "Complete: %d %s in %.1fs", result.getCompleted(),
                            options.getDownloadType().getItemLabel(), result.getDurationSeconds()));
            default -> eventBroadcastService.log(sessionId, LogLevel.WARNING,
                    String.format("Completed: %d, Failed: %d", result.getCompleted(), result.getFailed()));
        }
        publish(session, result);
    }

    private void fail(DownloadSession session, DownloadErrorType errorType, String message) {
        session.setEndTime(LocalDateTime.now(clock));
        String text = message != null && !message.isBlank() ? message : errorType.getDescription();
        eventBroadcastService.log(session.getSessionId(), LogLevel.ERROR,
                "Error: " + FormatUtils.truncate(text, DownloadConstants.SESSION_ERROR_DISPLAY_LENGTH));
        publish(session, SessionResult.failed(session, errorType, text));
    }

    private void publish(DownloadSession session, SessionResult result) {
        retain(session.getSessionId(), result);
        activeSession.compareAndSet(session, null);
        log.info("Session {} finished: {} ({} completed, {} failed of {})", session.getSessionId(),
                result.getOutcome(), result.getCompleted(), result.getFailed(), result.getTotal());
        eventBroadcastService.broadcastResult(result);
    }

    // Keeps the most recent finished sessions, dropping the oldest
    private void retain(String sessionId, SessionResult result) {
        int limit = properties.getDownload().getSessionHistorySize();
        synchronized (finished) {
            results.put(sessionId, result);
            finished.addLast(sessionId);
            while (finished.size() > limit) {
                String evicted = finished.removeFirst();
                sessions.remove(evicted);
                results.remove(evicted);
                log.debug("Session {} dropped from history", evicted);
            }
        }
    }

    /**
     * Outcome once every worker has stopped. Cancellation wins; otherwise a
     * session only fails outright when nothing succeeded.
     */
    static SessionOutcome classify(DownloadSession session) {
        if (session.isCancelled()) {
            return SessionOutcome.CANCELLED;
        }
        int total = session.getItems().size();
        int completed = session.getCompletedCount();
        if (total > 0 && completed == total) {
            return SessionOutcome.ALL_SUCCEEDED;
        }
        return completed > 0 ? SessionOutcome.PARTIAL_FAILURE : SessionOutcome.FAILED;
    }

    private void logSettings(DownloadSession session, DownloadOptions options, int concurrency) {
        String settings;
        if (options.getDownloadType() == DownloadType.VIDEO) {
            settings = String.format("%s | Video | %s | %s | Concurrent: %d | Items: %d", session.getPlatform(),
                    options.getResolution(), options.getVideoFormat().toUpperCase(Locale.ROOT), concurrency,
                    session.getItems().size());
        } else {
            settings = String.format("%s | Audio | %s | %s | Concurrent: %d | Items: %d", session.getPlatform(),
                    options.getAudioFormat().toUpperCase(Locale.ROOT), options.getAudioQuality(), concurrency,
                    session.getItems().size());
        }
        eventBroadcastService.log(session.getSessionId(), LogLevel.INFO, settings);
    }

    private Path outputDirectory(DownloadOptions options) {
        String directory = options.getOutputDirectory() != null && !options.getOutputDirectory().isBlank()
                ? options.getOutputDirectory()
                : properties.getDownload().getPath();
        return Paths.get(directory).toAbsolutePath();
    }

    private String newSessionId() {
        String base = LocalDateTime.now(clock).format(SESSION_ID_FORMAT);
        String id = base;
        for (int suffix = 2; sessions.containsKey(id); suffix++) {
            id = base + "_" + suffix;
        }
        return id;
    }
}
