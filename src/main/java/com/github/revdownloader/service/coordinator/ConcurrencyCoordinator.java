package com.github.revdownloader.service.coordinator;

import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.model.DownloadItem;
import com.github.revdownloader.model.DownloadSession;
import com.github.revdownloader.model.DownloadStatus;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.model.LogLevel;
import com.github.revdownloader.model.ProgressSnapshot;
import com.github.revdownloader.service.EventBroadcastService;
import com.github.revdownloader.service.backend.ItemDownloadRequest;
import com.github.revdownloader.service.backend.MediaBackend;
import com.github.revdownloader.service.progress.ProgressAggregator;
import com.github.revdownloader.service.retry.AttemptObserver;
import com.github.revdownloader.service.retry.RetryExecutor;
import com.github.revdownloader.service.retry.RetryOutcome;
import com.github.revdownloader.service.state.ItemStateMachine;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Downloads the items of a session with a bounded number of workers.
 *
 * <p>Items are handed to the pool in index order. With one worker (concurrency 1
 * or a single item) that makes processing strictly sequential; with more,
 * completion order is arbitrary. Workers only post {@link WorkerEvent}s; the
 * calling thread drains them, owns the {@link ProgressAggregator} and the
 * success/failure counters, settles each item's final state and enforces the
 * per-item deadline.</p>
 *
 * <p>On session cancellation queued items are never started and stay PENDING,
 * and items already downloading end up CANCELLED. A timed-out item is marked
 * FAILED with {@link DownloadErrorType#TIMEOUT}; its backend call is cancelled
 * through an item-level token and the other workers carry on.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConcurrencyCoordinator {

    private final MediaBackend mediaBackend;
    private final RetryExecutor retryExecutor;
    private final ItemStateMachine stateMachine;
    private final EventBroadcastService eventBroadcastService;
    private final Clock clock;

    /**
     * Download every item of the session and return once all of them are
     * settled or were never started. Blocks the calling thread.
     */
    public CoordinationResult run(@NonNull DownloadSession session, @NonNull DownloadPlan plan) {
        if (plan.getConcurrency() < 1) {
            throw new IllegalArgumentException("Concurrency must be >= 1, was " + plan.getConcurrency());
        }
        return new Run(session, plan).execute();
    }

    /**
     * State of one coordinator run. Everything except the event queue is
     * touched only by the coordinating thread.
     */
    private final class Run {

        private final DownloadSession session;
        private final DownloadPlan plan;
        private final List<DownloadItem> items;
        private final int total;
        private final ProgressAggregator aggregator;
        private final BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();
        private final Map<Integer, ItemTask> outstanding = new LinkedHashMap<>();

        private ThreadPoolExecutor pool;
        private int completed;
        private int failed;
        private int cancelled;
        private int notStarted;
        private boolean cancellationHandled;
        private Instant lastBroadcast;

        private Run(DownloadSession session, DownloadPlan plan) {
            this.session = session;
            this.plan = plan;
            this.items = session.getItems();
            this.total = items.size();
            this.aggregator = new ProgressAggregator(session.getSessionId(), total, clock);
        }

        private CoordinationResult execute() {
            if (total == 0) {
                return result();
            }

            int workers = plan.getConcurrency() == 1 || total == 1 ? 1 : plan.getConcurrency();
            log.info("Session {}: downloading {} item(s) with {} worker(s)", session.getSessionId(), total, workers);

            pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                    new CustomizableThreadFactory("worker-" + session.getSessionId() + "-"));
            try {
                for (DownloadItem item : items) {
                    ItemTask task = new ItemTask(item, session.getCancellation().child());
                    outstanding.put(item.getIndex(), task);
                    pool.execute(task);
                }

                while (!outstanding.isEmpty()) {
                    WorkerEvent event = events.poll(DownloadConstants.EVENT_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                    while (event != null) {
                        handle(event);
                        event = events.poll();
                    }
                    if (session.isCancelled()) {
                        handleCancellation();
                    }
                    checkDeadlines();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Session {}: coordinator interrupted, cancelling remaining items", session.getSessionId());
                session.getCancellation().cancel();
                abandonOutstanding();
            } finally {
                pool.shutdownNow();
            }

            broadcast(aggregator.snapshot(), true);
            return result();
        }

        private void handle(WorkerEvent event) {
            ItemTask task = outstanding.get(event.getItemIndex());
            if (task == null) {
                // Item already settled by a timeout; late events are dropped
                return;
            }
            DownloadItem item = task.item;

            switch (event.getType()) {
                case STARTED -> {
                    task.deadline = clock.instant().plus(plan.getItemTimeout());
                    eventBroadcastService.log(session.getSessionId(), LogLevel.DOWNLOAD,
                            String.format("[%d/%d] Downloading: %s", item.getIndex(), total, displayTitle(item)));
                }
                case PROGRESS -> broadcast(aggregator.onProgress(item.getIndex(), event.getProgress()), false);
                case SKIPPED -> {
                    outstanding.remove(item.getIndex());
                    notStarted++;
                }
                case DONE -> {
                    outstanding.remove(item.getIndex());
                    settle(item, event.getOutcome());
                }
            }
        }

        private void settle(DownloadItem item, RetryOutcome<DownloadedMedia> outcome) {
            if (outcome.isSuccess()) {
                DownloadedMedia media = outcome.getValue();
                if (stateMachine.markCompleted(item, media != null ? media.getFilePath() : null)) {
                    completed++;
                    if (media != null && media.getSizeBytes() != null) {
                        session.getDownloadedBytes().addAndGet(media.getSizeBytes());
                    }
                    eventBroadcastService.log(session.getSessionId(), LogLevel.SUCCESS,
                            String.format("[%d] %s (%d/%d)", item.getIndex(), displayTitle(item), completed, total));
                }
                broadcast(aggregator.onItemFinished(item.getIndex()), true);
            } else if (outcome.isCancelled()) {
                if (item.getStatus() == DownloadStatus.PENDING) {
                    notStarted++;
                } else if (stateMachine.markCancelled(item)) {
                    cancelled++;
                }
                broadcast(aggregator.onItemAbandoned(item.getIndex()), true);
            } else {
                if (stateMachine.markFailed(item, outcome.getErrorType(), outcome.getErrorMessage())) {
                    failed++;
                    log.error("Session {}: item {} failed after {} attempt(s): {}", session.getSessionId(),
                            item.getIndex(), outcome.getAttempts(), outcome.getErrorMessage());
                    eventBroadcastService.log(session.getSessionId(), LogLevel.ERROR,
                            String.format("[%d] Failed: %s", item.getIndex(), outcome.getDisplayMessage()));
                }
                broadcast(aggregator.onItemFinished(item.getIndex()), true);
            }
        }

        private void handleCancellation() {
            if (cancellationHandled) {
                return;
            }
            cancellationHandled = true;

            // Queued tasks are returned without ever running; running ones get interrupted
            List<Runnable> unstarted = pool.shutdownNow();
            for (Runnable runnable : unstarted) {
                if (runnable instanceof ItemTask) {
                    ItemTask task = (ItemTask) runnable;
                    if (outstanding.remove(task.item.getIndex()) != null) {
                        notStarted++;
                    }
                }
            }
            log.info("Session {}: cancelled, {} item(s) will not be started, {} still stopping",
                    session.getSessionId(), unstarted.size(), outstanding.size());
        }

        private void checkDeadlines() {
            Instant now = clock.instant();
            Iterator<ItemTask> iterator = outstanding.values().iterator();
            while (iterator.hasNext()) {
                ItemTask task = iterator.next();
                if (task.deadline == null || !now.isAfter(task.deadline)) {
                    continue;
                }
                iterator.remove();
                task.token.cancel();
                task.abandon();
                timeOut(task.item);
            }
        }

        private void timeOut(DownloadItem item) {
            if (session.isCancelled()) {
                if (stateMachine.markCancelled(item)) {
                    cancelled++;
                }
                broadcast(aggregator.onItemAbandoned(item.getIndex()), true);
                return;
            }

            long seconds = plan.getItemTimeout().toSeconds();
            String message = "Download timed out after " + seconds + "s";
            if (stateMachine.markFailed(item, DownloadErrorType.TIMEOUT, message)) {
                failed++;
                log.warn("Session {}: item {} timed out after {}s", session.getSessionId(), item.getIndex(), seconds);
                eventBroadcastService.log(session.getSessionId(), LogLevel.ERROR,
                        String.format("[%d] Failed: %s", item.getIndex(), message));
            }
            broadcast(aggregator.onItemFinished(item.getIndex()), true);
        }

        private void abandonOutstanding() {
            for (ItemTask task : outstanding.values()) {
                task.token.cancel();
                DownloadItem item = task.item;
                if (item.getStatus() == DownloadStatus.PENDING) {
                    notStarted++;
                } else if (stateMachine.markCancelled(item)) {
                    cancelled++;
                }
                aggregator.onItemAbandoned(item.getIndex());
            }
            outstanding.clear();
        }

        private void resizePool(int delta) {
            synchronized (pool) {
                if (pool.isShutdown()) {
                    return;
                }
                if (delta > 0) {
                    pool.setMaximumPoolSize(pool.getMaximumPoolSize() + delta);
                    pool.setCorePoolSize(pool.getCorePoolSize() + delta);
                } else {
                    pool.setCorePoolSize(pool.getCorePoolSize() + delta);
                    pool.setMaximumPoolSize(pool.getMaximumPoolSize() + delta);
                }
            }
        }

        private void broadcast(ProgressSnapshot snapshot, boolean force) {
            Instant now = clock.instant();
            if (!force && lastBroadcast != null
                    && Duration.between(lastBroadcast, now).compareTo(DownloadConstants.EVENT_POLL_INTERVAL) < 0) {
                return;
            }
            lastBroadcast = now;
            eventBroadcastService.broadcastProgress(snapshot);
        }

        private CoordinationResult result() {
            return CoordinationResult.builder()
                    .completed(completed)
                    .failed(failed)
                    .cancelled(cancelled)
                    .notStarted(notStarted)
                    .sessionCancelled(session.isCancelled())
                    .finalProgress(aggregator.snapshot())
                    .build();
        }

        /**
         * One item on a worker thread.
         */
        private final class ItemTask implements Runnable {

            private final DownloadItem item;
            private final CancellationToken token;

            // Coordinator thread only
            private Instant deadline;

            private Thread runner;
            private boolean finished;
            private boolean replaced;

            private ItemTask(DownloadItem item, CancellationToken token) {
                this.item = item;
                this.token = token;
            }

            @Override
            public void run() {
                synchronized (this) {
                    runner = Thread.currentThread();
                }
                try {
                    if (token.isCancelled()) {
                        events.add(WorkerEvent.skipped(item.getIndex()));
                        return;
                    }
                    events.add(WorkerEvent.done(item.getIndex(), download()));
                } catch (RuntimeException e) {
                    log.error("Unexpected error downloading item {}: {}", item.getIndex(), e.getMessage(), e);
                    events.add(WorkerEvent.done(item.getIndex(),
                            RetryOutcome.failure(DownloadErrorType.BACKEND_ERROR, e.getMessage(), e, 0)));
                } finally {
                    boolean shrink;
                    synchronized (this) {
                        runner = null;
                        finished = true;
                        shrink = replaced;
                    }
                    if (shrink) {
                        resizePool(-1);
                    }
                    // Do not leak a timeout interrupt into the next task on this thread
                    Thread.interrupted();
                }
            }

            private RetryOutcome<DownloadedMedia> download() {
                ItemDownloadRequest request = ItemDownloadRequest.builder()
                        .sessionId(session.getSessionId())
                        .itemIndex(item.getIndex())
                        .url(item.getUrl())
                        .options(plan.getOptions())
                        .outputDirectory(plan.getOutputDirectory())
                        .playlistTitle(plan.getPlaylistTitle())
                        .cancellation(token)
                        .build();

                return retryExecutor.execute(item.getUrl(), attempt -> {
                    if (!stateMachine.startAttempt(item)) {
                        throw new BackendException("Item " + item.getIndex() + " is no longer active", item.getUrl());
                    }
                    if (attempt == 0) {
                        events.add(WorkerEvent.started(item.getIndex()));
                    }
                    return mediaBackend.download(request,
                            sample -> events.add(WorkerEvent.progress(item.getIndex(), sample)));
                }, token, new ItemAttemptObserver(item));
            }

            /**
             * Interrupt the worker after a timeout. Until it actually returns,
             * an extra pool thread takes its place so queued items keep moving.
             */
            private synchronized void abandon() {
                if (runner == null || finished) {
                    return;
                }
                runner.interrupt();
                replaced = true;
                resizePool(1);
            }
        }

        private final class ItemAttemptObserver implements AttemptObserver {

            private final DownloadItem item;

            private ItemAttemptObserver(DownloadItem item) {
                this.item = item;
            }

            @Override
            public void attemptFailed(int attempt, DownloadErrorType errorType, String errorMessage) {
                stateMachine.recordFailedAttempt(item);
            }

            @Override
            public void retryScheduled(int nextAttempt, Duration delay, DownloadErrorType errorType) {
                stateMachine.markRetrying(item);
                String reason = errorType == DownloadErrorType.RATE_LIMITED ? " (rate limit suspected)" : "";
                eventBroadcastService.log(session.getSessionId(), LogLevel.WARNING,
                        String.format("[%d] Retry %d/%d in %ds%s", item.getIndex(), nextAttempt + 1,
                                retryExecutor.getMaxAttempts(), delay.toSeconds(), reason));
            }
        }
    }

    private static String displayTitle(DownloadItem item) {
        return FormatUtils.truncate(item.getDisplayName(), DownloadConstants.TITLE_DISPLAY_LENGTH);
    }
}
