package com.github.revdownloader.service.progress;

import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.ProgressSnapshot;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns per-item progress samples into one overall progress, speed and ETA
 * view for a session.
 *
 * <p>Overall progress is {@code (finishedItems + sum of in-flight item fractions) / totalItems},
 * capped at 1. Speed is recalculated per item at most once per
 * {@link DownloadConstants#SPEED_SAMPLE_INTERVAL}; the session speed is the sum
 * over in-flight items. An item's fraction never goes down while it is in flight
 * and the finished count never goes down at all.</p>
 *
 * <p>All state sits behind this object's monitor. The aggregator knows nothing
 * about retries or platforms.</p>
 */
@Slf4j
public class ProgressAggregator {

    private final String sessionId;
    private final int totalItemCount;
    private final Clock clock;

    private final Map<Integer, ItemProgress> inFlight = new HashMap<>();
    private int completedItemCount;

    public ProgressAggregator(String sessionId, int totalItemCount, Clock clock) {
        this.sessionId = sessionId;
        this.totalItemCount = Math.max(totalItemCount, 0);
        this.clock = clock;
    }

    /**
     * Apply a progress sample for one item.
     */
    public synchronized ProgressSnapshot onProgress(int itemIndex, BackendProgress sample) {
        ItemProgress item = inFlight.computeIfAbsent(itemIndex, k -> new ItemProgress());

        if (sample.getPhase() == BackendProgress.Phase.FINISHED) {
            // The backend finished a file; the item is settled only when the worker reports it
            item.fraction = 1.0;
            item.downloadedBytes = Math.max(item.downloadedBytes, sample.getDownloadedBytes());
            return snapshot();
        }

        Long knownTotal = sample.getKnownTotalBytes();
        double fraction;
        if (knownTotal != null) {
            fraction = Math.min((double) sample.getDownloadedBytes() / knownTotal, 1.0);
            item.totalBytes = knownTotal;
        } else if (sample.hasFragments()) {
            fraction = Math.min((double) sample.getFragmentIndex() / sample.getFragmentCount(), 1.0);
        } else if (sample.getFraction() != null) {
            fraction = Math.max(0.0, Math.min(sample.getFraction(), 1.0));
        } else {
            fraction = DownloadConstants.UNKNOWN_EXTENT_FRACTION;
        }
        item.fraction = Math.max(item.fraction, fraction);
        item.downloadedBytes = sample.getDownloadedBytes();

        sampleSpeed(item, sample.getDownloadedBytes());
        return snapshot();
    }

    /**
     * An item reached a terminal state other than cancelled. Its in-flight state
     * is dropped and it counts as finished.
     */
    public synchronized ProgressSnapshot onItemFinished(int itemIndex) {
        inFlight.remove(itemIndex);
        if (completedItemCount < totalItemCount) {
            completedItemCount++;
        } else {
            log.warn("Session {} reported more finished items than the {} it has", sessionId, totalItemCount);
        }
        return snapshot();
    }

    /**
     * An item was cancelled; forget its partial progress without counting it.
     */
    public synchronized ProgressSnapshot onItemAbandoned(int itemIndex) {
        inFlight.remove(itemIndex);
        return snapshot();
    }

    public synchronized ProgressSnapshot snapshot() {
        double inFlightFraction = 0.0;
        double speed = 0.0;
        long remainingBytes = 0;
        boolean sizeKnown = false;

        for (ItemProgress item : inFlight.values()) {
            inFlightFraction += item.fraction;
            speed += item.speedBytesPerSecond;
            if (item.totalBytes != null) {
                sizeKnown = true;
                remainingBytes += Math.max(item.totalBytes - item.downloadedBytes, 0);
            }
        }

        double overall = Math.min((completedItemCount + inFlightFraction) / Math.max(totalItemCount, 1), 1.0);

        Long etaSeconds = null;
        if (speed > 0 && sizeKnown) {
            etaSeconds = (long) (remainingBytes / speed);
        }

        return ProgressSnapshot.builder()
                .sessionId(sessionId)
                .progress(overall)
                .speedBytesPerSecond(speed)
                .speed(speed > 0 ? FormatUtils.formatSpeed(speed) : null)
                .etaSeconds(etaSeconds)
                .eta(etaSeconds != null ? FormatUtils.formatEta(etaSeconds) : null)
                .completedItems(completedItemCount)
                .totalItems(totalItemCount)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    public synchronized int getCompletedItemCount() {
        return completedItemCount;
    }

    public int getTotalItemCount() {
        return totalItemCount;
    }

    /**
     * Fraction of the given in-flight item, 0 if it is not in flight.
     */
    public synchronized double getItemFraction(int itemIndex) {
        ItemProgress item = inFlight.get(itemIndex);
        return item != null ? item.fraction : 0.0;
    }

    public synchronized double getSpeedBytesPerSecond() {
        return inFlight.values().stream().mapToDouble(item -> item.speedBytesPerSecond).sum();
    }

    private void sampleSpeed(ItemProgress item, long bytesNow) {
        Instant now = clock.instant();
        if (item.lastSampleTime == null) {
            item.lastSampleTime = now;
            item.lastSampleBytes = bytesNow;
            return;
        }

        Duration elapsed = Duration.between(item.lastSampleTime, now);
        if (elapsed.compareTo(DownloadConstants.SPEED_SAMPLE_INTERVAL) < 0) {
            return;
        }

        // A new file within the same item restarts the byte counter
        if (bytesNow >= item.lastSampleBytes) {
            double seconds = elapsed.toNanos() / 1_000_000_000.0;
            item.speedBytesPerSecond = (bytesNow - item.lastSampleBytes) / seconds;
        }
        item.lastSampleTime = now;
        item.lastSampleBytes = bytesNow;
    }

    private static final class ItemProgress {
        private double fraction;
        private long downloadedBytes;
        private Long totalBytes;
        private Instant lastSampleTime;
        private long lastSampleBytes;
        private double speedBytesPerSecond;
    }
}
