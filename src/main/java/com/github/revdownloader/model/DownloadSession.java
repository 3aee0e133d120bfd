package com.github.revdownloader.model;

import com.github.revdownloader.service.coordinator.CancellationToken;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One user-initiated download covering one or many items. Lives only as long
 * as the controller is reporting on it.
 */
@Data
@Builder
public class DownloadSession {

    private final String sessionId;
    private final String url;
    private final String platform;

    @Builder.Default
    private List<DownloadItem> items = new CopyOnWriteArrayList<>();

    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;

    // Size of completed files, when the backend reports it
    @Builder.Default
    private final AtomicLong downloadedBytes = new AtomicLong();

    @Builder.Default
    private final CancellationToken cancellation = new CancellationToken();

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public int getCompletedCount() {
        return (int) items.stream().filter(DownloadItem::isCompleted).count();
    }

    public int getFailedCount() {
        return (int) items.stream().filter(DownloadItem::isFailed).count();
    }

    public int getCancelledCount() {
        return (int) items.stream().filter(item -> item.getStatus() == DownloadStatus.CANCELLED).count();
    }

    public int getPendingCount() {
        return (int) items.stream().filter(item -> item.getStatus() == DownloadStatus.PENDING).count();
    }

    /**
     * Fraction of items completed, 0 for an empty session.
     */
    public double getProgress() {
        if (items.isEmpty()) {
            return 0.0;
        }
        return (double) getCompletedCount() / items.size();
    }

    public Duration getDuration() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        LocalDateTime end = endTime != null ? endTime : LocalDateTime.now();
        return Duration.between(startTime, end);
    }
}
