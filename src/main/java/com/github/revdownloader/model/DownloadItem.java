package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One downloadable unit (track or video) inside a session.
 * Status and the fields that accompany it are changed only through
 * {@link com.github.revdownloader.service.state.ItemStateMachine}.
 */
@Data
@Builder
public class DownloadItem {

    private final String url;
    private final int index;

    @Builder.Default
    private final String title = "";

    @Builder.Default
    private volatile DownloadStatus status = DownloadStatus.PENDING;

    private volatile int retryCount;

    private volatile String errorMessage;
    private volatile DownloadErrorType errorType;

    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;

    private volatile String filePath;

    public String getDisplayName() {
        return title != null && !title.isBlank() ? title : "Item " + index;
    }

    public boolean isCompleted() {
        return status == DownloadStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == DownloadStatus.FAILED;
    }

    public boolean isActive() {
        return status == DownloadStatus.DOWNLOADING || status == DownloadStatus.RETRYING;
    }

    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }
}
