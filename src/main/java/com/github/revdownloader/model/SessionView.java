package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only view of a session for API clients.
 */
@Data
@Builder
public class SessionView {

    private final String sessionId;
    private final String url;
    private final String platform;
    private final boolean active;
    private final boolean cancelled;
    private final double progress;
    private final int completed;
    private final int failed;
    private final int pending;
    private final int total;
    private final long downloadedBytes;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final List<DownloadItem> items;

    public static SessionView of(DownloadSession session, boolean active) {
        return SessionView.builder()
                .sessionId(session.getSessionId())
                .url(session.getUrl())
                .platform(session.getPlatform())
                .active(active)
                .cancelled(session.isCancelled())
                .progress(session.getProgress())
                .completed(session.getCompletedCount())
                .failed(session.getFailedCount())
                .pending(session.getPendingCount())
                .total(session.getItems().size())
                .downloadedBytes(session.getDownloadedBytes().get())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .items(List.copyOf(session.getItems()))
                .build();
    }
}
