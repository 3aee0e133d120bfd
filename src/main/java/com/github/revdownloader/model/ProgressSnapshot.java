package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Aggregate progress view for a whole session.
 */
@Data
@Builder
public class ProgressSnapshot {

    private String sessionId;

    /**
     * Overall progress in [0, 1].
     */
    private double progress;

    private double speedBytesPerSecond;
    private Long etaSeconds;

    // Human readable: "1.2MB/s", "3m 12s"
    private String speed;
    private String eta;

    private int completedItems;
    private int totalItems;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public double getPercent() {
        return progress * 100.0;
    }
}
