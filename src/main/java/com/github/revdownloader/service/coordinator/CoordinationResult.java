package com.github.revdownloader.service.coordinator;

import com.github.revdownloader.model.ProgressSnapshot;
import lombok.Builder;
import lombok.Data;

/**
 * Counts reported by the coordinator once every worker has stopped.
 */
@Data
@Builder
public class CoordinationResult {

    private final int completed;
    private final int failed;
    private final int cancelled;

    /**
     * Items never handed to a backend; they stay PENDING.
     */
    private final int notStarted;

    private final boolean sessionCancelled;

    private final ProgressSnapshot finalProgress;
}
