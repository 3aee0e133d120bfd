package com.github.revdownloader.service.coordinator;

import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.service.retry.RetryOutcome;
import lombok.Getter;

/**
 * Message from a worker to the coordinator. Workers never touch progress state
 * themselves; they only post these.
 */
@Getter
final class WorkerEvent {

    enum Type {
        /** Worker picked the item up. */
        STARTED,
        /** Backend progress sample. */
        PROGRESS,
        /** Worker saw the session cancelled before starting the item. */
        SKIPPED,
        /** Worker is done with the item. */
        DONE
    }

    private final Type type;
    private final int itemIndex;
    private final BackendProgress progress;
    private final RetryOutcome<DownloadedMedia> outcome;

    private WorkerEvent(Type type, int itemIndex, BackendProgress progress, RetryOutcome<DownloadedMedia> outcome) {
        this.type = type;
        this.itemIndex = itemIndex;
        this.progress = progress;
        this.outcome = outcome;
    }

    static WorkerEvent started(int itemIndex) {
        return new WorkerEvent(Type.STARTED, itemIndex, null, null);
    }

    static WorkerEvent progress(int itemIndex, BackendProgress progress) {
        return new WorkerEvent(Type.PROGRESS, itemIndex, progress, null);
    }

    static WorkerEvent skipped(int itemIndex) {
        return new WorkerEvent(Type.SKIPPED, itemIndex, null, null);
    }

    static WorkerEvent done(int itemIndex, RetryOutcome<DownloadedMedia> outcome) {
        return new WorkerEvent(Type.DONE, itemIndex, null, outcome);
    }
}
