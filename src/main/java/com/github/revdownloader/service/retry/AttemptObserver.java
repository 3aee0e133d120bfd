package com.github.revdownloader.service.retry;

import com.github.revdownloader.model.DownloadErrorType;

import java.time.Duration;

/**
 * Callbacks from {@link RetryExecutor} so callers can log and update state
 * around retries. Both methods run on the thread executing the operation.
 */
public interface AttemptObserver {

    AttemptObserver NONE = new AttemptObserver() {
    };

    /**
     * Called after every failed attempt, retryable or not.
     */
    default void attemptFailed(int attempt, DownloadErrorType errorType, String errorMessage) {
    }

    /**
     * Called right before sleeping ahead of the next attempt.
     *
     * @param nextAttempt Zero-based number of the attempt that follows the sleep
     * @param delay How long the executor is about to sleep
     * @param errorType Classification of the failure that caused the retry
     */
    default void retryScheduled(int nextAttempt, Duration delay, DownloadErrorType errorType) {
    }
}
