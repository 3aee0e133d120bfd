package com.github.revdownloader.service.retry;

import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.FormatUtils;
import lombok.Builder;
import lombok.Data;

/**
 * Result of running an operation through {@link RetryExecutor}.
 *
 * @param <T> Value type on success
 */
@Data
@Builder
public class RetryOutcome<T> {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    private final Status status;
    private final T value;

    /**
     * Classification of the last failure; null on success.
     */
    private final DownloadErrorType errorType;

    /**
     * Full text of the last failure, kept for logs.
     */
    private final String errorMessage;

    private final Throwable cause;

    /**
     * Number of attempts that actually ran.
     */
    private final int attempts;

    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return RetryOutcome.<T>builder()
                .status(Status.SUCCEEDED)
                .value(value)
                .attempts(attempts)
                .build();
    }

    public static <T> RetryOutcome<T> failure(DownloadErrorType errorType, String errorMessage,
                                              Throwable cause, int attempts) {
        return RetryOutcome.<T>builder()
                .status(Status.FAILED)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .cause(cause)
                .attempts(attempts)
                .build();
    }

    public static <T> RetryOutcome<T> cancelled(int attempts) {
        return RetryOutcome.<T>builder()
                .status(Status.CANCELLED)
                .errorType(DownloadErrorType.CANCELLED)
                .errorMessage(DownloadErrorType.CANCELLED.getDescription())
                .attempts(attempts)
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Error message cut down for display.
     */
    public String getDisplayMessage() {
        return FormatUtils.truncate(errorMessage, DownloadConstants.ITEM_ERROR_DISPLAY_LENGTH);
    }
}
