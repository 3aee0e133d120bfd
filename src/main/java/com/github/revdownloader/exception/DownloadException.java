package com.github.revdownloader.exception;

import com.github.revdownloader.model.DownloadErrorType;

/**
 * Base exception for all download-related errors.
 */
public class DownloadException extends RuntimeException {

    private final DownloadErrorType errorType;

    public DownloadException(String message) {
        this(DownloadErrorType.BACKEND_ERROR, message);
    }

    public DownloadException(String message, Throwable cause) {
        this(DownloadErrorType.BACKEND_ERROR, message, cause);
    }

    public DownloadException(Throwable cause) {
        super(cause);
        this.errorType = DownloadErrorType.BACKEND_ERROR;
    }

    public DownloadException(DownloadErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DownloadException(DownloadErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public DownloadErrorType getErrorType() {
        return errorType;
    }
}
