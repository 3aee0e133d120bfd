package com.github.revdownloader.exception;

import com.github.revdownloader.model.DownloadErrorType;

/**
 * Thrown when a session cannot start because a precondition does not hold.
 * No item has been attempted when this is raised.
 */
public class SessionRejectedException extends DownloadException {

    private final String url;

    public SessionRejectedException(DownloadErrorType errorType, String message) {
        super(errorType, message);
        this.url = null;
    }

    public SessionRejectedException(DownloadErrorType errorType, String message, String url) {
        super(errorType, message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
