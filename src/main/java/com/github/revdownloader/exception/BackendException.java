package com.github.revdownloader.exception;

/**
 * Exception thrown when the media backend fails to resolve or download a URL.
 * The message carries the backend's own error text so it can be classified.
 */
public class BackendException extends DownloadException {

    private final String url;
    private final Integer exitCode;

    public BackendException(String message, String url) {
        super(message);
        this.url = url;
        this.exitCode = null;
    }

    public BackendException(String message, String url, Integer exitCode) {
        super(message);
        this.url = url;
        this.exitCode = exitCode;
    }

    public BackendException(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
        this.exitCode = null;
    }

    public String getUrl() {
        return url;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
