package com.github.revdownloader.model;

/**
 * Classification of everything that can stop a session or an item.
 */
public enum DownloadErrorType {
    INVALID_URL("Invalid URL", false),
    DRM_UNSUPPORTED("DRM protected content is not supported", false),
    PRIVATE_CONTENT("Private video", false),
    AUTH_REQUIRED("Login required", false),
    IP_BLOCKED("IP address blocked by platform", false),
    INSUFFICIENT_DISK_SPACE("Insufficient disk space", false),
    OUTPUT_UNAVAILABLE("Download folder cannot be created", false),
    ALREADY_DOWNLOADING("A download is already in progress", false),
    RATE_LIMITED("403 Forbidden", true),
    TIMEOUT("Download timeout", false),
    BACKEND_ERROR("Download failed", true),
    INTERRUPTED("Interrupted", false),
    CANCELLED("Cancelled", false);

    private final String description;
    private final boolean retryable;

    DownloadErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
