package com.github.revdownloader.model;

public enum DownloadStatus {
    PENDING("Pending"),
    DOWNLOADING("Downloading"),
    RETRYING("Retrying"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    DownloadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
