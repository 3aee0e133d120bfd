package com.github.revdownloader.model;

public enum DownloadType {
    AUDIO("tracks"),
    VIDEO("videos");

    private final String itemLabel;

    DownloadType(String itemLabel) {
        this.itemLabel = itemLabel;
    }

    /**
     * Plural noun used in summary log lines ("3 tracks", "2 videos").
     */
    public String getItemLabel() {
        return itemLabel;
    }
}
