package com.github.revdownloader.exception;

import com.github.revdownloader.model.DownloadErrorType;

/**
 * Exception thrown when a URL could not be resolved into downloadable items.
 */
public class MetadataResolutionException extends DownloadException {

    private final String url;

    public MetadataResolutionException(DownloadErrorType errorType, String message, String url) {
        super(errorType, message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
