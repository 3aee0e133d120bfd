package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DownloadedMedia {

    private final String url;
    private final String filePath;
    private final Long sizeBytes;

    public static DownloadedMedia of(String url, String filePath) {
        return DownloadedMedia.builder()
                .url(url)
                .filePath(filePath)
                .build();
    }
}
