package com.github.revdownloader.service.coordinator;

import com.github.revdownloader.model.DownloadOptions;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.nio.file.Path;
import java.time.Duration;

/**
 * How the items of one session are to be downloaded.
 */
@Data
@Builder
public class DownloadPlan {

    @NonNull
    private final DownloadOptions options;

    /**
     * Number of simultaneous workers, 1..10.
     */
    private final int concurrency;

    @NonNull
    private final Path outputDirectory;

    /**
     * Playlist title for playlist sessions, null for a single video.
     */
    private final String playlistTitle;

    @NonNull
    private final Duration itemTimeout;
}
