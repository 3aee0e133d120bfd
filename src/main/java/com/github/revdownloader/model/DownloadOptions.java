package com.github.revdownloader.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Format and quality choices for a session. The orchestration core only reads
 * {@code concurrency}, {@code playlist} and {@code playlistLimit}; everything
 * else is handed to the media backend untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DownloadOptions {

    @Builder.Default
    private DownloadType downloadType = DownloadType.AUDIO;

    // Audio
    @Builder.Default
    private String audioFormat = "mp3";

    @Builder.Default
    private String audioQuality = "320";

    // Video
    @Builder.Default
    private String resolution = "1080p";

    @Builder.Default
    private String videoFormat = "mp4";

    private boolean subtitles;

    @Builder.Default
    private String subtitleLanguage = "en";

    private boolean embedSubtitles;
    private boolean sponsorBlock;
    private boolean thumbnail;

    @Builder.Default
    private boolean metadata = true;

    // Playlist handling
    @Builder.Default
    private boolean playlist = true;

    /**
     * Maximum playlist items; null means the configured default, 0 means no limit.
     */
    @Min(0)
    private Integer playlistLimit;

    /**
     * Parallel workers; null means the configured default.
     */
    @Min(1)
    @Max(10)
    private Integer concurrency;

    private String outputDirectory;
}
