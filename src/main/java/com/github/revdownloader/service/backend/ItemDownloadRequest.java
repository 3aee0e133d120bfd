package com.github.revdownloader.service.backend;

import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.service.coordinator.CancellationToken;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.nio.file.Path;

/**
 * Transfer of a single item. The options are passed through as the user chose them.
 */
@Data
@Builder
public class ItemDownloadRequest {

    @NonNull
    private final String sessionId;

    private final int itemIndex;

    @NonNull
    private final String url;

    @NonNull
    private final DownloadOptions options;

    @NonNull
    private final Path outputDirectory;

    /**
     * Title of the playlist the item belongs to, null for a single video.
     */
    private final String playlistTitle;

    @NonNull
    private final CancellationToken cancellation;

    public boolean isPlaylistItem() {
        return playlistTitle != null;
    }
}
