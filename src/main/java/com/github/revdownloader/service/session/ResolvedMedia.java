package com.github.revdownloader.service.session;

import com.github.revdownloader.model.DownloadItem;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Items a URL expanded to.
 */
@Data
@Builder
public class ResolvedMedia {

    private final List<DownloadItem> items;

    private final boolean playlist;

    /**
     * Playlist title, null for a single video.
     */
    private final String playlistTitle;
}
