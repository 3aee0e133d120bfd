package com.github.revdownloader.service.session;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.MetadataResolutionException;
import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.model.DownloadItem;
import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.model.DownloadSession;
import com.github.revdownloader.model.MediaEntry;
import com.github.revdownloader.model.MediaMetadata;
import com.github.revdownloader.service.PlatformDetector;
import com.github.revdownloader.service.backend.MediaBackend;
import com.github.revdownloader.service.backend.ResolveRequest;
import com.github.revdownloader.service.retry.RetryExecutor;
import com.github.revdownloader.service.retry.RetryOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a session URL into its download items.
 *
 * <p>A resolution counts as a playlist when the user allows playlists, the
 * backend returned entries, and either there is more than one entry, the URL
 * looks like a playlist, or the backend tagged it as one. A single entry under
 * a plain URL is treated as one video.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataResolver {

    private final MediaBackend mediaBackend;
    private final RetryExecutor retryExecutor;
    private final PlatformDetector platformDetector;
    private final DownloaderProperties properties;

    /**
     * Resolve the session URL, retrying like any other backend call.
     *
     * @throws MetadataResolutionException if resolution fails, finds nothing or is cancelled
     */
    public ResolvedMedia resolve(DownloadSession session, DownloadOptions options) {
        String url = session.getUrl();
        int limit = effectiveLimit(options);

        ResolveRequest request = ResolveRequest.builder()
                .sessionId(session.getSessionId())
                .url(url)
                .playlist(options.isPlaylist())
                .playlistEnd(options.isPlaylist() ? limit : 0)
                .cancellation(session.getCancellation())
                .build();

        RetryOutcome<MediaMetadata> outcome = retryExecutor.execute(url,
                attempt -> mediaBackend.resolve(request), session.getCancellation());

        if (outcome.isCancelled()) {
            throw new MetadataResolutionException(DownloadErrorType.CANCELLED, "Cancelled", url);
        }
        if (!outcome.isSuccess()) {
            throw new MetadataResolutionException(outcome.getErrorType(), outcome.getErrorMessage(), url);
        }

        ResolvedMedia media = toItems(url, outcome.getValue(), options, limit);
        if (media.getItems().isEmpty()) {
            throw new MetadataResolutionException(DownloadErrorType.BACKEND_ERROR, "No downloadable items found", url);
        }
        return media;
    }

    /**
     * Item cap for this session: the user's limit, or the fallback cap when
     * the user asked for no limit.
     */
    int effectiveLimit(DownloadOptions options) {
        int limit = options.getPlaylistLimit() != null
                ? options.getPlaylistLimit()
                : properties.getDownload().getPlaylistLimit();
        return limit > 0 ? limit : properties.getDownload().getPlaylistFallbackCap();
    }

    ResolvedMedia toItems(String url, MediaMetadata metadata, DownloadOptions options, int limit) {
        List<MediaEntry> entries = metadata.getNonNullEntries();
        boolean playlist = options.isPlaylist()
                && !entries.isEmpty()
                && (entries.size() > 1 || platformDetector.isPlaylistUrl(url) || metadata.isPlaylistType());

        if (!playlist) {
            String title = firstNonBlank(metadata.getTitle(), metadata.getUploader());
            if (title == null && !entries.isEmpty()) {
                title = entries.get(0).getTitle();
            }
            DownloadItem item = DownloadItem.builder()
                    .url(url)
                    .index(1)
                    .title(title != null ? title : "Unknown")
                    .build();
            return ResolvedMedia.builder()
                    .items(List.of(item))
                    .playlist(false)
                    .build();
        }

        List<DownloadItem> items = new ArrayList<>();
        int count = Math.min(entries.size(), limit);
        for (int i = 0; i < count; i++) {
            MediaEntry entry = entries.get(i);
            int index = i + 1;
            if (entry.getUrl() == null || entry.getUrl().isBlank()) {
                log.debug("Skipping playlist entry {} without URL", index);
                continue;
            }
            items.add(DownloadItem.builder()
                    .url(entry.getUrl())
                    .index(index)
                    .title(entry.getTitle() != null ? entry.getTitle() : "Item " + index)
                    .build());
        }

        return ResolvedMedia.builder()
                .items(items)
                .playlist(true)
                .playlistTitle(firstNonBlank(metadata.getTitle(), "Playlist"))
                .build();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
