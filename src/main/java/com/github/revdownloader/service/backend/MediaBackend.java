package com.github.revdownloader.service.backend;

import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.model.MediaMetadata;

import java.util.function.Consumer;

/**
 * Component that knows how to look up and transfer media. Implementations must
 * stop promptly once the request's cancellation token fires and report every
 * failure as an exception whose message carries the backend's own error text.
 */
public interface MediaBackend {

    /**
     * Resolve a URL to its title and, for containers, its entries.
     *
     * @throws com.github.revdownloader.exception.BackendException if the backend fails
     * @throws InterruptedException if the calling thread is interrupted
     */
    MediaMetadata resolve(ResolveRequest request) throws InterruptedException;

    /**
     * Download one item.
     *
     * @param request What to download and where
     * @param onProgress Receives progress samples in the order the backend produces them
     * @return The downloaded file
     * @throws com.github.revdownloader.exception.BackendException if the backend fails
     * @throws InterruptedException if the calling thread is interrupted
     */
    DownloadedMedia download(ItemDownloadRequest request, Consumer<BackendProgress> onProgress)
            throws InterruptedException;
}
