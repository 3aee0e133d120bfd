package com.github.revdownloader.service.backend;

import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.model.MediaMetadata;
import com.github.revdownloader.service.PlatformDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Sends each call to the impersonating backend when the URL's platform needs
 * it and to the structured backend otherwise.
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class MediaBackendRouter implements MediaBackend {

    private final YtDlpMediaBackend structuredBackend;
    private final ImpersonatingMediaBackend impersonatingBackend;
    private final PlatformDetector platformDetector;

    @Override
    public MediaMetadata resolve(ResolveRequest request) throws InterruptedException {
        return backendFor(request.getUrl()).resolve(request);
    }

    @Override
    public DownloadedMedia download(ItemDownloadRequest request, Consumer<BackendProgress> onProgress)
            throws InterruptedException {
        return backendFor(request.getUrl()).download(request, onProgress);
    }

    MediaBackend backendFor(String url) {
        if (platformDetector.requiresImpersonation(url)) {
            log.debug("Using impersonating backend for {}", url);
            return impersonatingBackend;
        }
        return structuredBackend;
    }
}
