package com.github.revdownloader.service.session;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.SessionRejectedException;
import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.service.PlatformDetector;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Checks that must hold before a session is created. Nothing is resolved or
 * downloaded when one of them fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionPreconditions {

    private final PlatformDetector platformDetector;
    private final DownloaderProperties properties;

    /**
     * Validate a start request.
     *
     * @param rawUrl URL as the user typed it
     * @param outputDirectory Where the session would write
     * @param sessionActive Whether another session is running
     * @param lastStart When the previous session started, null if none did
     * @param now Current time
     * @return The normalized URL
     * @throws SessionRejectedException if the session must not start
     */
    public String check(String rawUrl, Path outputDirectory, boolean sessionActive, Instant lastStart, Instant now) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new SessionRejectedException(DownloadErrorType.INVALID_URL, "Please enter a URL");
        }
        String url = platformDetector.normalize(rawUrl);

        if (sessionActive) {
            throw new SessionRejectedException(DownloadErrorType.ALREADY_DOWNLOADING,
                    "A download is already in progress", url);
        }
        if (platformDetector.isDrmPlatform(url)) {
            throw new SessionRejectedException(DownloadErrorType.DRM_UNSUPPORTED,
                    "DRM platform - Not supported", url);
        }
        if (!platformDetector.isValidUrl(url)) {
            throw new SessionRejectedException(DownloadErrorType.INVALID_URL, "Invalid URL format", url);
        }
        checkDiskSpace(outputDirectory, url);

        Duration minInterval = Duration.ofMillis(properties.getDownload().getMinStartIntervalMs());
        if (lastStart != null && Duration.between(lastStart, now).compareTo(minInterval) < 0) {
            throw new SessionRejectedException(DownloadErrorType.ALREADY_DOWNLOADING,
                    String.format("Please wait %d seconds between downloads", Math.max(minInterval.toSeconds(), 1)), url);
        }
        return url;
    }

    private void checkDiskSpace(Path outputDirectory, String url) {
        if (!PathUtils.createDirectoryStructure(outputDirectory)) {
            throw new SessionRejectedException(DownloadErrorType.OUTPUT_UNAVAILABLE,
                    "Cannot create download folder: " + outputDirectory, url);
        }
        long requiredMb = properties.getDownload().getMinFreeSpaceMb();
        if (requiredMb <= 0) {
            return;
        }
        OptionalLong free = PathUtils.freeSpace(outputDirectory);
        if (free.isEmpty()) {
            // Unknown free space does not block a download
            return;
        }
        long freeMb = free.getAsLong() / DownloadConstants.BYTES_PER_MIB;
        if (freeMb < requiredMb) {
            log.warn("Only {} MB free in {}, {} MB required", freeMb, outputDirectory, requiredMb);
            throw new SessionRejectedException(DownloadErrorType.INSUFFICIENT_DISK_SPACE,
                    String.format("Insufficient disk space (need %dMB+)", requiredMb), url);
        }
    }
}
