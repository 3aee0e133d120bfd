package com.github.revdownloader.service.backend;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.model.MediaMetadata;
import com.github.revdownloader.service.parser.ProgressParser;
import com.github.revdownloader.util.DownloadConstants;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Shared yt-dlp plumbing. Subclasses decide whether to impersonate a browser
 * and how progress lines are read.
 */
@Slf4j
public abstract class AbstractYtDlpBackend implements MediaBackend {

    protected final YtDlpCommandBuilder commandBuilder;
    protected final YtDlpProcessExecutor processExecutor;
    protected final YtDlpMetadataParser metadataParser;
    protected final DownloaderProperties properties;

    protected AbstractYtDlpBackend(YtDlpCommandBuilder commandBuilder, YtDlpProcessExecutor processExecutor,
                                   YtDlpMetadataParser metadataParser, DownloaderProperties properties) {
        this.commandBuilder = commandBuilder;
        this.processExecutor = processExecutor;
        this.metadataParser = metadataParser;
        this.properties = properties;
    }

    protected abstract boolean impersonate();

    protected abstract boolean progressTemplate();

    protected abstract ProgressParser createProgressParser();

    @Override
    public MediaMetadata resolve(@NonNull ResolveRequest request) throws InterruptedException {
        List<String> command = commandBuilder.buildResolveCommand(request, impersonate());
        AtomicReference<String> json = new AtomicReference<>();

        processExecutor.run(command, request.getUrl(),
                YtDlpProcessExecutor.processKey(request.getSessionId(), DownloadConstants.RESOLVE_PROCESS_SUFFIX),
                request.getCancellation(),
                Duration.ofSeconds(properties.getBackend().getResolveTimeoutSeconds()),
                line -> {
                    if (line.startsWith("{")) {
                        json.set(line);
                    }
                });

        if (json.get() == null) {
            throw new BackendException("Backend printed no metadata", request.getUrl());
        }
        MediaMetadata metadata = metadataParser.parse(json.get(), request.getUrl());
        log.debug("Resolved {}: type={}, entries={}", request.getUrl(), metadata.getType(),
                metadata.getEntries() != null ? metadata.getEntries().size() : 0);
        return metadata;
    }

    @Override
    public DownloadedMedia download(@NonNull ItemDownloadRequest request,
                                    @NonNull Consumer<BackendProgress> onProgress) throws InterruptedException {
        List<String> command = commandBuilder.buildDownloadCommand(request, impersonate(), progressTemplate());
        ProgressParser parser = createProgressParser();
        AtomicReference<String> filePath = new AtomicReference<>();

        processExecutor.run(command, request.getUrl(),
                YtDlpProcessExecutor.processKey(request.getSessionId(), request.getItemIndex()),
                request.getCancellation(),
                Duration.ofSeconds(properties.getDownload().getItemTimeoutSeconds()),
                line -> {
                    if (line.startsWith(YtDlpCommandBuilder.FILE_PATH_PREFIX)) {
                        filePath.set(line.substring(YtDlpCommandBuilder.FILE_PATH_PREFIX.length()).trim());
                        return;
                    }
                    BackendProgress progress = parser.parseLine(line);
                    if (progress != null) {
                        onProgress.accept(progress);
                    }
                });

        return DownloadedMedia.builder()
                .url(request.getUrl())
                .filePath(filePath.get())
                .sizeBytes(sizeOf(filePath.get()))
                .build();
    }

    private static Long sizeOf(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return null;
        }
        try {
            Path path = Paths.get(filePath);
            return Files.exists(path) ? Files.size(path) : null;
        } catch (IOException | RuntimeException e) {
            log.debug("Cannot read size of {}: {}", filePath, e.getMessage());
            return null;
        }
    }
}
