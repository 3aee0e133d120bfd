package com.github.revdownloader.service.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.service.PlatformDetector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaBackendRouter")
class MediaBackendRouterTest {

    private final DownloaderProperties properties = new DownloaderProperties();
    private final YtDlpCommandBuilder commandBuilder = new YtDlpCommandBuilder(properties);
    private final YtDlpProcessExecutor processExecutor = new YtDlpProcessExecutor();
    private final YtDlpMetadataParser metadataParser = new YtDlpMetadataParser(new ObjectMapper());

    private final YtDlpMediaBackend structured = new YtDlpMediaBackend(commandBuilder, processExecutor,
            metadataParser, properties, new ObjectMapper());
    private final ImpersonatingMediaBackend impersonating = new ImpersonatingMediaBackend(commandBuilder,
            processExecutor, metadataParser, properties);
    private final MediaBackendRouter router = new MediaBackendRouter(structured, impersonating,
            new PlatformDetector(properties));

    @Test
    @DisplayName("should impersonate for platforms that require it")
    void shouldImpersonate() {
        assertSame(impersonating, router.backendFor("https://www.tiktok.com/@a/video/1"));
    }

    @Test
    @DisplayName("should use the structured backend otherwise")
    void shouldUseStructuredBackend() {
        assertSame(structured, router.backendFor("https://www.youtube.com/watch?v=1"));
        assertSame(structured, router.backendFor("https://example.com/video"));
    }
}
