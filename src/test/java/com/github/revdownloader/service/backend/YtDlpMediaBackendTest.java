package com.github.revdownloader.service.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.model.BackendProgress;
import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.model.DownloadedMedia;
import com.github.revdownloader.model.MediaMetadata;
import com.github.revdownloader.service.coordinator.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the backends against a shell script standing in for yt-dlp.
 */
@DisplayName("yt-dlp backends")
@EnabledOnOs({OS.LINUX, OS.MAC})
@Timeout(20)
class YtDlpMediaBackendTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    @TempDir
    Path tempDir;

    private DownloaderProperties properties;
    private Path outputFile;

    @BeforeEach
    void setUp() throws IOException {
        outputFile = tempDir.resolve("Song.mp3");
        Path script = tempDir.resolve("fake-yt-dlp");
        Files.writeString(script, String.join("\n",
                "#!/bin/sh",
                "if [ \"$1\" = \"--dump-single-json\" ]; then",
                "  echo '[youtube] abc: Downloading webpage'",
                "  echo '{\"_type\":\"video\",\"title\":\"Song\",\"webpage_url\":\"" + URL + "\"}'",
                "  exit 0",
                "fi",
                "case \"$*\" in *missing*) echo 'ERROR: [youtube] missing: Video unavailable'; exit 1;; esac",
                "echo '[download]  50.0% of 10.00MiB at 1.00MiB/s ETA 00:05'",
                "echo '[progress]{\"status\":\"downloading\",\"downloaded_bytes\":2,\"total_bytes\":4}'",
                "echo '[progress]{\"status\":\"finished\",\"downloaded_bytes\":4,\"total_bytes\":4}'",
                "printf 'abcd' > '" + outputFile + "'",
                "echo '[file]" + outputFile + "'",
                ""), StandardCharsets.UTF_8);
        assertTrue(script.toFile().setExecutable(true));

        properties = new DownloaderProperties();
        properties.getBackend().setExecutable(script.toString());
    }

    private YtDlpMediaBackend structuredBackend() {
        return new YtDlpMediaBackend(new YtDlpCommandBuilder(properties), new YtDlpProcessExecutor(),
                new YtDlpMetadataParser(new ObjectMapper()), properties, new ObjectMapper());
    }

    private ImpersonatingMediaBackend impersonatingBackend() {
        return new ImpersonatingMediaBackend(new YtDlpCommandBuilder(properties), new YtDlpProcessExecutor(),
                new YtDlpMetadataParser(new ObjectMapper()), properties);
    }

    private ItemDownloadRequest request(String url) {
        return ItemDownloadRequest.builder()
                .sessionId("s1")
                .itemIndex(1)
                .url(url)
                .options(DownloadOptions.builder().build())
                .outputDirectory(tempDir)
                .cancellation(new CancellationToken())
                .build();
    }

    @Test
    @DisplayName("resolve should parse the JSON document among other output")
    void resolve() throws Exception {
        MediaMetadata metadata = structuredBackend().resolve(ResolveRequest.builder()
                .sessionId("s1").url(URL).cancellation(new CancellationToken()).build());

        assertEquals("Song", metadata.getTitle());
        assertEquals(URL, metadata.getUrl());
        assertNull(metadata.getEntries());
    }

    @Test
    @DisplayName("download should report byte progress and the final file")
    void downloadStructured() throws Exception {
        List<BackendProgress> samples = new CopyOnWriteArrayList<>();

        DownloadedMedia media = structuredBackend().download(request(URL), samples::add);

        assertEquals(outputFile.toString(), media.getFilePath());
        assertEquals(4L, media.getSizeBytes());
        assertEquals(2, samples.size());
        assertEquals(2L, samples.get(0).getDownloadedBytes());
        assertEquals(BackendProgress.Phase.FINISHED, samples.get(1).getPhase());
    }

    @Test
    @DisplayName("impersonating download should report percentages")
    void downloadImpersonating() throws Exception {
        List<BackendProgress> samples = new CopyOnWriteArrayList<>();

        DownloadedMedia media = impersonatingBackend().download(request(URL), samples::add);

        assertEquals(outputFile.toString(), media.getFilePath());
        assertEquals(1, samples.size());
        assertEquals(0.5, samples.get(0).getFraction(), 1e-9);
    }

    @Test
    @DisplayName("failed download should carry the backend error")
    void downloadFailure() {
        BackendException e = assertThrows(BackendException.class,
                () -> structuredBackend().download(request("https://www.youtube.com/watch?v=missing"), p -> { }));

        assertEquals("ERROR: [youtube] missing: Video unavailable", e.getMessage());
    }
}
