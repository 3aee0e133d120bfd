package com.github.revdownloader.service.backend;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.model.DownloadType;
import com.github.revdownloader.service.coordinator.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YtDlpCommandBuilder")
class YtDlpCommandBuilderTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";
    private static final Path OUTPUT = Paths.get("/data/music");

    private YtDlpCommandBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new YtDlpCommandBuilder(new DownloaderProperties());
    }

    private static ItemDownloadRequest request(DownloadOptions options, String playlistTitle) {
        return ItemDownloadRequest.builder()
                .sessionId("s1")
                .itemIndex(1)
                .url(URL)
                .options(options)
                .outputDirectory(OUTPUT)
                .playlistTitle(playlistTitle)
                .cancellation(new CancellationToken())
                .build();
    }

    private static void assertArgument(List<String> command, String flag, String value) {
        int index = command.indexOf(flag);
        assertTrue(index >= 0, flag + " missing from " + command);
        assertEquals(value, command.get(index + 1), "value of " + flag);
    }

    @Nested
    @DisplayName("buildResolveCommand")
    class ResolveCommandTests {

        @Test
        @DisplayName("should dump flat JSON capped at the playlist limit")
        void shouldDumpFlatJson() {
            List<String> command = builder.buildResolveCommand(ResolveRequest.builder()
                    .sessionId("s1").url(URL).playlistEnd(25).cancellation(new CancellationToken()).build(), false);

            assertEquals("yt-dlp", command.get(0));
            assertTrue(command.contains("--dump-single-json"));
            assertTrue(command.contains("--flat-playlist"));
            assertArgument(command, "--playlist-end", "25");
            assertFalse(command.contains("--impersonate"));
            assertEquals(URL, command.get(command.size() - 1));
        }

        @Test
        @DisplayName("should skip playlists and impersonate when asked")
        void shouldSkipPlaylists() {
            List<String> command = builder.buildResolveCommand(ResolveRequest.builder()
                    .sessionId("s1").url(URL).playlist(false).cancellation(new CancellationToken()).build(), true);

            assertTrue(command.contains("--no-playlist"));
            assertFalse(command.contains("--playlist-end"));
            assertArgument(command, "--impersonate", "chrome");
        }
    }

    @Nested
    @DisplayName("buildDownloadCommand")
    class DownloadCommandTests {

        @Test
        @DisplayName("audio should extract with codec and bitrate")
        void audioCommand() {
            List<String> command = builder.buildDownloadCommand(request(DownloadOptions.builder().build(), null),
                    false, true);

            assertArgument(command, "-f", "bestaudio/best");
            assertTrue(command.contains("--extract-audio"));
            assertArgument(command, "--audio-format", "mp3");
            assertArgument(command, "--audio-quality", "320K");
            assertArgument(command, "--progress-template", "download:[progress]%(progress)j");
            assertArgument(command, "--print", "after_move:[file]%(filepath)s");
            assertTrue(command.contains("--no-playlist"));
            assertTrue(command.contains("--embed-metadata"));
            assertArgument(command, "-o", OUTPUT.resolve("%(title)s.%(ext)s").toString());
            assertEquals(URL, command.get(command.size() - 1));
        }

        @Test
        @DisplayName("lossless audio should take no quality")
        void losslessAudio() {
            List<String> command = builder.buildDownloadCommand(request(DownloadOptions.builder()
                    .audioFormat("flac").audioQuality("320").metadata(false).build(), null), false, true);

            assertArgument(command, "--audio-format", "flac");
            assertFalse(command.contains("--audio-quality"));
            assertFalse(command.contains("--embed-metadata"));
        }

        @Test
        @DisplayName("video should select by height and add extras")
        void videoCommand() {
            DownloadOptions options = DownloadOptions.builder()
                    .downloadType(DownloadType.VIDEO)
                    .resolution("720p")
                    .videoFormat("mkv")
                    .subtitles(true)
                    .subtitleLanguage("de (German)")
                    .embedSubtitles(true)
                    .sponsorBlock(true)
                    .thumbnail(true)
                    .build();

            List<String> command = builder.buildDownloadCommand(request(options, null), false, true);

            assertArgument(command, "-f", "bestvideo[height<=720]+bestaudio/best[height<=720]");
            assertArgument(command, "--merge-output-format", "mkv");
            assertArgument(command, "--sub-langs", "de");
            assertTrue(command.contains("--embed-subs"));
            assertArgument(command, "--sponsorblock-remove", "sponsor,intro,outro,selfpromo,preview,filler");
            assertArgument(command, "--convert-thumbnails", "jpg");
            assertFalse(command.contains("--extract-audio"));
        }

        @Test
        @DisplayName("playlist items should go into a directory named after the playlist")
        void playlistDirectory() {
            List<String> command = builder.buildDownloadCommand(
                    request(DownloadOptions.builder().build(), "Best of: 2024/25"), true, false);

            assertArgument(command, "-o", OUTPUT.resolve("Best of_ 2024_25").resolve("%(title)s.%(ext)s").toString());
            assertArgument(command, "--impersonate", "chrome");
            assertFalse(command.contains("--progress-template"));
        }
    }

    @ParameterizedTest
    @CsvSource({
        "1080p, bestvideo[height<=1080]+bestaudio/best[height<=1080]",
        "2160p (4K), bestvideo[height<=2160]+bestaudio/best[height<=2160]",
        "Best, bestvideo+bestaudio/best",
        "weird, bestvideo[height<=1080]+bestaudio/best[height<=1080]"
    })
    @DisplayName("videoFormatSelector should map resolution labels")
    void videoFormatSelector(String resolution, String expected) {
        assertEquals(expected, builder.videoFormatSelector(resolution));
    }

    @ParameterizedTest
    @CsvSource({
        "ogg, vorbis",
        "WMA, wmav2",
        "webm, opus",
        "m4a, m4a",
        "alac, alac"
    })
    @DisplayName("audioCodec should map format names")
    void audioCodec(String format, String expected) {
        assertEquals(expected, builder.audioCodec(format));
    }

    @Test
    @DisplayName("audioQuality should distinguish bitrates and VBR levels")
    void audioQuality() {
        assertEquals("192K", builder.audioQuality("mp3", "192"));
        assertEquals("5", builder.audioQuality("ogg", "5"));
        assertEquals("0", builder.audioQuality("mp3", "lossless"));
        assertEquals("0", builder.audioQuality("mp3", null));
        assertNull(builder.audioQuality("WAV", "320"));
    }
}
