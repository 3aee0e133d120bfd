package com.github.revdownloader.service.backend;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.model.DownloadOptions;
import com.github.revdownloader.model.DownloadType;
import com.github.revdownloader.service.parser.YtDlpProgressTemplateParser;
import com.github.revdownloader.util.DownloadConstants;
import com.github.revdownloader.util.PathUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builder for constructing yt-dlp command-line arguments.
 * Centralizes all yt-dlp command construction logic for consistency and testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpCommandBuilder {

    /**
     * Prefix of the line yt-dlp prints with the final file path.
     */
    public static final String FILE_PATH_PREFIX = "[file]";

    private static final Map<String, String> AUDIO_CODECS = Map.of(
            "mp3", "mp3",
            "m4a", "m4a",
            "aac", "aac",
            "wav", "wav",
            "flac", "flac",
            "ogg", "vorbis",
            "opus", "opus",
            "wma", "wmav2",
            "aiff", "aiff",
            "webm", "opus");

    private static final Set<String> LOSSLESS_FORMATS = Set.of("wav", "flac", "aiff");

    private static final Map<String, String> HEIGHT_FILTERS = Map.of(
            "144p", "[height<=144]",
            "240p", "[height<=240]",
            "360p", "[height<=360]",
            "480p", "[height<=480]",
            "720p", "[height<=720]",
            "1080p", "[height<=1080]",
            "1440p", "[height<=1440]",
            "2160p", "[height<=2160]",
            "4320p", "[height<=4320]");

    private static final String DEFAULT_HEIGHT_FILTER = "[height<=1080]";

    private static final String SPONSORBLOCK_CATEGORIES = "sponsor,intro,outro,selfpromo,preview,filler";

    private final DownloaderProperties properties;

    /**
     * Build the command that prints a URL's metadata as one JSON document.
     *
     * @param request Resolution request
     * @param impersonate Whether to impersonate a browser
     * @return yt-dlp command arguments
     */
    public List<String> buildResolveCommand(@NonNull ResolveRequest request, boolean impersonate) {
        DownloaderProperties.Backend backend = properties.getBackend();

        List<String> command = new ArrayList<>();
        command.add(backend.getExecutable());
        command.add("--dump-single-json");
        command.add("--flat-playlist");
        command.add("--no-warnings");
        command.add("--socket-timeout");
        command.add(String.valueOf(backend.getSocketTimeoutSeconds()));
        if (impersonate) {
            command.add("--impersonate");
            command.add(backend.getImpersonateTarget());
        }
        if (!request.isPlaylist()) {
            command.add("--no-playlist");
        } else if (request.getPlaylistEnd() > 0) {
            command.add("--playlist-end");
            command.add(String.valueOf(request.getPlaylistEnd()));
        }
        command.add(request.getUrl());

        log.debug("Built resolve command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build the command that downloads a single item.
     *
     * @param request Download request
     * @param impersonate Whether to impersonate a browser
     * @param progressTemplate Whether to print JSON progress lines instead of the console progress bar
     * @return yt-dlp command arguments
     */
    public List<String> buildDownloadCommand(@NonNull ItemDownloadRequest request, boolean impersonate,
                                             boolean progressTemplate) {
        DownloaderProperties.Backend backend = properties.getBackend();
        DownloadOptions options = request.getOptions();

        List<String> command = new ArrayList<>();
        command.add(backend.getExecutable());
        if (impersonate) {
            command.add("--impersonate");
            command.add(backend.getImpersonateTarget());
        }
        command.add("--no-warnings");
        command.add("--newline");
        command.add("--progress");
        if (progressTemplate) {
            command.add("--progress-template");
            command.add("download:" + YtDlpProgressTemplateParser.PROGRESS_PREFIX + "%(progress)j");
        }
        command.add("--print");
        command.add("after_move:" + FILE_PATH_PREFIX + "%(filepath)s");

        // Resume partial files but replace finished ones
        command.add("--continue");
        command.add("--force-overwrites");
        command.add("--no-playlist");

        command.add("--socket-timeout");
        command.add(String.valueOf(backend.getSocketTimeoutSeconds()));
        command.add("--retries");
        command.add(String.valueOf(backend.getRetries()));
        command.add("--fragment-retries");
        command.add(String.valueOf(backend.getFragmentRetries()));
        command.add("--concurrent-fragments");
        command.add(String.valueOf(backend.getConcurrentFragments()));

        if (options.getDownloadType() == DownloadType.VIDEO) {
            addVideoOptions(command, options);
        } else {
            addAudioOptions(command, options);
        }

        if (options.isThumbnail()) {
            command.add("--embed-thumbnail");
            command.add("--convert-thumbnails");
            command.add("jpg");
        }
        if (options.isMetadata()) {
            command.add("--embed-metadata");
        }

        command.add("-o");
        command.add(outputTemplate(request));
        command.add(request.getUrl());

        log.debug("Built download command: {}", String.join(" ", command));
        return command;
    }

    /**
     * yt-dlp format selector for a resolution label such as "720p", "2160p (4K)" or "Best".
     */
    public String videoFormatSelector(String resolution) {
        String heightFilter = heightFilter(resolution);
        if (heightFilter.isEmpty()) {
            return "bestvideo+bestaudio/best";
        }
        // Strict: never fall back to an unfiltered format
        return "bestvideo" + heightFilter + "+bestaudio/best" + heightFilter;
    }

    /**
     * yt-dlp audio codec for a user-facing format name; unknown names pass through.
     */
    public String audioCodec(String format) {
        String key = format == null ? "mp3" : format.toLowerCase(Locale.ROOT);
        return AUDIO_CODECS.getOrDefault(key, key);
    }

    /**
     * yt-dlp audio quality argument, or null for lossless formats which take none.
     */
    public String audioQuality(String format, String quality) {
        if (format != null && LOSSLESS_FORMATS.contains(format.toLowerCase(Locale.ROOT))) {
            return null;
        }
        if (quality == null || quality.isBlank() || "lossless".equalsIgnoreCase(quality)) {
            return "0";
        }
        String trimmed = quality.trim();
        // Plain numbers above the VBR scale are bitrates in kbit/s
        if (trimmed.chars().allMatch(Character::isDigit) && Integer.parseInt(trimmed) > 10) {
            return trimmed + "K";
        }
        return trimmed;
    }

    private void addVideoOptions(List<String> command, DownloadOptions options) {
        command.add("-f");
        command.add(videoFormatSelector(options.getResolution()));
        command.add("--merge-output-format");
        command.add(options.getVideoFormat());

        if (options.isSubtitles()) {
            command.add("--write-subs");
            command.add("--write-auto-subs");
            command.add("--sub-langs");
            command.add(subtitleLanguageCode(options.getSubtitleLanguage()));
            if (options.isEmbedSubtitles()) {
                command.add("--embed-subs");
            }
        }

        if (options.isSponsorBlock()) {
            command.add("--sponsorblock-remove");
            command.add(SPONSORBLOCK_CATEGORIES);
            command.add("--sponsorblock-chapter-title");
            command.add("[SponsorBlock] %(category)s");
        }
    }

    private void addAudioOptions(List<String> command, DownloadOptions options) {
        command.add("-f");
        command.add("bestaudio/best");
        command.add("--extract-audio");
        command.add("--audio-format");
        command.add(audioCodec(options.getAudioFormat()));

        String quality = audioQuality(options.getAudioFormat(), options.getAudioQuality());
        if (quality != null) {
            command.add("--audio-quality");
            command.add(quality);
        }
    }

    private String outputTemplate(ItemDownloadRequest request) {
        Path directory = request.getOutputDirectory();
        if (request.isPlaylistItem()) {
            directory = directory.resolve(PathUtils.safeFileName(request.getPlaylistTitle()));
        }
        return PathUtils.outputTemplate(directory, DownloadConstants.SINGLE_OUTPUT_TEMPLATE);
    }

    private static String heightFilter(String resolution) {
        if (resolution == null) {
            return DEFAULT_HEIGHT_FILTER;
        }
        if ("best".equalsIgnoreCase(resolution.trim())) {
            return "";
        }
        // "2160p (4K)" -> "2160p"
        String key = resolution.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
        return HEIGHT_FILTERS.getOrDefault(key, DEFAULT_HEIGHT_FILTER);
    }

    private static String subtitleLanguageCode(String language) {
        if (language == null || language.isBlank()) {
            return "en";
        }
        // "en (English)" -> "en"
        return language.trim().split("\\s+")[0];
    }
}
