package com.github.revdownloader.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "revdownloader")
public class DownloaderProperties {

    @Valid
    private Download download = new Download();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Backend backend = new Backend();

    @Valid
    private Platforms platforms = new Platforms();

    @Data
    public static class Download {
        @NotBlank
        private String path = Paths.get(System.getProperty("user.home"), "Downloads", "REVDownloader").toString();

        @Min(1)
        @Max(10)
        private int concurrency = 3;

        // 0 disables the user cap
        @Min(0)
        private int playlistLimit = 50;

        @Min(1)
        private int playlistFallbackCap = 500;

        @Min(0)
        private long minFreeSpaceMb = 500;

        @Min(0)
        private long minStartIntervalMs = 2000;

        @Min(1)
        private long itemTimeoutSeconds = 300;

        // finished sessions kept for status and result lookups
        @Min(1)
        private int sessionHistorySize = 20;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long baseDelayMs = 2000;

        @Min(0)
        private long maxDelayMs = 30000;
    }

    @Data
    public static class Backend {
        @NotBlank
        private String executable = "yt-dlp";

        @Min(1)
        private int socketTimeoutSeconds = 30;

        @Min(0)
        private int retries = 10;

        @Min(0)
        private int fragmentRetries = 10;

        @Min(1)
        private int concurrentFragments = 4;

        @NotBlank
        private String impersonateTarget = "chrome";

        @Min(1)
        private long resolveTimeoutSeconds = 120;
    }

    @Data
    public static class Platforms {
        private List<String> supported = new ArrayList<>(List.of(
                "youtube.com", "youtu.be", "facebook.com", "fb.watch", "instagram.com",
                "tiktok.com", "twitter.com", "x.com", "soundcloud.com", "vimeo.com",
                "dailymotion.com", "bilibili.com", "twitch.tv", "reddit.com",
                "pinterest.com", "linkedin.com", "bandcamp.com"));

        private List<String> drm = new ArrayList<>(List.of(
                "spotify.com", "music.apple.com", "music.amazon.com", "tidal.com", "deezer.com"));

        private List<String> impersonation = new ArrayList<>(List.of("tiktok.com"));

        private List<String> loginRestricted = new ArrayList<>(List.of("facebook.com", "fb.watch"));
    }
}
