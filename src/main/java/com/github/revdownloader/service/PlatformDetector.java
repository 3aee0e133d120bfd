package com.github.revdownloader.service;

import com.github.revdownloader.config.DownloaderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * URL heuristics: which platform a URL belongs to and which special handling
 * that platform needs.
 */
@Service
@RequiredArgsConstructor
public class PlatformDetector {

    private static final Pattern URL_PATTERN = Pattern.compile("^https?://[^\\s/$.?#].[^\\s]*$", Pattern.CASE_INSENSITIVE);

    private final DownloaderProperties properties;

    /**
     * Prefix {@code https://} when the user left out the scheme.
     */
    public String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return "https://" + trimmed;
        }
        return trimmed;
    }

    public boolean isValidUrl(String url) {
        return url != null && !url.isEmpty() && URL_PATTERN.matcher(url).matches();
    }

    /**
     * Display name of the supported platform, e.g. "Youtube" for youtube.com.
     */
    public Optional<String> detectPlatform(String url) {
        String lower = lower(url);
        for (String host : properties.getPlatforms().getSupported()) {
            if (lower.contains(host)) {
                String name = host.split("\\.")[0];
                return Optional.of(Character.toUpperCase(name.charAt(0)) + name.substring(1));
            }
        }
        return Optional.empty();
    }

    public String platformName(String url) {
        return detectPlatform(url).orElse("Unknown");
    }

    public boolean isDrmPlatform(String url) {
        return matchesAny(url, properties.getPlatforms().getDrm());
    }

    public boolean requiresImpersonation(String url) {
        return matchesAny(url, properties.getPlatforms().getImpersonation());
    }

    public boolean isLoginRestricted(String url) {
        return matchesAny(url, properties.getPlatforms().getLoginRestricted());
    }

    /**
     * Whether the URL itself says it points at a playlist, album or set.
     */
    public boolean isPlaylistUrl(String url) {
        String lower = lower(url);
        if (lower.contains("playlist?list=") || lower.contains("/playlist/")) {
            return true;
        }
        if (lower.contains("music.youtube.com") && lower.contains("list=")) {
            return true;
        }
        if (lower.contains("soundcloud.com") && lower.contains("/sets/")) {
            return true;
        }
        return lower.contains("bandcamp.com") && lower.contains("/album/");
    }

    private boolean matchesAny(String url, List<String> hosts) {
        String lower = lower(url);
        return hosts.stream().anyMatch(lower::contains);
    }

    private static String lower(String url) {
        return url == null ? "" : url.toLowerCase(Locale.ROOT);
    }
}
