package com.github.revdownloader.util;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Utility class for formatting sizes, speeds, ETAs and log text.
 */
@UtilityClass
public class FormatUtils {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");

    /**
     * Format bytes to human-readable size string using binary units.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "512B", "1.5KB", "12.3MB" or "1.25GB"
     */
    public static String formatBytes(long bytes) {
        if (bytes < DownloadConstants.BYTES_PER_KIB) {
            return bytes + "B";
        } else if (bytes < DownloadConstants.BYTES_PER_MIB) {
            return String.format("%.1fKB", bytes / (double) DownloadConstants.BYTES_PER_KIB);
        } else if (bytes < DownloadConstants.BYTES_PER_GIB) {
            return String.format("%.1fMB", bytes / (double) DownloadConstants.BYTES_PER_MIB);
        } else {
            return String.format("%.2fGB", bytes / (double) DownloadConstants.BYTES_PER_GIB);
        }
    }

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "1.2MB/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        return formatBytes((long) bytesPerSecond) + "/s";
    }

    /**
     * Format an ETA depending on its magnitude.
     *
     * @param seconds Remaining time in seconds
     * @return "45s" under a minute, "3m 12s" under an hour, "2h 5m" otherwise
     */
    public static String formatEta(long seconds) {
        if (seconds < 0) {
            return "0s";
        }
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return String.format("%dm %ds", seconds / 60, seconds % 60);
        } else {
            return String.format("%dh %dm", seconds / 3600, (seconds % 3600) / 60);
        }
    }

    /**
     * Format percentage with 1 decimal place.
     *
     * @param percentage Percentage value (0-100)
     * @return Formatted percentage string like "45.6%"
     */
    public static String formatPercentage(double percentage) {
        return String.format("%.1f%%", percentage);
    }

    /**
     * Cut text down to at most {@code length} characters.
     */
    public static String truncate(String text, int length) {
        if (text == null) {
            return "";
        }
        return text.length() > length ? text.substring(0, length) : text;
    }

    /**
     * Strip terminal escape sequences that backends print around their messages.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        if (text.indexOf('\u001B') < 0) {
            return text;
        }
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }
}
