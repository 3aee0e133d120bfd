package com.github.revdownloader.util;

import java.time.Duration;

/**
 * Constants used throughout the download engine that are not user configurable.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Progress Tracking ==========

    /**
     * Minimum time between two speed recalculations for the same item.
     */
    public static final Duration SPEED_SAMPLE_INTERVAL = Duration.ofSeconds(1);

    /**
     * Item fraction reported while a download is running but its size is unknown.
     */
    public static final double UNKNOWN_EXTENT_FRACTION = 0.5;

    /**
     * How long the coordinator waits for a worker event before re-checking deadlines.
     */
    public static final Duration EVENT_POLL_INTERVAL = Duration.ofMillis(100);

    // ========== Display ==========

    /**
     * Maximum length of an item error message shown to the user.
     */
    public static final int ITEM_ERROR_DISPLAY_LENGTH = 100;

    /**
     * Maximum length of a session error message shown to the user.
     */
    public static final int SESSION_ERROR_DISPLAY_LENGTH = 60;

    /**
     * Maximum length of an item title inside a log line.
     */
    public static final int TITLE_DISPLAY_LENGTH = 30;

    /**
     * Maximum number of log entries kept for late subscribers.
     */
    public static final int LOG_HISTORY_SIZE = 500;

    /**
     * Number of trailing backend output lines kept to build an error message.
     */
    public static final int BACKEND_ERROR_TAIL_LINES = 20;

    // ========== Session ==========

    /**
     * Session id pattern, derived from the creation time.
     */
    public static final String SESSION_ID_PATTERN = "yyyyMMdd_HHmmss_SSS";

    // ========== Output Templates ==========

    /**
     * Output template for one item. Playlist items go into a directory named
     * after the playlist.
     */
    public static final String SINGLE_OUTPUT_TEMPLATE = "%(title)s.%(ext)s";

    // ========== Size Units ==========

    /**
     * Bytes in one kibibyte (1024 bytes).
     */
    public static final long BYTES_PER_KIB = 1024L;

    /**
     * Bytes in one mebibyte.
     */
    public static final long BYTES_PER_MIB = 1024L * 1024;

    /**
     * Bytes in one gibibyte.
     */
    public static final long BYTES_PER_GIB = 1024L * 1024 * 1024;

    // ========== Process Management ==========

    /**
     * Key separator for composite process keys (sessionId:itemIndex).
     */
    public static final String PROCESS_KEY_SEPARATOR = ":";

    /**
     * Process key suffix for metadata resolution.
     */
    public static final String RESOLVE_PROCESS_SUFFIX = "resolve";
}
