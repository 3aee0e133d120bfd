package com.github.revdownloader.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Utility class for download directory handling.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create
     * @return true if directory exists or was created successfully, false otherwise
     */
    public static boolean createDirectoryStructure(Path path) {
        try {
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                log.debug("Created directory structure: {}", path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to create directory structure: {}", path, e);
            return false;
        }
    }

    /**
     * Usable free space of the file store holding {@code path}.
     *
     * @param path Existing file or directory
     * @return Free bytes, or empty if the store cannot be inspected
     */
    public static OptionalLong freeSpace(Path path) {
        try {
            FileStore store = Files.getFileStore(path);
            return OptionalLong.of(store.getUsableSpace());
        } catch (IOException | SecurityException e) {
            log.warn("Cannot determine free space for {}: {}", path, e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * Resolve a backend output template against the download directory.
     *
     * @param directory Download directory
     * @param template Backend output template, relative
     * @return Absolute template string
     */
    public static String outputTemplate(Path directory, String template) {
        return directory.resolve(template).toString();
    }

    /**
     * Make a title usable as a single path segment.
     *
     * @param name Title as reported by the backend
     * @return Name with path separators and reserved characters replaced by '_'
     */
    public static String safeFileName(String name) {
        if (name == null || name.isBlank()) {
            return "Playlist";
        }
        String cleaned = UNSAFE_CHARACTERS.matcher(name.trim()).replaceAll("_");
        // "." and ".." would leave the download directory
        if (cleaned.chars().allMatch(c -> c == '.')) {
            return "Playlist";
        }
        return cleaned;
    }
}
