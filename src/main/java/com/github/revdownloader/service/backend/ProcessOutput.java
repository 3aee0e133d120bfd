package com.github.revdownloader.service.backend;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What a finished yt-dlp process left behind.
 */
@Data
@Builder
public class ProcessOutput {

    private final int exitCode;

    /**
     * Last output lines, oldest first.
     */
    private final List<String> tail;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Error text for classification: the {@code ERROR:} lines if there are any,
     * otherwise the whole tail.
     */
    public String errorText() {
        List<String> errors = tail.stream()
                .filter(line -> line.toUpperCase(Locale.ROOT).startsWith("ERROR"))
                .collect(Collectors.toList());
        List<String> source = errors.isEmpty() ? tail : errors;
        String text = String.join("\n", source).trim();
        return text.isEmpty() ? "Backend exited with code " + exitCode : text;
    }
}
