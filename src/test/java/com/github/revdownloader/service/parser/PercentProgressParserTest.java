package com.github.revdownloader.service.parser;

import com.github.revdownloader.model.BackendProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PercentProgressParser")
class PercentProgressParserTest {

    private final PercentProgressParser parser = new PercentProgressParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "[download]  42.3% of 10.00MiB at 1.00MiB/s ETA 00:06 | 0.423",
        "[download] 100% of 3.2MiB in 00:02 | 1.0",
        "[Download] 7% | 0.07",
        "[download] 250.0% odd output | 1.0"
    })
    @DisplayName("should read the percentage of download lines")
    void shouldReadPercentage(String line, double expected) {
        BackendProgress progress = parser.parseLine(line);

        assertNotNull(progress);
        assertEquals(expected, progress.getFraction(), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[ExtractAudio] Destination: a.mp3",
        "[ffmpeg] Merging 50% done",
        "[download] Destination: a.webm"
    })
    @DisplayName("should ignore other lines")
    void shouldIgnoreOtherLines(String line) {
        assertNull(parser.parseLine(line));
    }

    @Test
    @DisplayName("should return null for null input")
    void shouldReturnNullForNull() {
        assertNull(parser.parseLine(null));
    }
}
