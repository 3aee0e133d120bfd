package com.github.revdownloader.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Nested
    @DisplayName("formatBytes")
    class FormatBytesTests {

        @Test
        @DisplayName("should keep small values in bytes")
        void shouldKeepBytes() {
            assertEquals("0B", FormatUtils.formatBytes(0));
            assertEquals("1023B", FormatUtils.formatBytes(1023));
        }

        @Test
        @DisplayName("should switch units at binary boundaries")
        void shouldUseBinaryUnits() {
            assertEquals(String.format("%.1fKB", 1.0), FormatUtils.formatBytes(1024));
            assertEquals(String.format("%.1fMB", 1.0), FormatUtils.formatBytes(1024 * 1024));
            assertEquals(String.format("%.2fGB", 1.5), FormatUtils.formatBytes(1024L * 1024 * 1024 * 3 / 2));
        }

        @Test
        @DisplayName("speed should append per second")
        void shouldFormatSpeed() {
            assertEquals("512B/s", FormatUtils.formatSpeed(512.9));
        }
    }

    @Nested
    @DisplayName("formatEta")
    class FormatEtaTests {

        @ParameterizedTest
        @CsvSource({
            "-5, 0s",
            "0, 0s",
            "45, 45s",
            "60, 1m 0s",
            "192, 3m 12s",
            "3599, 59m 59s",
            "3600, 1h 0m",
            "7500, 2h 5m"
        })
        @DisplayName("should pick the unit by magnitude")
        void shouldPickUnit(long seconds, String expected) {
            assertEquals(expected, FormatUtils.formatEta(seconds));
        }
    }

    @Nested
    @DisplayName("truncate")
    class TruncateTests {

        @Test
        @DisplayName("should cut long text")
        void shouldCut() {
            assertEquals("abc", FormatUtils.truncate("abcdef", 3));
        }

        @Test
        @DisplayName("should keep short text and map null to empty")
        void shouldKeepShort() {
            assertEquals("ab", FormatUtils.truncate("ab", 3));
            assertEquals("", FormatUtils.truncate(null, 3));
        }
    }

    @Nested
    @DisplayName("sanitize")
    class SanitizeTests {

        @Test
        @DisplayName("should strip ANSI color codes")
        void shouldStripAnsi() {
            assertEquals("ERROR: Private video", FormatUtils.sanitize("\u001B[0;31mERROR:\u001B[0m Private video"));
        }

        @Test
        @DisplayName("should leave plain text alone")
        void shouldLeavePlainText() {
            assertEquals("plain", FormatUtils.sanitize("plain"));
            assertEquals("", FormatUtils.sanitize(null));
        }
    }
}
