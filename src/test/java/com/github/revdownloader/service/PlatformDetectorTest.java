package com.github.revdownloader.service;

import com.github.revdownloader.config.DownloaderProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlatformDetector")
class PlatformDetectorTest {

    private final PlatformDetector detector = new PlatformDetector(new DownloaderProperties());

    @Nested
    @DisplayName("normalize")
    class NormalizeTests {

        @Test
        @DisplayName("should add a missing scheme")
        void shouldAddScheme() {
            assertEquals("https://youtu.be/abc", detector.normalize(" youtu.be/abc "));
        }

        @Test
        @DisplayName("should keep an existing scheme")
        void shouldKeepScheme() {
            assertEquals("HTTP://example.com", detector.normalize("HTTP://example.com"));
            assertEquals("", detector.normalize(null));
        }
    }

    @Test
    @DisplayName("should validate URL shape")
    void validatesUrls() {
        assertTrue(detector.isValidUrl("https://www.youtube.com/watch?v=abc"));
        assertFalse(detector.isValidUrl("https://"));
        assertFalse(detector.isValidUrl("ftp://example.com"));
        assertFalse(detector.isValidUrl("https://has space.com"));
    }

    @Test
    @DisplayName("should name supported platforms")
    void namesPlatforms() {
        assertEquals("Youtube", detector.platformName("https://music.youtube.com/watch?v=1"));
        assertEquals("Soundcloud", detector.platformName("https://soundcloud.com/a/b"));
        assertEquals("Unknown", detector.platformName("https://example.com/video"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://open.spotify.com/track/1",
            "https://music.apple.com/us/album/1",
            "https://TIDAL.com/browse/track/1"
    })
    @DisplayName("should flag DRM platforms")
    void flagsDrm(String url) {
        assertTrue(detector.isDrmPlatform(url));
    }

    @Test
    @DisplayName("should flag platform specific handling")
    void flagsSpecialHandling() {
        assertTrue(detector.requiresImpersonation("https://www.tiktok.com/@a/video/1"));
        assertFalse(detector.requiresImpersonation("https://www.youtube.com/watch?v=1"));
        assertTrue(detector.isLoginRestricted("https://fb.watch/abc"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://www.youtube.com/playlist?list=PL1",
            "https://music.youtube.com/watch?v=1&list=RD1",
            "https://soundcloud.com/artist/sets/best",
            "https://artist.bandcamp.com/album/first",
            "https://example.com/playlist/7"
    })
    @DisplayName("should recognise playlist URLs")
    void recognisesPlaylists(String url) {
        assertTrue(detector.isPlaylistUrl(url));
    }

    @Test
    @DisplayName("plain video URL is not a playlist")
    void plainVideo() {
        assertFalse(detector.isPlaylistUrl("https://www.youtube.com/watch?v=abc&list=PL1"));
    }
}
