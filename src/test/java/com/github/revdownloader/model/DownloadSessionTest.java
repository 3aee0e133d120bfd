package com.github.revdownloader.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadSession")
class DownloadSessionTest {

    private static DownloadItem item(int index, DownloadStatus status) {
        return DownloadItem.builder().url("https://x/" + index).index(index).status(status).build();
    }

    private static DownloadSession session() {
        return DownloadSession.builder().sessionId("s1").url("https://x").platform("Unknown").build();
    }

    @Test
    @DisplayName("counts should follow item status")
    void shouldCountByStatus() {
        DownloadSession session = session();
        session.getItems().add(item(1, DownloadStatus.COMPLETED));
        session.getItems().add(item(2, DownloadStatus.COMPLETED));
        session.getItems().add(item(3, DownloadStatus.FAILED));
        session.getItems().add(item(4, DownloadStatus.CANCELLED));
        session.getItems().add(item(5, DownloadStatus.PENDING));

        assertEquals(2, session.getCompletedCount());
        assertEquals(1, session.getFailedCount());
        assertEquals(1, session.getCancelledCount());
        assertEquals(1, session.getPendingCount());
        assertEquals(0.4, session.getProgress(), 1e-9);
    }

    @Test
    @DisplayName("empty session should report no progress")
    void shouldHandleEmptySession() {
        assertEquals(0.0, session().getProgress());
        assertEquals(Duration.ZERO, session().getDuration());
    }

    @Test
    @DisplayName("cancellation should be visible on the session")
    void shouldExposeCancellation() {
        DownloadSession session = session();
        assertFalse(session.isCancelled());

        session.getCancellation().cancel();

        assertTrue(session.isCancelled());
    }

    @Test
    @DisplayName("duration should span start to end")
    void shouldMeasureDuration() {
        DownloadSession session = session();
        session.setStartTime(LocalDateTime.of(2026, 3, 1, 10, 0, 0));
        session.setEndTime(LocalDateTime.of(2026, 3, 1, 10, 1, 30));

        assertEquals(Duration.ofSeconds(90), session.getDuration());
        assertEquals(90.0, SessionResult.of(session, SessionOutcome.FAILED).getDurationSeconds(), 1e-9);
    }

    @Test
    @DisplayName("item display name should fall back to its index")
    void shouldFallBackToIndex() {
        assertEquals("Item 7", DownloadItem.builder().url("u").index(7).title(" ").build().getDisplayName());
        assertEquals("Song", DownloadItem.builder().url("u").index(7).title("Song").build().getDisplayName());
    }
}
