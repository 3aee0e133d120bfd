package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

/**
 * Final report for a session once every worker has stopped.
 */
@Data
@Builder
public class SessionResult {

    private final String sessionId;
    private final int completed;
    private final int failed;
    private final int cancelled;
    private final int total;
    private final double durationSeconds;
    private final SessionOutcome outcome;

    // Only set for sessions that never reached their items
    private final DownloadErrorType errorType;
    private final String errorMessage;

    public static SessionResult of(DownloadSession session, SessionOutcome outcome) {
        return SessionResult.builder()
                .sessionId(session.getSessionId())
                .completed(session.getCompletedCount())
                .failed(session.getFailedCount())
                .cancelled(session.getCancelledCount())
                .total(session.getItems().size())
                .durationSeconds(session.getDuration().toMillis() / 1000.0)
                .outcome(outcome)
                .build();
    }

    public static SessionResult failed(DownloadSession session, DownloadErrorType errorType, String errorMessage) {
        return SessionResult.builder()
                .sessionId(session.getSessionId())
                .completed(0)
                .failed(0)
                .cancelled(0)
                .total(session.getItems().size())
                .durationSeconds(session.getDuration().toMillis() / 1000.0)
                .outcome(SessionOutcome.FAILED)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isSuccessful() {
        return outcome == SessionOutcome.ALL_SUCCEEDED;
    }
}
