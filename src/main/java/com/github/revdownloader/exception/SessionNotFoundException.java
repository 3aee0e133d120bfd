package com.github.revdownloader.exception;

public class SessionNotFoundException extends DownloadException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Unknown session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
