package com.github.revdownloader.service;

import com.github.revdownloader.model.LogEntry;
import com.github.revdownloader.model.ProgressSnapshot;
import com.github.revdownloader.model.SessionResult;

/**
 * Subscriber to the session event stream. Callbacks arrive on the single event
 * thread in publication order.
 */
public interface SessionEventListener {

    default void onLog(LogEntry entry) {
    }

    default void onProgress(ProgressSnapshot snapshot) {
    }

    default void onResult(SessionResult result) {
    }
}
