package com.github.revdownloader.service.state;

import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.model.DownloadItem;
import com.github.revdownloader.model.DownloadStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for download item status transitions.
 * Every mutation of an item's status goes through here, under the item's
 * monitor, so the status and the fields that belong to it change together and
 * a terminal item never changes again.
 *
 * Valid state flow:
 * <pre>
 * PENDING → DOWNLOADING → COMPLETED
 *               ↓  ↑    ↘ FAILED
 *            RETRYING   ↘ CANCELLED
 *               ↓
 *        FAILED / CANCELLED
 * </pre>
 */
@Slf4j
@Component
public class ItemStateMachine {

    private final Map<DownloadStatus, Set<DownloadStatus>> validTransitions;
    private final Clock clock;

    public ItemStateMachine(Clock clock) {
        this.clock = clock;
        this.validTransitions = new EnumMap<>(DownloadStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(DownloadStatus.PENDING, EnumSet.of(DownloadStatus.DOWNLOADING));

        validTransitions.put(DownloadStatus.DOWNLOADING,
                EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED,
                        DownloadStatus.RETRYING, DownloadStatus.CANCELLED));

        // A retrying item sleeps between attempts; it can be cancelled or time out while asleep
        validTransitions.put(DownloadStatus.RETRYING,
                EnumSet.of(DownloadStatus.DOWNLOADING, DownloadStatus.FAILED, DownloadStatus.CANCELLED));

        // Terminal states (no transitions)
        validTransitions.put(DownloadStatus.COMPLETED, EnumSet.noneOf(DownloadStatus.class));
        validTransitions.put(DownloadStatus.FAILED, EnumSet.noneOf(DownloadStatus.class));
        validTransitions.put(DownloadStatus.CANCELLED, EnumSet.noneOf(DownloadStatus.class));
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull DownloadStatus currentState, @NonNull DownloadStatus newState) {
        Set<DownloadStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    public boolean isTerminalState(@NonNull DownloadStatus state) {
        Set<DownloadStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    public Set<DownloadStatus> getValidNextStates(@NonNull DownloadStatus currentState) {
        Set<DownloadStatus> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(DownloadStatus.class);
    }

    /**
     * Move an item into DOWNLOADING, either for its first attempt or after a retry sleep.
     * The start time is stamped on the first attempt only.
     *
     * @return true if the item is now downloading
     */
    public boolean startAttempt(@NonNull DownloadItem item) {
        synchronized (item) {
            if (!apply(item, DownloadStatus.DOWNLOADING)) {
                return false;
            }
            if (item.getStartTime() == null) {
                item.setStartTime(LocalDateTime.now(clock));
            }
            return true;
        }
    }

    /**
     * Record one failed attempt. Does not change the status.
     */
    public void recordFailedAttempt(@NonNull DownloadItem item) {
        synchronized (item) {
            if (!isTerminalState(item.getStatus())) {
                item.setRetryCount(item.getRetryCount() + 1);
            }
        }
    }

    public boolean markRetrying(@NonNull DownloadItem item) {
        synchronized (item) {
            return apply(item, DownloadStatus.RETRYING);
        }
    }

    public boolean markCompleted(@NonNull DownloadItem item, String filePath) {
        synchronized (item) {
            if (!apply(item, DownloadStatus.COMPLETED)) {
                return false;
            }
            item.setEndTime(LocalDateTime.now(clock));
            item.setFilePath(filePath);
            return true;
        }
    }

    public boolean markFailed(@NonNull DownloadItem item, @NonNull DownloadErrorType errorType, String errorMessage) {
        synchronized (item) {
            if (!apply(item, DownloadStatus.FAILED)) {
                return false;
            }
            item.setEndTime(LocalDateTime.now(clock));
            item.setErrorType(errorType);
            item.setErrorMessage(errorMessage != null && !errorMessage.isBlank()
                    ? errorMessage
                    : errorType.getDescription());
            return true;
        }
    }

    public boolean markCancelled(@NonNull DownloadItem item) {
        synchronized (item) {
            return apply(item, DownloadStatus.CANCELLED);
        }
    }

    private boolean apply(DownloadItem item, DownloadStatus newState) {
        DownloadStatus currentState = item.getStatus();
        if (!isValidTransition(currentState, newState)) {
            log.warn("Item {} invalid state transition attempted: {} → {} (rejected)",
                    item.getIndex(), currentState, newState);
            return false;
        }
        log.debug("Item {} state transition: {} → {}", item.getIndex(), currentState, newState);
        item.setStatus(newState);
        return true;
    }
}
