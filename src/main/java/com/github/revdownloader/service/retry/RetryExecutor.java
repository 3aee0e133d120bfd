package com.github.revdownloader.service.retry;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.service.coordinator.CancellationToken;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;

/**
 * Runs one fallible operation (resolve metadata, download an item) with a
 * bounded number of attempts and exponential backoff between them.
 *
 * <ul>
 *   <li>DRM, private content, login and blocked-IP failures end the operation after the failing attempt.</li>
 *   <li>403/Forbidden failures are retried like any other but logged as a suspected rate limit.</li>
 *   <li>Cancellation is checked before every attempt and before every sleep, and is never retried.</li>
 * </ul>
 */
@Slf4j
@Component
public class RetryExecutor {

    private final BackoffPolicy backoffPolicy;
    private final ErrorClassifier errorClassifier;
    private final int maxAttempts;
    private final Function<CancellationToken, Sleeper> sleeperFactory;

    @Autowired
    public RetryExecutor(BackoffPolicy backoffPolicy, ErrorClassifier errorClassifier,
                         DownloaderProperties properties) {
        this(backoffPolicy, errorClassifier, properties.getRetry().getMaxAttempts(), CancellableSleeper::new);
    }

    public RetryExecutor(BackoffPolicy backoffPolicy, ErrorClassifier errorClassifier, int maxAttempts,
                         Function<CancellationToken, Sleeper> sleeperFactory) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.backoffPolicy = backoffPolicy;
        this.errorClassifier = errorClassifier;
        this.maxAttempts = maxAttempts;
        this.sleeperFactory = sleeperFactory;
    }

    public <T> RetryOutcome<T> execute(@NonNull String url,
                                       @NonNull RetryableOperation<T> operation,
                                       @NonNull CancellationToken token) {
        return execute(url, operation, token, AttemptObserver.NONE);
    }

    /**
     * Execute the operation.
     *
     * @param url URL the operation works on, used for error classification
     * @param operation Operation to run
     * @param token Cancellation signal checked at every attempt boundary
     * @param observer Notified of failed attempts and scheduled retries
     * @return Outcome; never throws for operation failures
     */
    public <T> RetryOutcome<T> execute(@NonNull String url,
                                       @NonNull RetryableOperation<T> operation,
                                       @NonNull CancellationToken token,
                                       @NonNull AttemptObserver observer) {
        Sleeper sleeper = sleeperFactory.apply(token);
        int attemptsRun = 0;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (token.isCancelled()) {
                return RetryOutcome.cancelled(attemptsRun);
            }

            try {
                attemptsRun++;
                T value = operation.attempt(attempt);
                return RetryOutcome.success(value, attemptsRun);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (token.isCancelled()) {
                    return RetryOutcome.cancelled(attemptsRun);
                }
                log.warn("Operation on {} interrupted on attempt {}", url, attempt + 1);
                return RetryOutcome.failure(DownloadErrorType.INTERRUPTED, "Interrupted", e, attemptsRun);
            } catch (Exception e) {
                // A backend killed by cancellation fails with an arbitrary error
                if (token.isCancelled()) {
                    return RetryOutcome.cancelled(attemptsRun);
                }

                String errorMessage = describe(e);
                DownloadErrorType errorType = errorClassifier.classify(errorMessage, url);
                observer.attemptFailed(attempt, errorType, errorMessage);

                if (!errorType.isRetryable()) {
                    log.warn("Not retrying {} ({}): {}", url, errorType, errorMessage);
                    return RetryOutcome.failure(errorType, errorMessage, e, attemptsRun);
                }

                if (attempt == maxAttempts - 1) {
                    log.error("Giving up on {} after {} attempts: {}", url, attemptsRun, errorMessage);
                    return RetryOutcome.failure(errorType, errorMessage, e, attemptsRun);
                }

                if (errorType == DownloadErrorType.RATE_LIMITED) {
                    log.warn("Attempt {}/{} for {} got 403 Forbidden, rate limit suspected",
                            attempt + 1, maxAttempts, url);
                } else {
                    log.warn("Attempt {}/{} for {} failed: {}", attempt + 1, maxAttempts, url, errorMessage);
                }

                if (token.isCancelled()) {
                    return RetryOutcome.cancelled(attemptsRun);
                }

                Duration delay = backoffPolicy.delay(attempt);
                observer.retryScheduled(attempt + 1, delay, errorType);
                try {
                    sleeper.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    if (token.isCancelled()) {
                        return RetryOutcome.cancelled(attemptsRun);
                    }
                    return RetryOutcome.failure(DownloadErrorType.INTERRUPTED, "Interrupted", ie, attemptsRun);
                }
            }
        }

        // The last attempt always returns from inside the loop
        throw new IllegalStateException("Retry loop exited without an outcome for " + url);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
