package com.github.revdownloader.service.retry;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.exception.ConfigurationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff shared by every retryable operation:
 * {@code delay(attempt) = min(base * 2^attempt, cap)}.
 */
@Component
public class BackoffPolicy {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(30);

    private final Duration base;
    private final Duration cap;

    @Autowired
    public BackoffPolicy(DownloaderProperties properties) {
        this(Duration.ofMillis(properties.getRetry().getBaseDelayMs()),
                Duration.ofMillis(properties.getRetry().getMaxDelayMs()));
    }

    public BackoffPolicy(Duration base, Duration cap) {
        if (base.isNegative()) {
            throw new ConfigurationException("Backoff base delay must not be negative",
                    "revdownloader.retry.base-delay-ms", base.toMillis());
        }
        if (cap.compareTo(base) < 0) {
            throw new ConfigurationException("Backoff cap must not be smaller than the base delay",
                    "revdownloader.retry.max-delay-ms", cap.toMillis());
        }
        this.base = base;
        this.cap = cap;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_CAP);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt Zero-based attempt number
     * @return Delay, never more than the cap
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was " + attempt);
        }
        long baseMillis = base.toMillis();
        long capMillis = cap.toMillis();
        // Past 62 doublings the shift overflows; the cap has long been reached by then
        if (attempt >= 62 || baseMillis > (capMillis >> attempt)) {
            return cap;
        }
        return Duration.ofMillis(Math.min(baseMillis << attempt, capMillis));
    }

    public Duration getBase() {
        return base;
    }

    public Duration getCap() {
        return cap;
    }
}
