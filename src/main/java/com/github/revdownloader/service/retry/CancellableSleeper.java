package com.github.revdownloader.service.retry;

import com.github.revdownloader.service.coordinator.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;

/**
 * Backoff sleeper that wakes up as soon as the token is cancelled.
 */
@RequiredArgsConstructor
public class CancellableSleeper implements Sleeper {

    private final CancellationToken token;

    @Override
    public void sleep(long backOffPeriod) throws InterruptedException {
        token.await(Duration.ofMillis(backOffPeriod));
    }
}
