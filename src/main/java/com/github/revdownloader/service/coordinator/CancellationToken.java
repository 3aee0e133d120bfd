package com.github.revdownloader.service.coordinator;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monotonic cancellation signal shared by every worker of a session.
 * Once cancelled it stays cancelled; cancelling again has no effect.
 * Child tokens are cancelled with their parent but can also be cancelled alone,
 * which is how a single item is stopped on timeout.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Signal cancellation and run registered callbacks on the calling thread.
     *
     * @return true if this call performed the cancellation, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        // onCancel may race for the same callback; whoever removes it runs it
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register an action to run on cancellation, for example killing a subprocess.
     * Runs immediately if the token is already cancelled.
     *
     * @return handle that unregisters the action
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Wait until cancelled or until the timeout elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Create a token that is cancelled whenever this one is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration registration = onCancel(child::cancel);
        child.onCancel(registration::remove);
        return child;
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
