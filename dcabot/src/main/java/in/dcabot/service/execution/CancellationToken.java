package in.dcabot.service.execution;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-campaign abort signal. Every wait in a campaign goes through
 * {@link #sleep(Duration)} so an abort wakes it immediately.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Cancel the token. Only the first reason is kept.
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why != null ? why : "cancelled");
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * Wait for the given duration or until cancelled.
     *
     * @return true if the full duration elapsed, false if the token was cancelled
     */
    public boolean sleep(Duration duration) {
        if (isCancelled()) {
            return false;
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return true;
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
    }
}
