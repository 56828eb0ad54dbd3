package io.captionsync.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag that also wakes up sleeps waiting on it.
 */
public final class CancelToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static CancelToken none() {
        return new CancelToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0L;
    }

    public void throwIfCancelled(String what) {
        if (isCancelled()) {
            throw new CancellationException(what + " cancelled");
        }
    }

    /**
     * Sleeps for {@code delayMs} unless cancelled first, in which case {@link CancellationException} is thrown.
     */
    public void sleep(long delayMs, String what) {
        try {
            if (cancelled.await(Math.max(0L, delayMs), TimeUnit.MILLISECONDS)) {
                throw new CancellationException(what + " cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(what + " interrupted");
        }
    }
}
