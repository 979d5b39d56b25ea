package com.whereq.dispatch.poll;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot signal a caller uses to abort a wait early. Safe to cancel from any thread.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * A fresh token that nobody else holds
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Block until cancelled or the duration elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean awaitCancellation(Duration duration) throws InterruptedException {
        return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
