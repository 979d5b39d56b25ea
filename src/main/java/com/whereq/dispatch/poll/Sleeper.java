package com.whereq.dispatch.poll;

import java.time.Duration;

/**
 * Pause between polls.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Waits on the cancellation token, so a cancel wakes the poller immediately.
     */
    Sleeper CANCELLABLE = (duration, cancellation) -> cancellation.awaitCancellation(duration);

    /**
     * Sleep for the given duration or until the token is cancelled, whichever comes first
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void sleep(Duration duration, CancellationToken cancellation) throws InterruptedException;
}
