package com.whereq.dispatch.exception;

import java.time.Duration;

/**
 * The wait budget ran out while the job was still active. The job may still complete later.
 */
public class PollTimeoutException extends DispatchException {

    private final String identifier;
    private final Duration elapsed;
    private final Duration timeout;

    public PollTimeoutException(String identifier, Duration elapsed, Duration timeout) {
        super("Job " + identifier + " did not complete within " + timeout.toMillis()
            + "ms (elapsed " + elapsed.toMillis() + "ms)");
        this.identifier = identifier;
        this.elapsed = elapsed;
        this.timeout = timeout;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
