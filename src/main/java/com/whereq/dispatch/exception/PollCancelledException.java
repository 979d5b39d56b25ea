package com.whereq.dispatch.exception;

import java.time.Duration;

/**
 * A wait was aborted by its caller before the job stopped or the timeout elapsed
 */
public class PollCancelledException extends DispatchException {

    private final String identifier;
    private final Duration elapsed;

    public PollCancelledException(String identifier, Duration elapsed) {
        super("Wait for job " + identifier + " cancelled after " + elapsed.toMillis() + "ms");
        this.identifier = identifier;
        this.elapsed = elapsed;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
