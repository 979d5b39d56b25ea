package com.whereq.dispatch.poll;

import com.whereq.dispatch.model.StatusSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Parameters of a single wait for a job to stop
 */
@Value
@Builder
public class PollRequest {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    /**
     * Overall wait budget, must be positive
     */
    Duration timeout;

    /**
     * Fixed delay between polls, zero for back-to-back polls
     */
    @Builder.Default
    Duration pollInterval = DEFAULT_INTERVAL;

    /**
     * Observer invoked with every snapshot. Its failures are logged and ignored.
     */
    Consumer<StatusSnapshot> progressCallback;

    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();

    /**
     * @throws IllegalArgumentException if the timeout is not positive or the interval is negative
     */
    public void validate() {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Poll timeout must be positive, got " + timeout);
        }
        if (pollInterval == null || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must not be negative, got " + pollInterval);
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("Cancellation token must not be null");
        }
    }

    public static PollRequest of(Duration timeout) {
        return PollRequest.builder().timeout(timeout).build();
    }
}
