package com.whereq.dispatch.poll;

import com.whereq.dispatch.exception.JobFailedException;
import com.whereq.dispatch.exception.PollCancelledException;
import com.whereq.dispatch.exception.PollTimeoutException;
import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.StatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Sequential status polling until a job stops, fails, times out or the wait is cancelled.
 *
 * <p>Exit conditions, checked in order after every fetch:
 * <ol>
 *   <li>failed state or flag: {@link JobFailedException}, never retried</li>
 *   <li>done flag or terminal state: snapshot returned</li>
 *   <li>paused flag or state: snapshot returned</li>
 *   <li>elapsed >= timeout: {@link PollTimeoutException}</li>
 * </ol>
 * Otherwise it sleeps the fixed interval and polls again. Instances hold no per-wait state,
 * so one loop can serve concurrent waits on different threads.
 */
@Slf4j
public class PollLoop {

    private final MonotonicClock clock;
    private final Sleeper sleeper;

    public PollLoop() {
        this(MonotonicClock.SYSTEM, Sleeper.CANCELLABLE);
    }

    public PollLoop(MonotonicClock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Poll until the job reaches a stopping point.
     *
     * @param id job to wait on
     * @param source status read, called once per iteration
     * @param request wait parameters
     * @return the snapshot that ended the wait (done, terminal or paused)
     * @throws JobFailedException if the job failed
     * @throws PollTimeoutException if the budget elapsed while the job was active
     * @throws PollCancelledException if the token was cancelled or the thread interrupted
     */
    public StatusSnapshot run(JobId id, StatusSource source, PollRequest request) {
        request.validate();

        long start = clock.nanoTime();
        CancellationToken cancellation = request.getCancellation();
        int polls = 0;

        while (true) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new PollCancelledException(id.value(), elapsedSince(start));
            }

            StatusSnapshot snapshot = source.fetch(id);
            polls++;
            log.debug("Poll {} for job {}: {}", polls, id, snapshot);
            notifyProgress(request, snapshot);

            if (snapshot.isFailed() || snapshot.getState() == JobState.FAILED) {
                throw new JobFailedException(id.value(), snapshot.getState().name(), snapshot.getMessages());
            }
            if (snapshot.isDone() || snapshot.getState().isTerminal()) {
                return snapshot;
            }
            if (snapshot.isPaused() || snapshot.getState() == JobState.PAUSED) {
                return snapshot;
            }

            Duration elapsed = elapsedSince(start);
            if (elapsed.compareTo(request.getTimeout()) >= 0) {
                throw new PollTimeoutException(id.value(), elapsed, request.getTimeout());
            }

            if (!request.getPollInterval().isZero()) {
                try {
                    sleeper.sleep(request.getPollInterval(), cancellation);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PollCancelledException(id.value(), elapsedSince(start));
                }
            }
        }
    }

    private void notifyProgress(PollRequest request, StatusSnapshot snapshot) {
        if (request.getProgressCallback() == null) {
            return;
        }
        try {
            request.getProgressCallback().accept(snapshot);
        } catch (Exception e) {
            log.warn("Progress callback failed for job {}: {}", snapshot.getIdentifier(), e.getMessage(), e);
        }
    }

    private Duration elapsedSince(long start) {
        return Duration.ofNanos(clock.nanoTime() - start);
    }
}
