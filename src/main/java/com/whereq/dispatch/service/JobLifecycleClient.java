package com.whereq.dispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.config.DispatchProperties;
import com.whereq.dispatch.decode.StatusDecoder;
import com.whereq.dispatch.exception.JobFailedException;
import com.whereq.dispatch.exception.MalformedStatusException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.PollCancelledException;
import com.whereq.dispatch.exception.PollTimeoutException;
import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.JobPage;
import com.whereq.dispatch.model.JobSummary;
import com.whereq.dispatch.model.StatusSnapshot;
import com.whereq.dispatch.poll.CancellationToken;
import com.whereq.dispatch.poll.PollLoop;
import com.whereq.dispatch.poll.PollRequest;
import com.whereq.dispatch.transport.SearchTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Status, wait and control operations for remote search jobs.
 *
 * <p>Control operations are fire-and-confirm: they return once the server accepted the
 * request and never poll for the resulting state. Use {@link #fetchStatus(JobId)} or
 * {@link #pollUntilTerminal(JobId, PollRequest)} to observe the effect.
 */
@Slf4j
@Service
public class JobLifecycleClient {

    private final SearchTransport transport;
    private final StatusDecoder decoder;
    private final DispatchProperties properties;
    private final PollMetrics metrics;
    private final PollLoop pollLoop;
    private final JobListingPager pager;

    @Autowired
    public JobLifecycleClient(SearchTransport transport, StatusDecoder decoder,
                              DispatchProperties properties, PollMetrics metrics) {
        this(transport, decoder, properties, metrics, new PollLoop());
    }

    public JobLifecycleClient(SearchTransport transport, StatusDecoder decoder,
                              DispatchProperties properties, PollMetrics metrics, PollLoop pollLoop) {
        this.transport = transport;
        this.decoder = decoder;
        this.properties = properties;
        this.metrics = metrics;
        this.pollLoop = pollLoop;
        this.pager = new JobListingPager(transport, decoder, properties.getJobsPath(), properties.getRequestTimeout());
    }

    /**
     * Read the current status of a job. Transport failures propagate unchanged.
     *
     * @throws MalformedStatusException if the response has no valid dispatch state
     */
    public StatusSnapshot fetchStatus(JobId id) {
        JsonNode response = transport.get(jobPath(id), Map.of(), properties.getRequestTimeout());
        return decoder.decode(response, id);
    }

    /**
     * Wait with the configured poll interval and no progress callback.
     */
    public StatusSnapshot pollUntilTerminal(JobId id, Duration timeout) {
        return pollUntilTerminal(id, PollRequest.builder()
            .timeout(timeout)
            .pollInterval(properties.getPoll().getInterval())
            .build());
    }

    /**
     * Poll until the job is done, failed or paused.
     *
     * @throws JobFailedException if the job failed
     * @throws PollTimeoutException if the job was still active when the timeout elapsed
     * @throws PollCancelledException if the request's token was cancelled
     */
    public StatusSnapshot pollUntilTerminal(JobId id, PollRequest request) {
        long start = System.nanoTime();
        try {
            StatusSnapshot snapshot = pollLoop.run(id, this::fetchStatus, request);
            metrics.record(snapshot.isDone() || snapshot.getState().isTerminal()
                ? PollMetrics.Outcome.DONE : PollMetrics.Outcome.PAUSED, waitedSince(start));
            log.info("Job {} stopped waiting in state {}", id, snapshot.getState());
            return snapshot;
        } catch (JobFailedException e) {
            metrics.record(PollMetrics.Outcome.FAILED, waitedSince(start));
            log.info("Job {} failed: {}", id, e.getMessage());
            throw e;
        } catch (PollTimeoutException e) {
            metrics.record(PollMetrics.Outcome.TIMEOUT, waitedSince(start));
            log.info("Gave up waiting for job {}: {}", id, e.getMessage());
            throw e;
        } catch (PollCancelledException e) {
            metrics.record(PollMetrics.Outcome.CANCELLED, waitedSince(start));
            log.info("Wait for job {} cancelled", id);
            throw e;
        } catch (RuntimeException e) {
            metrics.record(PollMetrics.Outcome.ERROR, waitedSince(start));
            throw e;
        }
    }

    /**
     * Reactive wait. The poll loop runs on the bounded elastic scheduler; cancelling the
     * subscription cancels the wait.
     */
    public Mono<StatusSnapshot> awaitTerminal(JobId id, Duration timeout) {
        CancellationToken cancellation = new CancellationToken();
        PollRequest request = PollRequest.builder()
            .timeout(timeout)
            .pollInterval(properties.getPoll().getInterval())
            .cancellation(cancellation)
            .build();
        return Mono.fromCallable(() -> pollUntilTerminal(id, request))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnCancel(cancellation::cancel);
    }

    /**
     * Wait for a job, optionally logging progress on every poll.
     */
    public StatusSnapshot waitForJob(JobId id, Duration timeout, boolean showProgress) {
        PollRequest.PollRequestBuilder request = PollRequest.builder()
            .timeout(timeout)
            .pollInterval(properties.getPoll().getInterval());
        if (showProgress) {
            request.progressCallback(snapshot -> log.info("Job {}: {} {} ({} results)",
                snapshot.getIdentifier(), snapshot.getState(),
                String.format(Locale.ROOT, "%.1f%%", snapshot.getProgressPercent()),
                snapshot.getResultCount()));
        }
        return pollUntilTerminal(id, request.build());
    }

    /**
     * Request cancellation. A job that is already gone counts as cancelled.
     */
    public boolean cancel(JobId id) {
        try {
            control(id, "cancel", Map.of());
        } catch (NotFoundException e) {
            log.debug("Job {} already gone when cancelling: {}", id, e.getMessage());
        }
        return true;
    }

    public boolean pause(JobId id) {
        return control(id, "pause", Map.of());
    }

    /**
     * Clear the pause flag (the {@code unpause} action).
     */
    public boolean resume(JobId id) {
        return control(id, "unpause", Map.of());
    }

    /**
     * Stop computing further results; partial results are kept.
     */
    public boolean finalizeJob(JobId id) {
        return control(id, "finalize", Map.of());
    }

    /**
     * Set the inactivity time-to-live. The server may clamp the value; re-read the status to
     * see what took effect.
     *
     * @throws IllegalArgumentException if ttlSeconds is negative
     */
    public boolean setExpiry(JobId id, long ttlSeconds) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL must not be negative, got " + ttlSeconds);
        }
        return control(id, "setttl", Map.of("ttl", ttlSeconds));
    }

    /**
     * Restart the inactivity countdown without changing the TTL.
     */
    public boolean touch(JobId id) {
        return control(id, "touch", Map.of());
    }

    public boolean delete(JobId id) {
        transport.delete(jobPath(id), properties.getRequestTimeout());
        log.info("Job {} deleted", id);
        return true;
    }

    /**
     * Field summary of a job's events, returned as the server sent it
     */
    public JsonNode fetchSummary(JobId id) {
        return transport.get(jobPath(id) + "/summary", Map.of(), properties.getRequestTimeout());
    }

    public JobPage listJobs(int count, int offset) {
        return pager.page(count, offset);
    }

    /**
     * Active jobs within one listing page. Entries in other or unknown states are dropped,
     * so the result may be shorter than {@code count}.
     */
    public List<JobSummary> listActive(int count, int offset) {
        return pager.page(count, offset).getJobs().stream()
            .filter(JobSummary::isActive)
            .collect(Collectors.toList());
    }

    public List<JobSummary> listActive() {
        return listActive(properties.getListing().getDefaultCount(), 0);
    }

    /**
     * Configured wait budget for callers that do not choose one
     */
    public Duration defaultTimeout() {
        return properties.getPoll().getTimeout();
    }

    private boolean control(JobId id, String action, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", action);
        data.putAll(extra);
        transport.post(jobPath(id) + "/control", data, properties.getRequestTimeout());
        log.info("Job {} control action '{}' accepted", id, action);
        return true;
    }

    private String jobPath(JobId id) {
        return properties.getJobsPath() + "/" + id.encoded();
    }

    private static Duration waitedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
