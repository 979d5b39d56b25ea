package com.whereq.dispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.config.DispatchProperties;
import com.whereq.dispatch.decode.StatusDecoder;
import com.whereq.dispatch.exception.JobFailedException;
import com.whereq.dispatch.exception.MalformedStatusException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.PollTimeoutException;
import com.whereq.dispatch.exception.ServerException;
import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.JobPage;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.JobSummary;
import com.whereq.dispatch.model.StatusSnapshot;
import com.whereq.dispatch.poll.PollLoop;
import com.whereq.dispatch.poll.PollRequest;
import com.whereq.dispatch.support.FakeSearchTransport;
import com.whereq.dispatch.support.InMemoryJobStore;
import com.whereq.dispatch.transport.SearchTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static com.whereq.dispatch.support.Responses.entry;
import static com.whereq.dispatch.support.Responses.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobLifecycleClientTest {

    private DispatchProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryJobStore store;
    private FakeSearchTransport transport;
    private JobLifecycleClient client;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        properties.getPoll().setInterval(Duration.ZERO);
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryJobStore();
        transport = new FakeSearchTransport(store);
        client = newClient(transport);
    }

    @Test
    void fetchStatusEncodesTheIdentifierIntoOnePathSegment() {
        store.create("scheduler__admin/search 1", JobState.RUNNING).setDoneProgress(0.25);

        StatusSnapshot snapshot = client.fetchStatus(JobId.of("scheduler__admin/search 1"));

        assertThat(snapshot.getIdentifier()).isEqualTo("scheduler__admin/search 1");
        assertThat(snapshot.getProgressPercent()).isEqualTo(25.0);
        assertThat(transport.calls()).containsExactly("GET /search/v2/jobs/scheduler__admin%2Fsearch%201");
    }

    @Test
    void fetchStatusPropagatesTransportErrors() {
        assertThatThrownBy(() -> client.fetchStatus(JobId.of("missing.1")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void fetchStatusRaisesMalformedForUnknownState() {
        SearchTransport mockTransport = mock(SearchTransport.class);
        when(mockTransport.get(any(), anyMap(), any())).thenReturn(entry("{'dispatchState':'EXPLODED'}"));

        assertThatThrownBy(() -> newClient(mockTransport).fetchStatus(JobId.of("a.1")))
            .isInstanceOf(MalformedStatusException.class)
            .hasMessageContaining("EXPLODED");
    }

    @Test
    void pollUntilTerminalReturnsDoneSnapshotAndRecordsOutcome() {
        InMemoryJobStore.FakeJob job = store.create("a.1", JobState.DONE);
        job.setResultCount(42);

        StatusSnapshot snapshot = client.pollUntilTerminal(JobId.of("a.1"), Duration.ofSeconds(5));

        assertThat(snapshot.getResultCount()).isEqualTo(42);
        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "done").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("dispatch.poll.wait").count()).isEqualTo(1);
    }

    @Test
    void pollUntilTerminalRaisesJobFailed() {
        InMemoryJobStore.FakeJob job = store.create("a.1", JobState.FAILED);
        job.getMessages().add(new String[]{"ERROR", "Unknown search command 'foo'"});
        job.getMessages().add(new String[]{"ERROR", "Search aborted"});

        assertThatThrownBy(() -> client.pollUntilTerminal(JobId.of("a.1"), Duration.ofSeconds(5)))
            .isInstanceOfSatisfying(JobFailedException.class, e -> {
                assertThat(e.getMessages()).hasSize(2);
                assertThat(e.getDetails()).containsEntry("sid", "a.1");
            });
        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void pollUntilTerminalRecordsTransportErrorsAsErrorOutcome() {
        assertThatThrownBy(() -> client.pollUntilTerminal(JobId.of("missing.1"), Duration.ofSeconds(5)))
            .isInstanceOf(NotFoundException.class);

        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "error").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "failed").count()).isZero();
    }

    @Test
    void pollUntilTerminalTimesOutWithInjectedClock() {
        store.create("a.1", JobState.RUNNING);
        AtomicLong nanos = new AtomicLong();
        PollLoop loop = new PollLoop(nanos::get, (duration, cancellation) -> nanos.addAndGet(duration.toNanos()));
        JobLifecycleClient timedClient = new JobLifecycleClient(transport, new StatusDecoder(), properties,
            new PollMetrics(meterRegistry), loop);

        assertThatThrownBy(() -> timedClient.pollUntilTerminal(JobId.of("a.1"), PollRequest.builder()
                .timeout(Duration.ofSeconds(3))
                .pollInterval(Duration.ofSeconds(1))
                .build()))
            .isInstanceOf(PollTimeoutException.class);
        assertThat(transport.calls()).hasSize(4);
        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void waitForJobWithProgressLoggingReturnsPausedJob() {
        store.create("a.1", JobState.PAUSED);

        StatusSnapshot snapshot = client.waitForJob(JobId.of("a.1"), Duration.ofSeconds(5), true);

        assertThat(snapshot.isPaused()).isTrue();
        assertThat(meterRegistry.counter("dispatch.poll.outcome", "outcome", "paused").count()).isEqualTo(1.0);
    }

    @Test
    void awaitTerminalEmitsTheFinalSnapshot() {
        store.create("a.1", JobState.DONE);

        StepVerifier.create(client.awaitTerminal(JobId.of("a.1"), Duration.ofSeconds(5)))
            .assertNext(snapshot -> assertThat(snapshot.getState()).isEqualTo(JobState.DONE))
            .verifyComplete();
    }

    @Test
    void awaitTerminalSignalsJobFailure() {
        store.create("a.1", JobState.FAILED);

        StepVerifier.create(client.awaitTerminal(JobId.of("a.1"), Duration.ofSeconds(5)))
            .expectError(JobFailedException.class)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void pauseAndResumeDriveThePauseFlag() {
        store.create("a.1", JobState.RUNNING);
        JobId id = JobId.of("a.1");

        assertThat(client.pause(id)).isTrue();
        assertThat(client.fetchStatus(id).isPaused()).isTrue();
        assertThat(client.fetchStatus(id).getState()).isEqualTo(JobState.PAUSED);

        assertThat(client.resume(id)).isTrue();
        StatusSnapshot resumed = client.fetchStatus(id);
        assertThat(resumed.isPaused()).isFalse();
        assertThat(resumed.getState()).isEqualTo(JobState.RUNNING);
        assertThat(transport.calls()).contains("POST /search/v2/jobs/a.1/control pause",
            "POST /search/v2/jobs/a.1/control unpause");
    }

    @Test
    void pauseOfATerminalJobIsANoOp() {
        store.create("a.1", JobState.DONE);

        assertThat(client.pause(JobId.of("a.1"))).isTrue();
        assertThat(client.fetchStatus(JobId.of("a.1")).getState()).isEqualTo(JobState.DONE);
    }

    @Test
    void finalizeMovesJobToFinalizing() {
        store.create("a.1", JobState.RUNNING);

        assertThat(client.finalizeJob(JobId.of("a.1"))).isTrue();
        assertThat(client.fetchStatus(JobId.of("a.1")).getState()).isEqualTo(JobState.FINALIZING);
    }

    @Test
    void cancelDoesNotPollForTheResult() {
        store.create("a.1", JobState.RUNNING);

        assertThat(client.cancel(JobId.of("a.1"))).isTrue();
        assertThat(transport.calls()).containsExactly("POST /search/v2/jobs/a.1/control cancel");
    }

    @Test
    void cancelOfAVanishedJobCountsAsSuccess() {
        assertThat(client.cancel(JobId.of("gone.1"))).isTrue();
    }

    @Test
    void cancelPropagatesOtherTransportErrors() {
        SearchTransport mockTransport = mock(SearchTransport.class);
        when(mockTransport.post(any(), anyMap(), any()))
            .thenThrow(new ServerException("HTTP 500", "cancel", 500, null));

        assertThatThrownBy(() -> newClient(mockTransport).cancel(JobId.of("a.1")))
            .isInstanceOf(ServerException.class);
    }

    @Test
    void setExpiryPostsTtlAndServerReflectsIt() {
        store.create("a.1", JobState.DONE);

        assertThat(client.setExpiry(JobId.of("a.1"), 7200)).isTrue();
        assertThat(client.fetchStatus(JobId.of("a.1")).getTtlSeconds()).isEqualTo(7200);
    }

    @Test
    void setExpirySendsActionAndTtlFields() {
        SearchTransport mockTransport = mock(SearchTransport.class);
        when(mockTransport.post(any(), anyMap(), any())).thenReturn(json("{}"));

        newClient(mockTransport).setExpiry(JobId.of("a.1"), 3600);

        verify(mockTransport).post(eq("/search/v2/jobs/a.1/control"),
            eq(Map.of("action", "setttl", "ttl", 3600L)), eq(properties.getRequestTimeout()));
    }

    @Test
    void negativeExpiryIsRejectedWithoutCallingTheServer() {
        SearchTransport mockTransport = mock(SearchTransport.class);

        assertThatThrownBy(() -> newClient(mockTransport).setExpiry(JobId.of("a.1"), -1))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mockTransport);
    }

    @Test
    void touchKeepsTtlUnchanged() {
        InMemoryJobStore.FakeJob job = store.create("a.1", JobState.DONE);

        assertThat(client.touch(JobId.of("a.1"))).isTrue();
        assertThat(job.getTouches()).isEqualTo(1);
        assertThat(job.getTtl()).isEqualTo(600);
    }

    @Test
    void deletedJobIsNotFoundAfterwards() {
        store.create("a.1", JobState.DONE);

        assertThat(client.delete(JobId.of("a.1"))).isTrue();
        assertThatThrownBy(() -> client.fetchStatus(JobId.of("a.1"))).isInstanceOf(NotFoundException.class);
    }

    @Test
    void fetchSummaryReturnsRawJson() {
        store.create("a.1", JobState.DONE);

        JsonNode summary = client.fetchSummary(JobId.of("a.1"));

        assertThat(summary.has("fields")).isTrue();
        assertThat(transport.calls()).containsExactly("GET /search/v2/jobs/a.1/summary");
    }

    @Test
    void listActiveKeepsOnlyActiveJobs() {
        store.create("q.1", JobState.QUEUED);
        store.create("d.1", JobState.DONE);
        store.create("r.1", JobState.RUNNING);
        store.create("p.1", JobState.PAUSED);

        List<JobSummary> active = client.listActive();

        assertThat(active).extracting(JobSummary::getIdentifier).containsExactly("q.1", "r.1");
    }

    @Test
    void listJobsPassesPaging() {
        for (int i = 0; i < 5; i++) {
            store.create("s." + i, JobState.DONE);
        }

        JobPage page = client.listJobs(2, 1);

        assertThat(page.getJobs()).extracting(JobSummary::getIdentifier).containsExactly("s.1", "s.2");
        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void controlCallsAreOneRequestEach() {
        SearchTransport mockTransport = mock(SearchTransport.class);
        when(mockTransport.post(any(), anyMap(), any())).thenReturn(json("{}"));
        JobLifecycleClient mocked = newClient(mockTransport);
        JobId id = JobId.of("a.1");

        mocked.pause(id);
        mocked.resume(id);
        mocked.finalizeJob(id);
        mocked.touch(id);

        verify(mockTransport, times(4)).post(eq("/search/v2/jobs/a.1/control"), anyMap(), any());
        verify(mockTransport, times(0)).get(any(), anyMap(), any());
    }

    private JobLifecycleClient newClient(SearchTransport searchTransport) {
        return new JobLifecycleClient(searchTransport, new StatusDecoder(), properties, new PollMetrics(meterRegistry));
    }
}
