package com.whereq.dispatch.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.dto.JobControlResponse;
import com.whereq.dispatch.dto.JobStatusResponse;
import com.whereq.dispatch.dto.TtlRequest;
import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.JobSummary;
import com.whereq.dispatch.service.JobLifecycleClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST controller exposing search job status, waits and lifecycle control.
 * Blocking client calls run on the bounded elastic scheduler.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/search/jobs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Search Jobs", description = "Inspect, wait for and control search jobs")
public class SearchJobController {

    private final JobLifecycleClient jobLifecycleClient;

    @GetMapping("/{sid}")
    @Operation(summary = "Get job status", description = "Read the current dispatch state and counters of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getStatus(@PathVariable String sid) {
        return blocking(() -> jobLifecycleClient.fetchStatus(JobId.of(sid)))
            .map(snapshot -> ResponseEntity.ok(JobStatusResponse.from(snapshot)));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List one page of jobs, optionally only the active ones")
    public Mono<ResponseEntity<List<JobSummary>>> listJobs(
            @RequestParam(defaultValue = "50") int count,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return blocking(() -> activeOnly
                ? jobLifecycleClient.listActive(count, offset)
                : jobLifecycleClient.listJobs(count, offset).getJobs())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{sid}/poll")
    @Operation(summary = "Wait for job", description = "Poll until the job is done, failed or paused, or the timeout elapses")
    public Mono<ResponseEntity<JobStatusResponse>> poll(
            @PathVariable String sid,
            @RequestParam(required = false) Long timeoutSeconds) {
        Duration timeout = timeoutSeconds == null
            ? jobLifecycleClient.defaultTimeout()
            : Duration.ofSeconds(timeoutSeconds);
        log.info("Waiting up to {}s for job {}", timeout.toSeconds(), sid);
        return Mono.defer(() -> jobLifecycleClient.awaitTerminal(JobId.of(sid), timeout))
            .map(snapshot -> ResponseEntity.ok(JobStatusResponse.from(snapshot)));
    }

    @GetMapping("/{sid}/summary")
    @Operation(summary = "Get job field summary")
    public Mono<ResponseEntity<JsonNode>> getSummary(@PathVariable String sid) {
        return blocking(() -> jobLifecycleClient.fetchSummary(JobId.of(sid)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{sid}/cancel")
    @Operation(summary = "Cancel job")
    public Mono<ResponseEntity<JobControlResponse>> cancel(@PathVariable String sid) {
        return control(sid, "cancel", () -> jobLifecycleClient.cancel(JobId.of(sid)));
    }

    @PostMapping("/{sid}/pause")
    @Operation(summary = "Pause job")
    public Mono<ResponseEntity<JobControlResponse>> pause(@PathVariable String sid) {
        return control(sid, "pause", () -> jobLifecycleClient.pause(JobId.of(sid)));
    }

    @PostMapping("/{sid}/unpause")
    @Operation(summary = "Resume paused job")
    public Mono<ResponseEntity<JobControlResponse>> unpause(@PathVariable String sid) {
        return control(sid, "unpause", () -> jobLifecycleClient.resume(JobId.of(sid)));
    }

    @PostMapping("/{sid}/finalize")
    @Operation(summary = "Finalize job", description = "Stop the job and keep the results computed so far")
    public Mono<ResponseEntity<JobControlResponse>> finalizeJob(@PathVariable String sid) {
        return control(sid, "finalize", () -> jobLifecycleClient.finalizeJob(JobId.of(sid)));
    }

    @PostMapping("/{sid}/touch")
    @Operation(summary = "Touch job", description = "Restart the inactivity countdown")
    public Mono<ResponseEntity<JobControlResponse>> touch(@PathVariable String sid) {
        return control(sid, "touch", () -> jobLifecycleClient.touch(JobId.of(sid)));
    }

    @PostMapping("/{sid}/ttl")
    @Operation(summary = "Set job TTL")
    public Mono<ResponseEntity<JobControlResponse>> setTtl(@PathVariable String sid,
                                                           @Valid @RequestBody TtlRequest request) {
        return control(sid, "setttl", () -> jobLifecycleClient.setExpiry(JobId.of(sid), request.getTtl()));
    }

    @DeleteMapping("/{sid}")
    @Operation(summary = "Delete job")
    public Mono<ResponseEntity<JobControlResponse>> delete(@PathVariable String sid) {
        return control(sid, "delete", () -> jobLifecycleClient.delete(JobId.of(sid)));
    }

    private Mono<ResponseEntity<JobControlResponse>> control(String sid, String action, Callable<Boolean> call) {
        return blocking(call)
            .map(accepted -> ResponseEntity.ok(JobControlResponse.builder()
                .sid(sid)
                .action(action)
                .accepted(accepted)
                .requestedAt(Instant.now())
                .message("Action '" + action + "' sent; poll the job status to confirm")
                .build()));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
