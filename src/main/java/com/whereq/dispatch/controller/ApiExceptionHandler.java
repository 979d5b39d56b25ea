package com.whereq.dispatch.controller;

import com.whereq.dispatch.dto.ErrorResponse;
import com.whereq.dispatch.exception.JobFailedException;
import com.whereq.dispatch.exception.MalformedStatusException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.PollCancelledException;
import com.whereq.dispatch.exception.PollTimeoutException;
import com.whereq.dispatch.exception.RateLimitException;
import com.whereq.dispatch.exception.SearchQuotaException;
import com.whereq.dispatch.exception.TransportException;
import com.whereq.dispatch.model.DiagnosticMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps each job error kind to its own HTTP status
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleValidation(IllegalArgumentException e) {
        log.error("Validation error: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("VALIDATION", e.getMessage(), null));
    }

    @ExceptionHandler(JobFailedException.class)
    public ResponseEntity<ErrorResponse> handleJobFailed(JobFailedException e) {
        log.error("Job {} failed in state {}", e.getIdentifier(), e.getDispatchState());
        ErrorResponse body = ErrorResponse.of("JOB_FAILED", e.getMessage(), e.getIdentifier());
        body.setDetails(e.getMessages().stream()
            .map(DiagnosticMessage::getText)
            .collect(Collectors.toList()));
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(PollTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(PollTimeoutException e) {
        log.error("Timed out: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
            .body(ErrorResponse.of("POLL_TIMEOUT", e.getMessage() + "; the job may still complete", e.getIdentifier()));
    }

    @ExceptionHandler(PollCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(PollCancelledException e) {
        log.error("Cancelled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ErrorResponse.of("POLL_CANCELLED", e.getMessage(), e.getIdentifier()));
    }

    @ExceptionHandler(MalformedStatusException.class)
    public ResponseEntity<ErrorResponse> handleMalformed(MalformedStatusException e) {
        log.error("Malformed status from search head: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(ErrorResponse.of("MALFORMED_STATUS", e.getMessage(), null));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.error("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of("NOT_FOUND", e.getMessage(), null));
    }

    @ExceptionHandler({RateLimitException.class, SearchQuotaException.class})
    public ResponseEntity<ErrorResponse> handleThrottled(TransportException e) {
        log.error("Search head throttled the request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .body(ErrorResponse.of("THROTTLED", e.getMessage(), null));
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ErrorResponse> handleTransport(TransportException e) {
        log.error("Search head request failed (HTTP {}): {}", e.getStatusCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(ErrorResponse.of("TRANSPORT", e.getMessage(), null));
    }
}
