package com.whereq.dispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the REST API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    /**
     * Machine-readable error kind, e.g. JOB_FAILED or POLL_TIMEOUT
     */
    private String error;

    private String message;

    private String sid;

    /**
     * Diagnostic messages of a failed job
     */
    private List<String> details;

    private Instant timestamp;

    public static ErrorResponse of(String error, String message, String sid) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .sid(sid)
            .timestamp(Instant.now())
            .build();
    }
}
