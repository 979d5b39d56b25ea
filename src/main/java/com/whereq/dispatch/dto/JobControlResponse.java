package com.whereq.dispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for a job control action
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobControlResponse {
    /**
     * Job identifier
     */
    private String sid;

    /**
     * Action sent to the search head (cancel, pause, unpause, finalize, setttl, touch, delete)
     */
    private String action;

    /**
     * Whether the search head accepted the action
     */
    private boolean accepted;

    /**
     * When the action was sent
     */
    private Instant requestedAt;

    private String message;
}
