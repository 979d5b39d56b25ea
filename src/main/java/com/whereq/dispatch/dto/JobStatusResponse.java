package com.whereq.dispatch.dto;

import com.whereq.dispatch.model.DiagnosticMessage;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.StatusSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String sid;

    /**
     * Current dispatch state
     */
    private JobState state;

    /**
     * Completion percentage, 0-100
     */
    private double progress;

    private long eventCount;

    private long resultCount;

    private long scanCount;

    /**
     * Run duration in seconds
     */
    private double runDuration;

    private long ttl;

    private boolean done;

    private boolean failed;

    private boolean paused;

    /**
     * Error message (if failed)
     */
    private String errorMessage;

    private List<DiagnosticMessage> messages;

    public static JobStatusResponse from(StatusSnapshot snapshot) {
        return JobStatusResponse.builder()
            .sid(snapshot.getIdentifier())
            .state(snapshot.getState())
            .progress(snapshot.getProgressPercent())
            .eventCount(snapshot.getEventCount())
            .resultCount(snapshot.getResultCount())
            .scanCount(snapshot.getScanCount())
            .runDuration(snapshot.getRunDurationSeconds())
            .ttl(snapshot.getTtlSeconds())
            .done(snapshot.isDone())
            .failed(snapshot.isFailed())
            .paused(snapshot.isPaused())
            .errorMessage(snapshot.getErrorMessage().orElse(null))
            .messages(snapshot.getMessages())
            .build();
    }
}
