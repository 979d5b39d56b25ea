package com.whereq.dispatch.model;

import com.whereq.dispatch.exception.MalformedStatusException;

/**
 * Search job dispatch states as reported by the search head.
 *
 * State transitions:
 * QUEUED -> PARSING -> RUNNING -> FINALIZING -> {DONE, FAILED}
 * Any active state ⇄ PAUSED (pause / unpause)
 */
public enum JobState {
    /**
     * Waiting for a search slot
     */
    QUEUED,

    /**
     * Query is being parsed
     */
    PARSING,

    /**
     * Search actively executing
     */
    RUNNING,

    /**
     * Result computation stopping, partial results retained
     */
    FINALIZING,

    /**
     * Completed successfully
     */
    DONE,

    /**
     * Terminated with error
     */
    FAILED,

    /**
     * Scheduling suspended by request, can be resumed
     */
    PAUSED;

    /**
     * Check if job is still consuming server resources
     */
    public boolean isActive() {
        return this == QUEUED || this == PARSING || this == RUNNING || this == FINALIZING;
    }

    /**
     * Check if this is a terminal state. PAUSED is not terminal.
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isSuccess() {
        return this == DONE;
    }

    /**
     * Resolve a raw dispatch state value.
     *
     * @param raw value of the {@code dispatchState} field
     * @return matching state
     * @throws MalformedStatusException if the value is absent or not a known state
     */
    public static JobState fromDispatchState(String raw) {
        if (raw == null) {
            throw new MalformedStatusException("Missing dispatchState in job status response", null);
        }
        for (JobState state : values()) {
            if (state.name().equals(raw)) {
                return state;
            }
        }
        throw new MalformedStatusException("Invalid dispatchState: '" + raw + "'", raw);
    }
}
