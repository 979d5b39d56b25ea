package com.whereq.dispatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Lightweight listing entry for a search job
 */
@Value
@Builder
public class JobSummary {
    String identifier;

    /**
     * Dispatch state exactly as listed, may be outside {@link JobState}
     */
    String dispatchState;

    double progressFraction;

    long eventCount;

    long resultCount;

    double runDurationSeconds;

    public Optional<JobState> knownState() {
        if (dispatchState == null) {
            return Optional.empty();
        }
        for (JobState state : JobState.values()) {
            if (state.name().equals(dispatchState)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    public boolean isActive() {
        return knownState().map(JobState::isActive).orElse(false);
    }
}
