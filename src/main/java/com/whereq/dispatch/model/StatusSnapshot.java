package com.whereq.dispatch.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Point-in-time read of a search job's status.
 *
 * <p>The {@code done}, {@code failed} and {@code paused} flags are kept exactly as the
 * server reported them; they can briefly disagree with {@link #getState()}.
 */
@Value
@Builder
public class StatusSnapshot {
    /**
     * Job identifier echoed back by the server
     */
    String identifier;

    /**
     * Dispatch state
     */
    JobState state;

    /**
     * Completion between 0.0 and 1.0
     */
    double progressFraction;

    long eventCount;

    long resultCount;

    long scanCount;

    /**
     * Run duration in seconds
     */
    double runDurationSeconds;

    /**
     * Inactivity time-to-live in seconds, 0 when not reported
     */
    long ttlSeconds;

    boolean done;

    boolean failed;

    boolean paused;

    @Singular
    List<DiagnosticMessage> messages;

    /**
     * Raw content object. Copied on the way in and on the way out.
     */
    JsonNode content;

    /**
     * Copy of the raw content object; changes to it do not reach this snapshot.
     */
    public JsonNode getContent() {
        return content == null ? null : content.deepCopy();
    }

    public double getProgressPercent() {
        return progressFraction * 100.0;
    }

    /**
     * First diagnostic text of a failed job.
     */
    public Optional<String> getErrorMessage() {
        if (!failed || messages.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(0).getText());
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "StatusSnapshot(sid=%s, state=%s, progress=%.1f%%, results=%d)",
            identifier, state, getProgressPercent(), resultCount);
    }

    public static class StatusSnapshotBuilder {
        public StatusSnapshotBuilder content(JsonNode content) {
            this.content = content == null ? null : content.deepCopy();
            return this;
        }
    }
}
