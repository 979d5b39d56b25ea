package com.whereq.dispatch.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.exception.MalformedStatusException;
import com.whereq.dispatch.model.DiagnosticMessage;
import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.JobSummary;
import com.whereq.dispatch.model.StatusSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decode raw job status responses into {@link StatusSnapshot}s.
 *
 * <p>The dispatch state is validated strictly; counters, durations and flags are advisory
 * and decoded with {@link FieldCoercion}.
 */
@Component
public class StatusDecoder {

    /**
     * Decode a status response.
     *
     * @param raw response in any {@link ResponseShape}
     * @return decoded snapshot, identifier empty when the response carries none
     * @throws MalformedStatusException if the dispatch state is missing or unknown
     */
    public StatusSnapshot decode(JsonNode raw) {
        return decode(raw, null);
    }

    /**
     * Decode a status response, using the requested id when the response does not echo one.
     */
    public StatusSnapshot decode(JsonNode raw, JobId requested) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedStatusException("Invalid job status response: expected an object", null);
        }

        List<ResponseShape.Entry> entries = ResponseShape.detect(raw).entries(raw);
        if (entries.isEmpty()) {
            throw new MalformedStatusException("Invalid job status response: no entry", null);
        }

        ResponseShape.Entry entry = entries.get(0);
        JsonNode content = entry.getContent();

        String identifier = entry.getIdentifier();
        if (identifier == null || identifier.isEmpty()) {
            identifier = requested != null ? requested.value() : "";
        }

        return StatusSnapshot.builder()
            .identifier(identifier)
            .state(decodeState(content.get("dispatchState")))
            .progressFraction(Math.min(1.0, FieldCoercion.safeDouble(content.get("doneProgress"), 0.0)))
            .eventCount(FieldCoercion.safeLong(content.get("eventCount"), 0))
            .resultCount(FieldCoercion.safeLong(content.get("resultCount"), 0))
            .scanCount(FieldCoercion.safeLong(content.get("scanCount"), 0))
            .runDurationSeconds(FieldCoercion.safeDouble(content.get("runDuration"), 0.0))
            .ttlSeconds(FieldCoercion.safeLong(content.get("ttl"), 0))
            .done(FieldCoercion.safeBoolean(content.get("isDone")))
            .failed(FieldCoercion.safeBoolean(content.get("isFailed")))
            .paused(FieldCoercion.safeBoolean(content.get("isPaused")))
            .messages(decodeMessages(content.get("messages")))
            .content(content)
            .build();
    }

    /**
     * Decode one listing entry. Unknown states are kept verbatim.
     */
    public JobSummary decodeSummary(ResponseShape.Entry entry) {
        JsonNode content = entry.getContent();
        return JobSummary.builder()
            .identifier(entry.getIdentifier() == null ? "" : entry.getIdentifier())
            .dispatchState(FieldCoercion.text(content.get("dispatchState")))
            .progressFraction(Math.min(1.0, FieldCoercion.safeDouble(content.get("doneProgress"), 0.0)))
            .eventCount(FieldCoercion.safeLong(content.get("eventCount"), 0))
            .resultCount(FieldCoercion.safeLong(content.get("resultCount"), 0))
            .runDurationSeconds(FieldCoercion.safeDouble(content.get("runDuration"), 0.0))
            .build();
    }

    private JobState decodeState(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JobState.fromDispatchState(null);
        }
        if (!node.isTextual()) {
            throw new MalformedStatusException("Invalid dispatchState: " + node, node.toString());
        }
        return JobState.fromDispatchState(node.asText());
    }

    private List<DiagnosticMessage> decodeMessages(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<DiagnosticMessage> messages = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                messages.add(new DiagnosticMessage(
                    FieldCoercion.text(element.get("type")),
                    FieldCoercion.text(element.get("text"))));
            } else if (element.isTextual()) {
                messages.add(new DiagnosticMessage(null, element.asText()));
            }
        }
        return messages;
    }
}
