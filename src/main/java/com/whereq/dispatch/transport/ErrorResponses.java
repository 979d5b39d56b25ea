package com.whereq.dispatch.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.exception.AuthenticationException;
import com.whereq.dispatch.exception.AuthorizationException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.RateLimitException;
import com.whereq.dispatch.exception.SearchQuotaException;
import com.whereq.dispatch.exception.ServerException;
import com.whereq.dispatch.exception.TransportException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translate HTTP error responses from the search head into {@link TransportException} kinds
 */
public final class ErrorResponses {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private ErrorResponses() {
    }

    public static TransportException fromStatus(int status, String body, String operation,
                                                ObjectMapper objectMapper, Throwable cause) {
        String detail = extractMessage(body, objectMapper);
        String message = "HTTP " + status + (detail.isEmpty() ? "" : ": " + detail);

        switch (status) {
            case 401:
                return new AuthenticationException(message, operation, cause);
            case 403:
                return new AuthorizationException(message, operation, cause);
            case 404:
                return new NotFoundException(message, operation, cause);
            case 429:
                return new RateLimitException(message, operation, cause);
            case 503:
                if (detail.toLowerCase(Locale.ROOT).contains("quota")) {
                    return new SearchQuotaException(message, operation, cause);
                }
                return new ServerException(message, operation, status, cause);
            default:
                if (status >= 500) {
                    return new ServerException(message, operation, status, cause);
                }
                return new TransportException(message, operation, status, cause);
        }
    }

    /**
     * Pull the human-readable text out of an error body. The search head reports errors as
     * {@code {"messages":[{"type":"ERROR","text":"..."}]}}; anything else is returned truncated.
     */
    static String extractMessage(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode messages = root.path("messages");
            if (messages.isArray() && messages.size() > 0) {
                List<String> texts = new ArrayList<>();
                for (JsonNode message : messages) {
                    String text = message.path("text").asText("");
                    if (!text.isEmpty()) {
                        texts.add(text);
                    }
                }
                if (!texts.isEmpty()) {
                    return String.join("; ", texts);
                }
            }
        } catch (JsonProcessingException e) {
            // not JSON, fall through to the raw body
        }
        String trimmed = body.trim();
        return trimmed.length() > MAX_BODY_IN_MESSAGE ? trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "..." : trimmed;
    }
}
