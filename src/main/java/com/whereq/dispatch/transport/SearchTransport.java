package com.whereq.dispatch.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.exception.TransportException;

import java.time.Duration;
import java.util.Map;

/**
 * Authenticated request/response access to the search REST API.
 *
 * <p>Paths are relative to the configured service root and must already be encoded.
 * Implementations own retries and connection pooling; callers treat each call as stateless.
 */
public interface SearchTransport {

    /**
     * Issue a GET
     *
     * @param path resource path, e.g. {@code /search/v2/jobs/1703779200.12345}
     * @param params query parameters, may be empty
     * @param timeout request timeout
     * @return parsed response body, an empty object when the body is empty
     * @throws TransportException on network or HTTP failure
     */
    JsonNode get(String path, Map<String, ?> params, Duration timeout);

    /**
     * Issue a form-encoded POST
     *
     * @throws TransportException on network or HTTP failure
     */
    JsonNode post(String path, Map<String, ?> data, Duration timeout);

    /**
     * Issue a DELETE
     *
     * @throws TransportException on network or HTTP failure
     */
    JsonNode delete(String path, Duration timeout);
}
