package com.whereq.dispatch.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link SearchTransport} backed by Spring WebClient.
 *
 * <p>Every request asks for {@code output_mode=json}. Calls block the caller until the
 * response arrives or the timeout elapses.
 */
@Slf4j
public class WebClientSearchTransport implements SearchTransport {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String serviceRoot;

    /**
     * @param webClient client carrying the authentication headers
     * @param objectMapper mapper for response bodies
     * @param serviceRoot service root URL, e.g. {@code https://splunk.example.com:8089/services}
     */
    public WebClientSearchTransport(WebClient webClient, ObjectMapper objectMapper, String serviceRoot) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.serviceRoot = stripTrailingSlash(serviceRoot);
    }

    @Override
    public JsonNode get(String path, Map<String, ?> params, Duration timeout) {
        URI uri = buildUri(path, params);
        return exchange(HttpMethod.GET, uri, null, timeout);
    }

    @Override
    public JsonNode post(String path, Map<String, ?> data, Duration timeout) {
        URI uri = buildUri(path, Map.of());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (data != null) {
            data.forEach((key, value) -> {
                if (value != null) {
                    form.add(key, String.valueOf(value));
                }
            });
        }
        return exchange(HttpMethod.POST, uri, form, timeout);
    }

    @Override
    public JsonNode delete(String path, Duration timeout) {
        URI uri = buildUri(path, Map.of());
        return exchange(HttpMethod.DELETE, uri, null, timeout);
    }

    private JsonNode exchange(HttpMethod method, URI uri, MultiValueMap<String, String> form, Duration timeout) {
        String operation = method.name() + " " + uri.getPath();
        log.debug("Sending {} (timeout {}ms)", operation, timeout.toMillis());

        WebClient.RequestBodySpec request = webClient.method(method).uri(uri);
        if (form != null) {
            request.contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form));
        }

        String body = request
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(errorBody -> ErrorResponses.fromStatus(
                    response.statusCode().value(), errorBody, operation, objectMapper, null)))
            .bodyToMono(String.class)
            .defaultIfEmpty("")
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new TransportException(
                "Request timed out after " + timeout.toMillis() + "ms", operation, 0, e))
            .onErrorMap(WebClientRequestException.class, e -> new TransportException(
                "Connection failed: " + e.getMessage(), operation, 0, e))
            .doOnError(e -> log.debug("{} failed: {}", operation, e.getMessage()))
            .block();

        return parse(body, operation);
    }

    private JsonNode parse(String body, String operation) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException("Response is not valid JSON", operation, 0, e);
        }
    }

    private URI buildUri(String path, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(serviceRoot + path);
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    builder.queryParam(key, UriUtils.encodeQueryParam(String.valueOf(value), StandardCharsets.UTF_8));
                }
            });
        }
        if (params == null || !params.containsKey("output_mode")) {
            builder.queryParam("output_mode", "json");
        }
        return builder.build(true).toUri();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
