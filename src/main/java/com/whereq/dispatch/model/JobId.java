package com.whereq.dispatch.model;

import lombok.EqualsAndHashCode;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Opaque search job identifier (the search id returned at submission time).
 */
@EqualsAndHashCode
public final class JobId {

    private final String value;

    private JobId(String value) {
        this.value = value;
    }

    /**
     * Wrap a raw identifier.
     *
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static JobId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job identifier must not be blank");
        }
        return new JobId(value);
    }

    public String value() {
        return value;
    }

    /**
     * Percent-encode every reserved character so the identifier is safe as a single path segment.
     */
    public String encoded() {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return value;
    }
}
