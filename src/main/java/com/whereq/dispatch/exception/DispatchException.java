package com.whereq.dispatch.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Base exception for search job operations
 */
public class DispatchException extends RuntimeException {

    private final String operation;
    private final Map<String, Object> details;

    public DispatchException(String message) {
        this(message, null, null, null);
    }

    public DispatchException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public DispatchException(String message, String operation, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
    }

    /**
     * Operation that was in progress, e.g. "get job status"
     */
    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return operation == null ? message : message + " (during " + operation + ")";
    }
}
