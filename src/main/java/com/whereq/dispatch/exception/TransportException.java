package com.whereq.dispatch.exception;

/**
 * Network, authentication or HTTP failure talking to the search head.
 * Never retried by the job lifecycle core.
 */
public class TransportException extends DispatchException {

    private final int statusCode;

    public TransportException(String message, String operation, int statusCode, Throwable cause) {
        super(message, operation, null, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
