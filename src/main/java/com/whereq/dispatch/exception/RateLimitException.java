package com.whereq.dispatch.exception;

/**
 * 429 Too Many Requests
 */
public class RateLimitException extends TransportException {
    public RateLimitException(String message, String operation, Throwable cause) {
        super(message, operation, 429, cause);
    }
}
