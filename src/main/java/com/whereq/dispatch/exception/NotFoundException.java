package com.whereq.dispatch.exception;

/**
 * 404 Not Found, e.g. a job that was deleted or expired
 */
public class NotFoundException extends TransportException {
    public NotFoundException(String message, String operation, Throwable cause) {
        super(message, operation, 404, cause);
    }
}
