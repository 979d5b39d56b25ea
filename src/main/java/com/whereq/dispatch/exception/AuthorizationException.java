package com.whereq.dispatch.exception;

/**
 * 403 Forbidden, the user lacks the capability
 */
public class AuthorizationException extends TransportException {
    public AuthorizationException(String message, String operation, Throwable cause) {
        super(message, operation, 403, cause);
    }
}
