package com.whereq.dispatch.exception;

/**
 * 401 Unauthorized, bad or expired credentials
 */
public class AuthenticationException extends TransportException {
    public AuthenticationException(String message, String operation, Throwable cause) {
        super(message, operation, 401, cause);
    }
}
