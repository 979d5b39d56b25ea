package com.whereq.dispatch.exception;

/**
 * 5xx response from the search head
 */
public class ServerException extends TransportException {
    public ServerException(String message, String operation, int statusCode, Throwable cause) {
        super(message, operation, statusCode, cause);
    }
}
