package com.whereq.dispatch.exception;

/**
 * 503 with a search quota message, too many concurrent searches
 */
public class SearchQuotaException extends TransportException {
    public SearchQuotaException(String message, String operation, Throwable cause) {
        super(message, operation, 503, cause);
    }
}
