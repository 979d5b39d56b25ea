package com.whereq.dispatch.exception;

/**
 * The status response was reachable but its dispatch state is missing or unknown.
 */
public class MalformedStatusException extends DispatchException {

    private final String rawValue;

    public MalformedStatusException(String message, String rawValue) {
        super(message);
        this.rawValue = rawValue;
    }

    /**
     * Offending raw value, null when the field was absent
     */
    public String getRawValue() {
        return rawValue;
    }
}
