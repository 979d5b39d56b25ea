package com.whereq.dispatch.model;

import lombok.Value;

/**
 * Diagnostic message attached to a job status (e.g. ERROR "Search syntax error").
 */
@Value
public class DiagnosticMessage {
    String severity;
    String text;
}
