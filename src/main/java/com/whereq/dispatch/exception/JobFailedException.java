package com.whereq.dispatch.exception;

import com.whereq.dispatch.model.DiagnosticMessage;

import java.util.List;
import java.util.Map;

/**
 * The remote job itself finished with a failure outcome
 */
public class JobFailedException extends DispatchException {

    private final String identifier;
    private final String dispatchState;
    private final List<DiagnosticMessage> messages;

    public JobFailedException(String identifier, String dispatchState, List<DiagnosticMessage> messages) {
        super(buildMessage(identifier, messages), "poll job status",
            Map.of("sid", identifier, "dispatchState", dispatchState), null);
        this.identifier = identifier;
        this.dispatchState = dispatchState;
        this.messages = List.copyOf(messages);
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getDispatchState() {
        return dispatchState;
    }

    public List<DiagnosticMessage> getMessages() {
        return messages;
    }

    private static String buildMessage(String identifier, List<DiagnosticMessage> messages) {
        if (messages.isEmpty() || messages.get(0).getText() == null) {
            return "Job " + identifier + " failed";
        }
        return "Job " + identifier + " failed: " + messages.get(0).getText();
    }
}
