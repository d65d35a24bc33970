package com.tradeexecutor.event;

import com.tradeexecutor.domain.enums.CommandFailureKind;
import com.tradeexecutor.domain.enums.CommandKind;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published as a command moves through the pipeline. COMPLETED, FAILED and CANCELLED are
 * terminal and are published exactly once per command id.
 */
public class CommandEvent extends ApplicationEvent {

    private final String commandId;
    private final CommandKind kind;
    private final CommandEventType eventType;
    private final String message;
    private final Map<String, Object> details;
    private final CommandFailureKind failureKind;

    public CommandEvent(
            Object source, String commandId, CommandKind kind, CommandEventType eventType, String message) {
        this(source, commandId, kind, eventType, message, null);
    }

    public CommandEvent(
            Object source,
            String commandId,
            CommandKind kind,
            CommandEventType eventType,
            String message,
            Map<String, Object> details) {
        this(source, commandId, kind, eventType, message, details, null);
    }

    public CommandEvent(
            Object source,
            String commandId,
            CommandKind kind,
            CommandEventType eventType,
            String message,
            Map<String, Object> details,
            CommandFailureKind failureKind) {
        super(source);
        this.commandId = commandId;
        this.kind = kind;
        this.eventType = eventType;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
        this.failureKind = failureKind;
    }

    public String getCommandId() {
        return commandId;
    }

    public CommandKind getKind() {
        return kind;
    }

    public CommandEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /** Null unless the event is FAILED. */
    public CommandFailureKind getFailureKind() {
        return failureKind;
    }

    public boolean isExecutionFailure() {
        return eventType == CommandEventType.FAILED && failureKind == CommandFailureKind.EXECUTION;
    }
}
