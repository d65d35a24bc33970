package com.tradeexecutor.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Executor lifecycle event (ready, crash recovery, reconciliation, shutdown).
 */
public class SystemEvent extends ApplicationEvent {

    private final SystemEventType eventType;
    private final String message;
    private final Map<String, Object> details;

    public SystemEvent(Object source, SystemEventType eventType, String message) {
        this(source, eventType, message, null);
    }

    public SystemEvent(Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public SystemEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
