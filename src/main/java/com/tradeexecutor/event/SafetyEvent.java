package com.tradeexecutor.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the safety gate and the kill switch.
 *
 * <p>Details carry check-specific values, for example {@code {"dailyLoss": 520, "limit": 500}}
 * for a daily-loss denial or {@code {"initiator": "CLOUD"}} for a trip.
 */
public class SafetyEvent extends ApplicationEvent {

    private final SafetyEventType eventType;
    private final Severity severity;
    private final String message;
    private final Map<String, Object> details;

    public SafetyEvent(Object source, SafetyEventType eventType, Severity severity, String message) {
        this(source, eventType, severity, message, null);
    }

    public SafetyEvent(
            Object source,
            SafetyEventType eventType,
            Severity severity,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.severity = severity;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public SafetyEventType getEventType() {
        return eventType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
