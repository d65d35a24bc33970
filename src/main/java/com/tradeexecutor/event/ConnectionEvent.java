package com.tradeexecutor.event;

import com.tradeexecutor.domain.enums.ConnectionState;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the connection supervisor on every state transition of a named
 * connection, and when reconnect attempts cross the struggling or max-attempts marks.
 *
 * <p>The orchestrator folds these into the aggregate connection health; the activity log
 * records them for the status surface.
 */
public class ConnectionEvent extends ApplicationEvent {

    private final String connectionName;
    private final ConnectionEventType eventType;
    private final ConnectionState previousState;
    private final ConnectionState currentState;
    private final int attempts;
    private final String error;

    public ConnectionEvent(
            Object source,
            String connectionName,
            ConnectionEventType eventType,
            ConnectionState previousState,
            ConnectionState currentState,
            int attempts,
            String error) {
        super(source);
        this.connectionName = connectionName;
        this.eventType = eventType;
        this.previousState = previousState;
        this.currentState = currentState;
        this.attempts = attempts;
        this.error = error;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public ConnectionEventType getEventType() {
        return eventType;
    }

    public ConnectionState getPreviousState() {
        return previousState;
    }

    public ConnectionState getCurrentState() {
        return currentState;
    }

    public int getAttempts() {
        return attempts;
    }

    /** Last error message, or null when the transition was not caused by an error. */
    public String getError() {
        return error;
    }
}
