package com.tradeexecutor.event;

import org.springframework.context.ApplicationEvent;

/** Lifecycle change of an active strategy. */
public class StrategyEvent extends ApplicationEvent {

    private final String strategyId;
    private final StrategyEventType eventType;
    private final String message;

    public StrategyEvent(Object source, String strategyId, StrategyEventType eventType, String message) {
        super(source);
        this.strategyId = strategyId;
        this.eventType = eventType;
        this.message = message;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public StrategyEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }
}
