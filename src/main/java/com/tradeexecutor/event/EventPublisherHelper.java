package com.tradeexecutor.event;

import com.tradeexecutor.domain.enums.CommandFailureKind;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.ConnectionState;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.Signal;
import java.util.List;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for every executor
 * event. Components publish through this helper rather than constructing events inline.
 *
 * <p>Delivery is synchronous unless the listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Connection ----

    public void publishConnectionStatus(
            Object source,
            String name,
            ConnectionState previous,
            ConnectionState current,
            int attempts,
            String error) {
        applicationEventPublisher.publishEvent(new ConnectionEvent(
                source, name, ConnectionEventType.STATUS_CHANGED, previous, current, attempts, error));
    }

    public void publishConnectionAlert(
            Object source, String name, ConnectionEventType eventType, ConnectionState state, int attempts, String error) {
        applicationEventPublisher.publishEvent(new ConnectionEvent(source, name, eventType, state, state, attempts, error));
    }

    // ---- Command ----

    public void publishCommandEvent(
            Object source, String commandId, CommandKind kind, CommandEventType eventType, String message) {
        applicationEventPublisher.publishEvent(new CommandEvent(source, commandId, kind, eventType, message));
    }

    public void publishCommandEvent(
            Object source,
            String commandId,
            CommandKind kind,
            CommandEventType eventType,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new CommandEvent(source, commandId, kind, eventType, message, details));
    }

    public void publishCommandEvent(
            Object source,
            String commandId,
            CommandKind kind,
            CommandEventType eventType,
            String message,
            Map<String, Object> details,
            CommandFailureKind failureKind) {
        applicationEventPublisher.publishEvent(
                new CommandEvent(source, commandId, kind, eventType, message, details, failureKind));
    }

    // ---- Strategy ----

    public void publishStrategyEvent(Object source, String strategyId, StrategyEventType eventType, String message) {
        applicationEventPublisher.publishEvent(new StrategyEvent(source, strategyId, eventType, message));
    }

    // ---- Signal ----

    public void publishSignal(Object source, Signal signal) {
        applicationEventPublisher.publishEvent(new SignalEvent(source, signal));
    }

    // ---- Account ----

    public void publishAccountRefreshed(Object source, AccountSnapshot snapshot, List<OpenPosition> closedPositions) {
        applicationEventPublisher.publishEvent(new AccountRefreshedEvent(source, snapshot, closedPositions));
    }

    // ---- Safety ----

    public void publishSafetyEvent(Object source, SafetyEventType eventType, Severity severity, String message) {
        applicationEventPublisher.publishEvent(new SafetyEvent(source, eventType, severity, message));
    }

    public void publishSafetyEvent(
            Object source,
            SafetyEventType eventType,
            Severity severity,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SafetyEvent(source, eventType, severity, message, details));
    }

    // ---- System ----

    public void publishSystemEvent(Object source, SystemEventType eventType, String message) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message));
    }

    public void publishSystemEvent(
            Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message, details));
    }
}
