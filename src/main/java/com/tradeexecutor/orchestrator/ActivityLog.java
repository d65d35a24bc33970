package com.tradeexecutor.orchestrator;

import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.event.CommandEvent;
import com.tradeexecutor.event.CommandEventType;
import com.tradeexecutor.event.ConnectionEvent;
import com.tradeexecutor.event.ConnectionEventType;
import com.tradeexecutor.event.SafetyEvent;
import com.tradeexecutor.event.SignalEvent;
import com.tradeexecutor.event.StrategyEvent;
import com.tradeexecutor.event.StrategyEventType;
import com.tradeexecutor.event.SystemEvent;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ring buffer of the last {@value #MAX_ENTRIES} bus events in structured form, newest
 * first. Backs {@code GET /api/logs}.
 */
@Component
public class ActivityLog {

    static final int MAX_ENTRIES = 500;

    private final Clock clock;
    private final ConcurrentLinkedDeque<ActivityEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    public ActivityLog(Clock clock) {
        this.clock = clock;
    }

    public void record(String category, String type, String level, String message, Map<String, Object> details) {
        Map<String, Object> copy = new HashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        entries.addFirst(ActivityEntry.builder()
                .timestamp(clock.instant())
                .category(category)
                .type(type)
                .level(level)
                .message(message)
                .details(Map.copyOf(copy))
                .build());
        if (size.incrementAndGet() > MAX_ENTRIES) {
            entries.pollLast();
            size.decrementAndGet();
        }
    }

    public List<ActivityEntry> recent(int limit) {
        return entries.stream().limit(Math.max(0, limit)).toList();
    }

    public int size() {
        return size.get();
    }

    // ---- Bus listeners ----

    @EventListener
    public void onConnectionEvent(ConnectionEvent event) {
        String level = event.getEventType() == ConnectionEventType.MAX_ATTEMPTS_REACHED
                ? "ERROR"
                : event.getEventType() == ConnectionEventType.STRUGGLING ? "WARN" : "INFO";
        Map<String, Object> details = new HashMap<>();
        details.put("state", event.getCurrentState());
        details.put("attempts", event.getAttempts());
        details.put("error", event.getError());
        record("CONNECTION", event.getEventType().name(), level,
                event.getConnectionName() + " " + event.getPreviousState() + " -> " + event.getCurrentState(), details);
    }

    @EventListener
    public void onCommandEvent(CommandEvent event) {
        String level = event.getEventType() == CommandEventType.FAILED || event.getEventType() == CommandEventType.REJECTED
                ? "WARN"
                : "INFO";
        Map<String, Object> details = new HashMap<>();
        details.put("commandId", event.getCommandId());
        details.put("kind", event.getKind());
        record("COMMAND", event.getEventType().name(), level,
                event.getKind() + " " + event.getCommandId() + ": " + event.getMessage(), details);
    }

    @EventListener
    public void onStrategyEvent(StrategyEvent event) {
        String level = event.getEventType() == StrategyEventType.MONITOR_ERROR ? "ERROR" : "INFO";
        record("STRATEGY", event.getEventType().name(), level,
                event.getStrategyId() + ": " + event.getMessage(), Map.of("strategyId", event.getStrategyId()));
    }

    @EventListener
    public void onSignal(SignalEvent event) {
        Signal signal = event.getSignal();
        Map<String, Object> details = new HashMap<>();
        details.put("signalId", signal.getId());
        details.put("strategyId", signal.getStrategyId());
        details.put("volume", signal.getVolume());
        record("SIGNAL", signal.getDirection().name(), "INFO",
                signal.getDirection() + " " + signal.getSymbol() + " from " + signal.getStrategyId(), details);
    }

    @EventListener
    public void onSafetyEvent(SafetyEvent event) {
        String level = switch (event.getSeverity()) {
            case CRITICAL -> "ERROR";
            case WARNING -> "WARN";
            default -> "INFO";
        };
        record("SAFETY", event.getEventType().name(), level, event.getMessage(), event.getDetails());
    }

    @EventListener
    public void onSystemEvent(SystemEvent event) {
        record("SYSTEM", event.getEventType().name(), "INFO", event.getMessage(), event.getDetails());
    }
}
