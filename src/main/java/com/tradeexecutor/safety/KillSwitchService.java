package com.tradeexecutor.safety;

import com.tradeexecutor.domain.enums.KillSwitchState;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SafetyEventType;
import com.tradeexecutor.event.Severity;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Process-wide emergency stop.
 *
 * <p>Design principles:
 * <ul>
 *   <li><b>Idempotent:</b> {@link AtomicBoolean#compareAndSet} lets exactly one caller trip;
 *       concurrent or repeated trips are no-ops and publish nothing</li>
 *   <li><b>Stop new exposure only:</b> monitors are halted and queued open trades are
 *       cancelled; closing and modifying commands keep flowing</li>
 *   <li><b>Manual re-arm:</b> only {@link #reset(String)} clears a trip</li>
 * </ul>
 *
 * <p><b>Trip order:</b>
 * <ol>
 *   <li>Set the flag and record reason, initiator and time</li>
 *   <li>Stop every strategy monitor</li>
 *   <li>Cancel queued OPEN_POSITION commands</li>
 *   <li>Publish one CRITICAL KILL_SWITCH_TRIPPED event</li>
 * </ol>
 *
 * <p>Monitor and queue collaborators are resolved lazily; both depend on this service.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final EventPublisherHelper eventPublisherHelper;
    private final ObjectProvider<MonitorHalter> monitorHalter;
    private final ObjectProvider<OpenTradePurger> openTradePurger;
    private final Clock clock;

    private final AtomicBoolean tripped = new AtomicBoolean(false);
    private final AtomicReference<KillSwitchStatus> status = new AtomicReference<>(KillSwitchStatus.idle());

    public KillSwitchService(
            EventPublisherHelper eventPublisherHelper,
            ObjectProvider<MonitorHalter> monitorHalter,
            ObjectProvider<OpenTradePurger> openTradePurger,
            Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitorHalter = monitorHalter;
        this.openTradePurger = openTradePurger;
        this.clock = clock;
    }

    // ========================
    // TRIP / RESET
    // ========================

    /**
     * Trips the kill switch.
     *
     * @return true if this call tripped it, false if it was already tripped
     */
    public boolean trip(String reason, TripInitiator initiator) {
        if (!tripped.compareAndSet(false, true)) {
            log.warn("Kill switch already tripped, ignoring trip from {}: {}", initiator, reason);
            return false;
        }

        KillSwitchStatus previous = status.get();
        status.set(KillSwitchStatus.builder()
                .state(KillSwitchState.TRIPPED)
                .reason(reason)
                .initiator(initiator)
                .severity(Severity.CRITICAL)
                .trippedAt(clock.instant())
                .tripCount(previous.getTripCount() + 1)
                .build());
        log.error("KILL SWITCH TRIPPED by {}: {}", initiator, reason);

        int monitorsStopped = stopMonitors();
        int commandsCancelled = purgeQueuedTrades(reason);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("initiator", initiator.name());
        details.put("monitorsStopped", monitorsStopped);
        details.put("commandsCancelled", commandsCancelled);
        eventPublisherHelper.publishSafetyEvent(
                this, SafetyEventType.KILL_SWITCH_TRIPPED, Severity.CRITICAL, "Kill switch tripped: " + reason, details);
        return true;
    }

    /**
     * Re-arms the kill switch after an operator decision.
     *
     * @return true if it was tripped and is now idle
     */
    public boolean reset(String operator) {
        if (!tripped.compareAndSet(true, false)) {
            log.info("Kill switch reset requested by {} but it is not tripped", operator);
            return false;
        }
        status.updateAndGet(current -> current.toBuilder()
                .state(KillSwitchState.IDLE)
                .resetAt(clock.instant())
                .resetBy(operator)
                .build());
        log.warn("Kill switch reset by {}", operator);
        eventPublisherHelper.publishSafetyEvent(
                this,
                SafetyEventType.KILL_SWITCH_RESET,
                Severity.WARNING,
                "Kill switch reset by " + operator,
                Map.of("operator", operator));
        return true;
    }

    public boolean isTripped() {
        return tripped.get();
    }

    public KillSwitchStatus getStatus() {
        return status.get();
    }

    // ========================
    // TRIP STEPS
    // ========================

    private int stopMonitors() {
        MonitorHalter halter = monitorHalter.getIfAvailable();
        if (halter == null) {
            return 0;
        }
        try {
            return halter.stopAll();
        } catch (RuntimeException e) {
            log.error("Failed to stop strategy monitors during kill switch trip", e);
            return 0;
        }
    }

    private int purgeQueuedTrades(String reason) {
        OpenTradePurger purger = openTradePurger.getIfAvailable();
        if (purger == null) {
            return 0;
        }
        try {
            return purger.purgeOpenTrades("Kill switch tripped: " + reason);
        } catch (RuntimeException e) {
            log.error("Failed to cancel queued open trades during kill switch trip", e);
            return 0;
        }
    }
}
