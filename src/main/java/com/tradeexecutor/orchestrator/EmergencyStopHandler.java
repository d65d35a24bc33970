package com.tradeexecutor.orchestrator;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.config.EmergencyConfig;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.SafetyEvent;
import com.tradeexecutor.event.SafetyEventType;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Flattens the account after a kill-switch trip when {@code executor.emergency.close-positions-on-trip}
 * is set. Cloud emergency stops carry their own closePositions flag and are handled by the pipeline.
 */
@Component
public class EmergencyStopHandler {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopHandler.class);

    private final EmergencyConfig emergencyConfig;
    private final CommandPipeline commandPipeline;
    private final Clock clock;

    public EmergencyStopHandler(EmergencyConfig emergencyConfig, CommandPipeline commandPipeline, Clock clock) {
        this.emergencyConfig = emergencyConfig;
        this.commandPipeline = commandPipeline;
        this.clock = clock;
    }

    @EventListener
    public void onSafetyEvent(SafetyEvent event) {
        if (event.getEventType() != SafetyEventType.KILL_SWITCH_TRIPPED || !emergencyConfig.isClosePositionsOnTrip()) {
            return;
        }
        if (TripInitiator.CLOUD.name().equals(event.getDetails().get("initiator"))) {
            log.debug("Cloud emergency stop decides its own position close");
            return;
        }
        String commandId = "killswitch_close_" + clock.millis();
        CommandReceipt receipt = commandPipeline.closeAllPositions(commandId, event.getMessage());
        log.warn("Kill switch tripped, close-all {} submitted: {}", commandId, receipt.status());
    }
}
