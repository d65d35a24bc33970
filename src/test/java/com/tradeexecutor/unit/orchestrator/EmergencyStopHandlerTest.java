package com.tradeexecutor.unit.orchestrator;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.config.EmergencyConfig;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.event.SafetyEvent;
import com.tradeexecutor.event.SafetyEventType;
import com.tradeexecutor.event.Severity;
import com.tradeexecutor.orchestrator.EmergencyStopHandler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EmergencyStopHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private EmergencyConfig emergencyConfig;
    private CommandPipeline commandPipeline;
    private EmergencyStopHandler handler;

    @BeforeEach
    void setUp() {
        emergencyConfig = new EmergencyConfig();
        emergencyConfig.setClosePositionsOnTrip(true);
        commandPipeline = mock(CommandPipeline.class);
        when(commandPipeline.closeAllPositions(anyString(), anyString()))
                .thenReturn(new CommandReceipt("x", CommandStatus.PROCESSING, "ok"));
        handler = new EmergencyStopHandler(emergencyConfig, commandPipeline, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SafetyEvent tripped(String initiator) {
        return new SafetyEvent(
                new Object(),
                SafetyEventType.KILL_SWITCH_TRIPPED,
                Severity.CRITICAL,
                "Kill switch tripped: daily loss",
                Map.of("initiator", initiator));
    }

    @Test
    @DisplayName("An automatic trip submits close-all when configured")
    void closesOnTrip() {
        handler.onSafetyEvent(tripped("AUTOMATIC"));

        verify(commandPipeline).closeAllPositions(
                eq("killswitch_close_" + NOW.toEpochMilli()), eq("Kill switch tripped: daily loss"));
    }

    @Test
    @DisplayName("Cloud trips, other events and the disabled flag leave positions alone")
    void skipped() {
        handler.onSafetyEvent(tripped("CLOUD"));
        handler.onSafetyEvent(new SafetyEvent(new Object(), SafetyEventType.LIMIT_WARNING, Severity.WARNING, "80%"));
        emergencyConfig.setClosePositionsOnTrip(false);
        handler.onSafetyEvent(tripped("MANUAL"));

        verify(commandPipeline, never()).closeAllPositions(anyString(), anyString());
    }
}
