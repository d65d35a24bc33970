package com.tradeexecutor.unit.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.connection.ConnectionNames;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.platform.HeartbeatService;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.safety.KillSwitchService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HeartbeatServiceTest {

    private PlatformApiClient platformApiClient;
    private ConnectionSupervisor connectionSupervisor;
    private KillSwitchService killSwitchService;
    private HeartbeatService heartbeatService;

    @BeforeEach
    void setUp() {
        platformApiClient = mock(PlatformApiClient.class);
        connectionSupervisor = mock(ConnectionSupervisor.class);
        killSwitchService = mock(KillSwitchService.class);
        PlatformConfig platformConfig = new PlatformConfig();
        platformConfig.setUrl("https://platform.test");
        platformConfig.setMaxMissedHeartbeats(2);
        ExecutorProperties executorProperties = new ExecutorProperties();
        executorProperties.setId("exec-1");
        heartbeatService = new HeartbeatService(
                platformApiClient,
                platformConfig,
                connectionSupervisor,
                new StrategyRegistry(),
                killSwitchService,
                executorProperties,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A successful beat reports the platform connection as connected")
    void successfulBeat() {
        when(killSwitchService.isTripped()).thenReturn(true);

        assertThat(heartbeatService.beat()).isTrue();

        verify(platformApiClient).sendHeartbeat(argThat(payload -> "exec-1".equals(payload.get("executorId"))
                && "HALTED".equals(payload.get("status"))
                && "2026-03-02T10:00:00Z".equals(payload.get("timestamp"))));
        verify(connectionSupervisor).reportConnected(ConnectionNames.PLATFORM_API);
    }

    @Test
    @DisplayName("Misses below the threshold are only counted; reaching it reports an error")
    void missedHeartbeats() {
        doThrow(new PlatformApiException("timeout")).when(platformApiClient).sendHeartbeat(anyMap());

        assertThat(heartbeatService.beat()).isFalse();
        verify(connectionSupervisor, never()).reportError(anyString(), anyString());

        heartbeatService.beat();
        assertThat(heartbeatService.getMissedHeartbeats()).isEqualTo(2);
        verify(connectionSupervisor).reportError(eq(ConnectionNames.PLATFORM_API), eq("Missed 2 heartbeats: timeout"));
    }

    @Test
    @DisplayName("A success after misses resets the counter")
    void recovery() {
        doThrow(new PlatformApiException("timeout")).doNothing().when(platformApiClient).sendHeartbeat(anyMap());

        heartbeatService.beat();
        heartbeatService.beat();

        assertThat(heartbeatService.getMissedHeartbeats()).isZero();
    }
}
