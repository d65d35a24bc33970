package com.tradeexecutor.unit.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.config.OrchestratorConfig;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.connection.ConnectionNames;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.domain.enums.ReconciliationSource;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.StrategyEvent;
import com.tradeexecutor.event.StrategyEventType;
import com.tradeexecutor.event.SystemEvent;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.orchestrator.ExecutorOrchestrator;
import com.tradeexecutor.orchestrator.ExecutorStatusService;
import com.tradeexecutor.platform.HeartbeatService;
import com.tradeexecutor.recovery.CrashMarker;
import com.tradeexecutor.recovery.ExecutionSnapshot;
import com.tradeexecutor.recovery.ReconciliationResult;
import com.tradeexecutor.recovery.StateReconciler;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.transport.CloudCommandChannel;
import com.tradeexecutor.transport.TerminalTransport;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.context.ConfigurableApplicationContext;

/** Unit tests for ExecutorOrchestrator: startup sequence and the fatal-error window. */
class ExecutorOrchestratorTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-03-02T10:00:00Z"));

    private OrchestratorConfig orchestratorConfig;
    private PlatformConfig platformConfig;
    private CrashMarker crashMarker;
    private StateReconciler stateReconciler;
    private ConnectionSupervisor connectionSupervisor;
    private CloudCommandChannel cloudCommandChannel;
    private HeartbeatService heartbeatService;
    private KillSwitchService killSwitchService;
    private EventPublisherHelper eventPublisherHelper;
    private ExecutorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestratorConfig = new OrchestratorConfig();
        orchestratorConfig.setMaxFatalErrors(3);
        orchestratorConfig.setFatalErrorWindowMs(60_000);
        platformConfig = new PlatformConfig();
        crashMarker = mock(CrashMarker.class);
        stateReconciler = mock(StateReconciler.class);
        connectionSupervisor = mock(ConnectionSupervisor.class);
        cloudCommandChannel = mock(CloudCommandChannel.class);
        heartbeatService = mock(HeartbeatService.class);
        killSwitchService = mock(KillSwitchService.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);

        when(stateReconciler.reconcileOnStartup(any())).thenReturn(ReconciliationResult.builder()
                .source(ReconciliationSource.LOCAL_SNAPSHOT)
                .strategyIds(List.of("s1"))
                .build());

        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        when(clock.millis()).thenAnswer(invocation -> now.get().toEpochMilli());

        orchestrator = new ExecutorOrchestrator(
                orchestratorConfig,
                platformConfig,
                crashMarker,
                stateReconciler,
                connectionSupervisor,
                mock(TerminalTransport.class),
                cloudCommandChannel,
                heartbeatService,
                mock(CommandPipeline.class),
                mock(ExecutorStatusService.class),
                killSwitchService,
                eventPublisherHelper,
                mock(ConfigurableApplicationContext.class),
                clock);
    }

    // ========================
    // STARTUP
    // ========================

    @Nested
    @DisplayName("Startup")
    class Startup {

        @Test
        @DisplayName("Clean start writes the marker, connects the terminal, reconciles and announces readiness")
        void cleanStart() {
            ReconciliationResult result = orchestrator.start();

            assertThat(result.getStrategyIds()).containsExactly("s1");
            assertThat(orchestrator.isStarted()).isTrue();
            InOrder order = inOrder(crashMarker, connectionSupervisor, stateReconciler, eventPublisherHelper);
            order.verify(crashMarker).write();
            order.verify(connectionSupervisor).connect(ConnectionNames.TERMINAL);
            order.verify(stateReconciler).reconcileOnStartup(Optional.empty());
            order.verify(eventPublisherHelper).publishSystemEvent(
                    any(), eq(SystemEventType.EXECUTOR_READY), eq("Executor ready with 1 strategies"), anyMap());
            verify(stateReconciler, never()).recoverFromCrash();
            verify(connectionSupervisor, never()).connect(ConnectionNames.CLOUD_CHANNEL);
            verify(connectionSupervisor, never()).connect(ConnectionNames.PLATFORM_API);
        }

        @Test
        @DisplayName("A crash marker triggers crash recovery and hands its snapshot to reconciliation")
        void crashRecovery() {
            ExecutionSnapshot snapshot = ExecutionSnapshot.builder().takenAt(now.get().minusSeconds(600)).build();
            when(crashMarker.exists()).thenReturn(true);
            when(stateReconciler.recoverFromCrash()).thenReturn(Optional.of(snapshot));

            orchestrator.start();

            verify(stateReconciler).reconcileOnStartup(Optional.of(snapshot));
        }

        @Test
        @DisplayName("Enabled cloud channel and configured platform are connected too")
        void allConnections() {
            when(cloudCommandChannel.isEnabled()).thenReturn(true);
            platformConfig.setUrl("https://platform.test");

            orchestrator.start();

            verify(connectionSupervisor).connect(ConnectionNames.CLOUD_CHANNEL);
            verify(connectionSupervisor).connect(ConnectionNames.PLATFORM_API);
            verify(cloudCommandChannel).onMessage(any());
            verify(heartbeatService).driver();
        }

        @Test
        @DisplayName("A marker write failure does not stop startup; a second start is ignored")
        void degradedAndIdempotent() {
            doThrow(new StateStoreException("read-only", new IOException("read-only"))).when(crashMarker).write();

            assertThat(orchestrator.start()).isNotNull();
            assertThat(orchestrator.start()).isNull();
            verify(stateReconciler, times(1)).reconcileOnStartup(any());
        }
    }

    // ========================
    // FATAL ERRORS
    // ========================

    @Nested
    @DisplayName("Fatal errors")
    class FatalErrors {

        private StrategyEvent monitorError(String strategyId) {
            return new StrategyEvent(this, strategyId, StrategyEventType.MONITOR_ERROR, "boom");
        }

        @Test
        @DisplayName("Errors below the limit are only counted")
        void belowLimit() {
            orchestrator.onStrategyEvent(monitorError("s1"));
            orchestrator.onSystemEvent(new SystemEvent(this, SystemEventType.DISPATCHER_CRASHED, "npe"));

            assertThat(orchestrator.getFatalErrorCount()).isEqualTo(2);
            verify(killSwitchService, never()).trip(anyString(), any());
        }

        @Test
        @DisplayName("Errors outside the window fall away")
        void windowSlides() {
            orchestrator.onStrategyEvent(monitorError("s1"));
            orchestrator.onStrategyEvent(monitorError("s1"));
            now.set(now.get().plus(Duration.ofSeconds(61)));
            orchestrator.onStrategyEvent(monitorError("s1"));

            assertThat(orchestrator.getFatalErrorCount()).isEqualTo(1);
            verify(killSwitchService, never()).trip(anyString(), any());
        }

        @Test
        @DisplayName("Reaching the limit trips the kill switch and announces FATAL_ERROR once")
        void limitReached() {
            for (int i = 0; i < 4; i++) {
                orchestrator.onStrategyEvent(monitorError("s" + i));
            }

            verify(killSwitchService, times(1)).trip("3 fatal errors within 60000 ms", TripInitiator.ERROR);
            verify(eventPublisherHelper, times(1)).publishSystemEvent(
                    any(), eq(SystemEventType.FATAL_ERROR), anyString(), anyMap());
        }

        @Test
        @DisplayName("Other strategy events are not fatal")
        void otherEventsIgnored() {
            orchestrator.onStrategyEvent(new StrategyEvent(this, "s1", StrategyEventType.STARTED, "ok"));

            assertThat(orchestrator.getFatalErrorCount()).isZero();
        }
    }
}
