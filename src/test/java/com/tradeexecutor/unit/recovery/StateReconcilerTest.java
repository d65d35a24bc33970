package com.tradeexecutor.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.config.ReconcilerConfig;
import com.tradeexecutor.config.ResilienceConfig;
import com.tradeexecutor.domain.enums.EaAttachmentStatus;
import com.tradeexecutor.domain.enums.ReconciliationSource;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.monitor.StrategyMonitor;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.persistence.ExecutorStateStore;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.recovery.ExecutionSnapshot;
import com.tradeexecutor.recovery.ReconciliationResult;
import com.tradeexecutor.recovery.StateReconciler;
import com.tradeexecutor.recovery.StateSnapshotService;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for StateReconciler: control plane first with retry, then the persisted set,
 * then the crash snapshot.
 */
class StateReconcilerTest {

    private PlatformApiClient platformApiClient;
    private ExecutorStateStore executorStateStore;
    private StrategyRegistry strategyRegistry;
    private StrategyMonitor strategyMonitor;
    private StateSnapshotService stateSnapshotService;
    private EventPublisherHelper eventPublisherHelper;
    private StateReconciler reconciler;

    @BeforeEach
    void setUp() {
        platformApiClient = mock(PlatformApiClient.class);
        executorStateStore = mock(ExecutorStateStore.class);
        strategyRegistry = new StrategyRegistry();
        strategyMonitor = mock(StrategyMonitor.class);
        stateSnapshotService = mock(StateSnapshotService.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        when(platformApiClient.isConfigured()).thenReturn(true);

        ReconcilerConfig reconcilerConfig = new ReconcilerConfig();
        reconcilerConfig.setFetchAttempts(3);
        reconcilerConfig.setFetchInitialDelayMs(1);

        reconciler = new StateReconciler(
                platformApiClient,
                new ResilienceConfig().platformFetchRetry(reconcilerConfig),
                executorStateStore,
                strategyRegistry,
                strategyMonitor,
                stateSnapshotService,
                eventPublisherHelper,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    private static ActiveStrategy strategy(String id, EaAttachmentStatus attachment) {
        return ActiveStrategy.builder()
                .id(id)
                .name(id)
                .symbols(List.of("EURUSD"))
                .timeframe(Timeframe.H1)
                .eaAttachment(attachment)
                .build();
    }

    // ========================
    // CONTROL PLANE
    // ========================

    @Nested
    @DisplayName("Control plane source")
    class ControlPlane {

        @Test
        @DisplayName("Fetched strategies win, keep recorded attachments and replace the persisted set")
        void fetchedWins() {
            when(platformApiClient.fetchActiveStrategies()).thenReturn(List.of(
                    strategy("s1", EaAttachmentStatus.UNKNOWN), strategy("s2", EaAttachmentStatus.UNKNOWN)));
            when(executorStateStore.getActiveStrategies())
                    .thenReturn(List.of(strategy("s1", EaAttachmentStatus.ATTACHED_RECORDED)));

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.CONTROL_PLANE);
            assertThat(result.getStrategyIds()).containsExactly("s1", "s2");
            assertThat(result.getAttempts()).isEqualTo(1);
            assertThat(strategyRegistry.get("s1").orElseThrow().getEaAttachment())
                    .isEqualTo(EaAttachmentStatus.ATTACHED_RECORDED);
            assertThat(strategyRegistry.get("s2").orElseThrow().getEaAttachment())
                    .isEqualTo(EaAttachmentStatus.NEEDS_MANUAL_ATTACH);
            verify(executorStateStore).clearActiveStrategies();
            verify(executorStateStore, times(2)).saveActiveStrategy(any());
            verify(strategyMonitor, times(2)).startMonitoring(any());
            verify(eventPublisherHelper).publishSystemEvent(
                    any(), eq(SystemEventType.STATE_RECONCILED), eq("Reconciled from CONTROL_PLANE"), anyMap());
        }

        @Test
        @DisplayName("Transient control plane errors are retried")
        void retriesThenSucceeds() {
            when(platformApiClient.fetchActiveStrategies())
                    .thenThrow(new PlatformApiException("503"))
                    .thenReturn(List.of(strategy("s1", EaAttachmentStatus.UNKNOWN)));

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.CONTROL_PLANE);
            assertThat(result.getAttempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("An empty control plane list is authoritative")
        void emptyListAuthoritative() {
            when(platformApiClient.fetchActiveStrategies()).thenReturn(List.of());
            when(executorStateStore.getActiveStrategies())
                    .thenReturn(List.of(strategy("stale", EaAttachmentStatus.UNKNOWN)));

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.CONTROL_PLANE);
            assertThat(result.getStrategyCount()).isZero();
            verify(executorStateStore).clearActiveStrategies();
            verify(strategyMonitor, never()).startMonitoring(any());
        }

        @Test
        @DisplayName("A store failure while persisting does not abort reconciliation")
        void persistFailureTolerated() {
            when(platformApiClient.fetchActiveStrategies())
                    .thenReturn(List.of(strategy("s1", EaAttachmentStatus.UNKNOWN)));
            doThrow(new StateStoreException("read-only", new IOException("read-only")))
                    .when(executorStateStore).clearActiveStrategies();

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getStrategyIds()).containsExactly("s1");
            verify(strategyMonitor).startMonitoring(any());
        }
    }

    // ========================
    // LOCAL FALLBACK
    // ========================

    @Nested
    @DisplayName("Local fallback")
    class LocalFallback {

        @Test
        @DisplayName("After all attempts fail the persisted set is used")
        void persistedAfterRetries() {
            when(platformApiClient.fetchActiveStrategies()).thenThrow(new PlatformApiException("down"));
            when(executorStateStore.getActiveStrategies())
                    .thenReturn(List.of(strategy("s1", EaAttachmentStatus.ATTACHED_RECORDED)));

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.LOCAL_SNAPSHOT);
            assertThat(result.getAttempts()).isEqualTo(3);
            assertThat(result.getStrategyIds()).containsExactly("s1");
            verify(executorStateStore, never()).clearActiveStrategies();
        }

        @Test
        @DisplayName("An unconfigured control plane goes straight to local state")
        void unconfigured() {
            when(platformApiClient.isConfigured()).thenReturn(false);

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.empty());

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.EMPTY);
            assertThat(result.getAttempts()).isZero();
            verify(platformApiClient, never()).fetchActiveStrategies();
        }

        @Test
        @DisplayName("With nothing persisted the crash snapshot's strategies are restored")
        void crashSnapshotFallback() {
            when(platformApiClient.isConfigured()).thenReturn(false);
            ExecutionSnapshot crash = ExecutionSnapshot.builder()
                    .takenAt(Instant.parse("2026-03-02T09:00:00Z"))
                    .strategies(List.of(strategy("s9", EaAttachmentStatus.ATTACHED_RECORDED)))
                    .build();

            ReconciliationResult result = reconciler.reconcileOnStartup(Optional.of(crash));

            assertThat(result.getSource()).isEqualTo(ReconciliationSource.LOCAL_SNAPSHOT);
            assertThat(result.isCrashRecovered()).isTrue();
            ArgumentCaptor<ActiveStrategy> captor = ArgumentCaptor.forClass(ActiveStrategy.class);
            verify(strategyMonitor).startMonitoring(captor.capture());
            assertThat(captor.getValue().getId()).isEqualTo("s9");
        }
    }

    // ========================
    // CRASH RECOVERY
    // ========================

    @Nested
    @DisplayName("Crash recovery")
    class CrashRecovery {

        @Test
        @DisplayName("Recovery loads the latest snapshot and publishes CRASH_RECOVERED")
        void loadsLatest() {
            ExecutionSnapshot last = ExecutionSnapshot.builder().takenAt(Instant.parse("2026-03-02T09:00:00Z")).build();
            when(stateSnapshotService.latest()).thenReturn(Optional.of(last));

            assertThat(reconciler.recoverFromCrash()).contains(last);
            verify(eventPublisherHelper).publishSystemEvent(
                    any(), eq(SystemEventType.CRASH_RECOVERED), anyString(), anyMap());
        }

        @Test
        @DisplayName("An unreadable snapshot still reports recovery, without a snapshot")
        void unreadableSnapshot() {
            when(stateSnapshotService.latest())
                    .thenThrow(new StateStoreException("corrupt", new IOException("corrupt")));

            assertThat(reconciler.recoverFromCrash()).isEmpty();
            verify(eventPublisherHelper).publishSystemEvent(
                    any(), eq(SystemEventType.CRASH_RECOVERED), anyString(), anyMap());
        }
    }
}
