package com.tradeexecutor.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.command.CommandDispatcher;
import com.tradeexecutor.command.CommandHistory;
import com.tradeexecutor.command.CommandNormalizer;
import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandQueue;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.command.CommandResultReporter;
import com.tradeexecutor.command.InFlightGuard;
import com.tradeexecutor.command.StrategyLifecycleHandler;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.config.ReconcilerConfig;
import com.tradeexecutor.config.ResilienceConfig;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.enums.ReconciliationSource;
import com.tradeexecutor.domain.enums.StrategyStatus;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.marketdata.MarketDataService;
import com.tradeexecutor.monitor.ConditionEvaluator;
import com.tradeexecutor.monitor.FilterEvaluator;
import com.tradeexecutor.monitor.RecentSignalBuffer;
import com.tradeexecutor.monitor.SignalFactory;
import com.tradeexecutor.monitor.StrategyMonitor;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.observability.ExecutorMetricsService;
import com.tradeexecutor.orchestrator.ExecutorStatus;
import com.tradeexecutor.orchestrator.ExecutorStatusService;
import com.tradeexecutor.persistence.FileStateStore;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.platform.StrategyDefinitionParser;
import com.tradeexecutor.recovery.ReconciliationResult;
import com.tradeexecutor.recovery.StateReconciler;
import com.tradeexecutor.recovery.StateSnapshotService;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.safety.EmergencyStopMonitor;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.safety.SafetyGate;
import com.tradeexecutor.transport.CloudCommandChannel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

/**
 * Cross-service integration test for the strategy lifecycle.
 * Wires real CommandPipeline + StrategyLifecycleHandler + StrategyMonitor + FileStateStore +
 * StateReconciler to verify: START via command -> visible in status -> PAUSE persisted ->
 * restart restores from local state -> STOP leaves nothing to restore.
 */
class StrategyLifecycleIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path stateDirectory;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final EventPublisherHelper eventPublisherHelper =
            new EventPublisherHelper(mock(ApplicationEventPublisher.class));

    private FileStateStore stateStore;
    private PlatformApiClient platformApiClient;
    private StrategyRegistry strategyRegistry;
    private StrategyMonitor strategyMonitor;
    private CommandPipeline pipeline;
    private CommandHistory commandHistory;
    private ExecutorStatusService executorStatusService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        stateStore = new FileStateStore(stateDirectory);
        platformApiClient = mock(PlatformApiClient.class);
        strategyRegistry = new StrategyRegistry();
        strategyMonitor = newMonitor(strategyRegistry);

        CommandConfig config = new CommandConfig();
        commandHistory = new CommandHistory(config);
        KillSwitchService killSwitchService = mock(KillSwitchService.class);
        CommandResultReporter reporter = new CommandResultReporter(
                commandHistory,
                eventPublisherHelper,
                mock(CloudCommandChannel.class),
                platformApiClient,
                new ExecutorProperties(),
                Runnable::run);
        StrategyLifecycleHandler lifecycleHandler = new StrategyLifecycleHandler(
                strategyMonitor,
                strategyRegistry,
                new StrategyDefinitionParser(),
                stateStore,
                platformApiClient,
                eventPublisherHelper);

        pipeline = new CommandPipeline(
                new CommandNormalizer(config, clock),
                new CommandQueue(config),
                mock(CommandDispatcher.class),
                lifecycleHandler,
                reporter,
                commandHistory,
                new InFlightGuard(),
                mock(SafetyGate.class),
                killSwitchService,
                mock(AccountStateService.class),
                eventPublisherHelper,
                RateLimiter.ofDefaults("lifecycle-it"),
                config,
                mock(ExecutorService.class),
                (ObjectProvider<ExecutorStatusService>) mock(ObjectProvider.class),
                clock);

        executorStatusService = new ExecutorStatusService(
                new ExecutorProperties(),
                mock(ConnectionSupervisor.class),
                strategyRegistry,
                strategyMonitor,
                mock(RecentSignalBuffer.class),
                mock(ExecutorMetricsService.class),
                mock(MarketDataService.class),
                killSwitchService,
                pipeline,
                mock(AccountStateService.class),
                clock);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private StrategyMonitor newMonitor(StrategyRegistry registry) {
        TaskScheduler scheduler = mock(TaskScheduler.class);
        when(scheduler.scheduleWithFixedDelay(any(Runnable.class), any(Duration.class)))
                .thenReturn((ScheduledFuture) mock(ScheduledFuture.class));
        return new StrategyMonitor(
                registry,
                mock(MarketDataService.class),
                mock(FilterEvaluator.class),
                mock(ConditionEvaluator.class),
                mock(SignalFactory.class),
                mock(KillSwitchService.class),
                mock(AccountStateService.class),
                mock(EmergencyStopMonitor.class),
                eventPublisherHelper,
                mock(ExecutorMetricsService.class),
                new MonitorConfig(),
                scheduler,
                clock);
    }

    /** Simulates a process restart: fresh registry and monitor over the same state directory. */
    private ReconciliationResult restart(StrategyRegistry registry, StrategyMonitor monitor) {
        ReconcilerConfig reconcilerConfig = new ReconcilerConfig();
        reconcilerConfig.setFetchAttempts(1);
        reconcilerConfig.setFetchInitialDelayMs(1);
        StateReconciler reconciler = new StateReconciler(
                platformApiClient,
                new ResilienceConfig().platformFetchRetry(reconcilerConfig),
                new FileStateStore(stateDirectory),
                registry,
                monitor,
                mock(StateSnapshotService.class),
                eventPublisherHelper,
                clock);
        return reconciler.reconcileOnStartup(Optional.empty());
    }

    private static Map<String, Object> command(String id, String type, Map<String, Object> payload) {
        return Map.of("id", id, "type", type, "payload", payload);
    }

    private static Map<String, Object> definition() {
        return Map.of(
                "id", "s1",
                "name", "RSI reversal",
                "symbol", "EURUSD",
                "timeframe", "H1",
                "conditions", List.of(Map.of("indicator", "RSI", "operator", "<", "value", 30)));
    }

    @Test
    @DisplayName("Started strategy is visible in status, survives restart paused, and is gone after STOP")
    void startPauseRestartStop() {
        // Step 1: START_STRATEGY with an embedded definition
        CommandReceipt started = pipeline.submit(command("start-1", "START_STRATEGY", Map.of("strategy", definition())));
        assertThat(started.status()).isEqualTo(CommandStatus.COMPLETED);
        assertThat(started.message()).isEqualTo("Strategy s1 started");

        ExecutorStatus status = executorStatusService.getStatus();
        assertThat(status.getStrategies()).extracting(ActiveStrategy::getId).containsExactly("s1");
        assertThat(status.getStrategies().get(0).getTimeframe()).isEqualTo(Timeframe.H1);
        assertThat(status.getMonitors()).hasSize(1);
        assertThat(status.getMonitors().get(0).paused()).isFalse();
        assertThat(stateStore.getActiveStrategies()).extracting(ActiveStrategy::getId).containsExactly("s1");

        // Step 2: PAUSE is persisted
        pipeline.submit(command("pause-1", "PAUSE_STRATEGY", Map.of("strategyId", "s1")));
        assertThat(commandHistory.get("pause-1")).hasValueSatisfying(
                result -> assertThat(result.getMessage()).isEqualTo("Strategy s1 paused"));
        assertThat(stateStore.getActiveStrategies().get(0).getStatus()).isEqualTo(StrategyStatus.PAUSED);

        // Step 3: restart without a control plane restores from the local store, still paused
        StrategyRegistry restoredRegistry = new StrategyRegistry();
        StrategyMonitor restoredMonitor = newMonitor(restoredRegistry);
        ReconciliationResult restored = restart(restoredRegistry, restoredMonitor);
        assertThat(restored.getSource()).isEqualTo(ReconciliationSource.LOCAL_SNAPSHOT);
        assertThat(restored.getStrategyIds()).containsExactly("s1");
        assertThat(restoredRegistry.get("s1").orElseThrow().getStatus()).isEqualTo(StrategyStatus.PAUSED);
        assertThat(restoredMonitor.getMonitorStatuses().get(0).paused()).isTrue();

        // Step 4: STOP removes it from the store
        CommandReceipt stopped = pipeline.submit(command("stop-1", "STOP_STRATEGY", Map.of("strategyId", "s1")));
        assertThat(stopped.status()).isEqualTo(CommandStatus.COMPLETED);
        assertThat(strategyRegistry.contains("s1")).isFalse();
        assertThat(stateStore.getActiveStrategies()).isEmpty();

        ReconciliationResult afterStop = restart(new StrategyRegistry(), newMonitor(new StrategyRegistry()));
        assertThat(afterStop.getSource()).isEqualTo(ReconciliationSource.EMPTY);
    }

    @Test
    @DisplayName("Duplicate START is answered from history without restarting the monitor")
    void duplicateStartIgnored() {
        pipeline.submit(command("start-1", "START_STRATEGY", Map.of("strategy", definition())));

        CommandReceipt duplicate = pipeline.submit(command("start-1", "START_STRATEGY", Map.of("strategy", definition())));

        assertThat(duplicate.status()).isEqualTo(CommandStatus.COMPLETED);
        assertThat(duplicate.message()).isEqualTo(CommandPipeline.DUPLICATE);
        assertThat(strategyMonitor.activeMonitorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("START with rules at the top level of the payload runs without a control-plane fetch")
    void flatRulesStart() {
        Map<String, Object> payload = Map.of(
                "strategyId", "s1",
                "symbol", "EURUSD",
                "timeframe", "H1",
                "rules", Map.of("entry", Map.of(
                        "logic", "AND",
                        "conditions", List.of(Map.of("indicator", "RSI", "condition", "<", "value", 30)))));

        CommandReceipt started = pipeline.submit(command("start-flat", "START_STRATEGY", payload));

        assertThat(started.status()).isEqualTo(CommandStatus.COMPLETED);
        assertThat(strategyRegistry.get("s1")).hasValueSatisfying(strategy -> {
            assertThat(strategy.getTimeframe()).isEqualTo(Timeframe.H1);
            assertThat(strategy.getConditions()).hasSize(1);
        });
        assertThat(stateStore.getActiveStrategies()).extracting(ActiveStrategy::getId).containsExactly("s1");
        verify(platformApiClient, never()).fetchActiveStrategies();
    }
}
