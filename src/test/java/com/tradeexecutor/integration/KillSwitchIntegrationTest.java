package com.tradeexecutor.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
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
import com.tradeexecutor.command.TerminalCommandExecutor;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.config.EmergencyConfig;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.domain.enums.CommandFailureKind;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.CommandEvent;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.orchestrator.ExecutorStatusService;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.safety.CorrelationTable;
import com.tradeexecutor.safety.EmergencyStopMonitor;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.safety.MonitorHalter;
import com.tradeexecutor.safety.OpenTradePurger;
import com.tradeexecutor.safety.SafetyGate;
import com.tradeexecutor.safety.SafetyLimits;
import com.tradeexecutor.transport.CloudCommandChannel;
import com.tradeexecutor.transport.simulator.SimulatedTerminalTransport;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Cross-service integration test for the kill switch.
 * Wires real CommandPipeline + CommandDispatcher + SafetyGate + KillSwitchService against
 * the simulated terminal to verify the sequence:
 * open trade -> trip -> queued opens cancelled -> new opens denied -> close all -> reset.
 */
class KillSwitchIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private SimulatedTerminalTransport terminal;
    private AccountStateService accountStateService;
    private KillSwitchService killSwitchService;
    private CommandHistory commandHistory;
    private CommandPipeline pipeline;
    private ExecutorService dispatchExecutor;
    private EmergencyStopMonitor emergencyStopMonitor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CommandConfig config = new CommandConfig();
        // Command events reach the emergency monitor the way the application context delivers them
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> {
            if (event instanceof CommandEvent commandEvent && emergencyStopMonitor != null) {
                emergencyStopMonitor.onCommandEvent(commandEvent);
            }
        });
        dispatchExecutor = Executors.newCachedThreadPool();

        terminal = new SimulatedTerminalTransport(clock, 10_000);
        terminal.connect();
        terminal.setPrice("EURUSD", 1.0850);
        terminal.setPrice("USDJPY", 149.50);
        accountStateService = new AccountStateService(terminal, eventPublisherHelper, clock);

        ObjectProvider<MonitorHalter> halterProvider = mock(ObjectProvider.class);
        ObjectProvider<OpenTradePurger> purgerProvider = mock(ObjectProvider.class);
        when(purgerProvider.getIfAvailable()).thenAnswer(invocation -> pipeline);
        killSwitchService = new KillSwitchService(eventPublisherHelper, halterProvider, purgerProvider, clock);

        SafetyLimits limits = SafetyLimits.builder()
                .maxDailyLoss(new BigDecimal("500"))
                .maxDrawdown(new BigDecimal("1000"))
                .maxPositions(5)
                .maxLotSize(new BigDecimal("1.0"))
                .maxCorrelation(0.7)
                .maxTotalExposure(new BigDecimal("5000"))
                .contractSize(new BigDecimal("100000"))
                .leverage(new BigDecimal("100"))
                .build();
        SafetyGate safetyGate =
                new SafetyGate(limits, killSwitchService, new CorrelationTable(), eventPublisherHelper);

        EmergencyConfig emergencyConfig = new EmergencyConfig();
        emergencyConfig.setMaxErrorRatePerMinute(20);
        emergencyStopMonitor = new EmergencyStopMonitor(
                emergencyConfig, limits, killSwitchService, accountStateService, eventPublisherHelper, clock);

        commandHistory = new CommandHistory(config);
        CommandQueue commandQueue = new CommandQueue(config);
        InFlightGuard inFlightGuard = new InFlightGuard();
        RateLimiter rateLimiter = RateLimiter.ofDefaults("kill-switch-it");
        CommandResultReporter reporter = new CommandResultReporter(
                commandHistory,
                eventPublisherHelper,
                mock(CloudCommandChannel.class),
                mock(PlatformApiClient.class),
                new ExecutorProperties(),
                Runnable::run);
        CommandDispatcher dispatcher = new CommandDispatcher(
                commandQueue,
                new TerminalCommandExecutor(terminal, accountStateService),
                inFlightGuard,
                reporter,
                killSwitchService,
                rateLimiter,
                config,
                eventPublisherHelper,
                dispatchExecutor);

        pipeline = new CommandPipeline(
                new CommandNormalizer(config, clock),
                commandQueue,
                dispatcher,
                mock(StrategyLifecycleHandler.class),
                reporter,
                commandHistory,
                inFlightGuard,
                safetyGate,
                killSwitchService,
                accountStateService,
                eventPublisherHelper,
                rateLimiter,
                config,
                dispatchExecutor,
                (ObjectProvider<ExecutorStatusService>) mock(ObjectProvider.class),
                clock);

        accountStateService.refresh();
    }

    @AfterEach
    void tearDown() {
        dispatchExecutor.shutdownNow();
    }

    private static Map<String, Object> open(String id, String symbol, double volume, String priority) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", id);
        raw.put("type", "OPEN_POSITION");
        raw.put("priority", priority);
        raw.put("payload", Map.of("symbol", symbol, "type", "BUY", "volume", volume, "strategyId", "s1"));
        return raw;
    }

    private void awaitStatus(String commandId, CommandStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (pipeline.getCommandStatus(commandId) != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(pipeline.getCommandStatus(commandId)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Trip cancels queued opens, denies new ones, and close-all flattens the book until reset")
    void fullKillSwitchSequence() throws Exception {
        // Step 1: an urgent open reaches the terminal
        CommandReceipt first = pipeline.submit(open("open-1", "EURUSD", 0.1, "URGENT"));
        assertThat(first.status()).isEqualTo(CommandStatus.PROCESSING);
        awaitStatus("open-1", CommandStatus.COMPLETED);
        assertThat(accountStateService.refresh().getOpenPositions()).hasSize(1);

        // Step 2: a normal open waits in the queue (no consumer is running)
        CommandReceipt queued = pipeline.submit(open("open-2", "USDJPY", 0.1, "NORMAL"));
        assertThat(queued.status()).isEqualTo(CommandStatus.QUEUED);

        // Step 3: trip
        assertThat(killSwitchService.trip("manual test", TripInitiator.MANUAL)).isTrue();
        assertThat(pipeline.getCommandStatus("open-2")).isEqualTo(CommandStatus.CANCELLED);
        assertThat(commandHistory.get("open-2")).hasValueSatisfying(
                result -> assertThat(result.getMessage()).isEqualTo("Kill switch tripped: manual test"));

        // Step 4: new exposure is refused before it is queued
        CommandReceipt denied = pipeline.submit(open("open-3", "EURUSD", 0.1, "URGENT"));
        assertThat(denied.status()).isEqualTo(CommandStatus.FAILED);
        assertThat(denied.message()).isEqualTo("Kill switch is tripped");

        // Step 5: closing is still allowed
        CommandReceipt closeAll = pipeline.closeAllPositions("close-all-1", "manual test");
        assertThat(closeAll.status()).isEqualTo(CommandStatus.PROCESSING);
        awaitStatus("close-all-1", CommandStatus.COMPLETED);
        assertThat(accountStateService.refresh().getOpenPositions()).isEmpty();

        // Step 6: reset re-arms trading
        assertThat(killSwitchService.reset("ops")).isTrue();
        pipeline.submit(open("open-4", "EURUSD", 0.1, "URGENT"));
        awaitStatus("open-4", CommandStatus.COMPLETED);
        assertThat(killSwitchService.getStatus().getTripCount()).isEqualTo(1);
        assertThat(killSwitchService.getStatus().getResetBy()).isEqualTo("ops");
    }

    @Test
    @DisplayName("A safety-limit denial never reaches the terminal")
    void safetyDenialStopsAtGate() {
        CommandReceipt receipt = pipeline.submit(open("big-1", "EURUSD", 2.0, "URGENT"));

        assertThat(receipt.status()).isEqualTo(CommandStatus.FAILED);
        assertThat(receipt.message()).startsWith("Lot size 2");
        assertThat(killSwitchService.isTripped()).isFalse();
        assertThat(accountStateService.refresh().getOpenPositions()).isEmpty();
    }

    @Test
    @DisplayName("A burst of safety denials keeps the executor running")
    void repeatedDenialsDoNotTrip() {
        for (int i = 0; i < 25; i++) {
            CommandReceipt receipt = pipeline.submit(open("big-" + i, "EURUSD", 5.0, "NORMAL"));
            assertThat(receipt.status()).isEqualTo(CommandStatus.FAILED);
        }

        assertThat(commandHistory.get("big-0")).hasValueSatisfying(
                result -> assertThat(result.getFailureKind()).isEqualTo(CommandFailureKind.SAFETY_DENIED));
        assertThat(emergencyStopMonitor.errorsInLastMinute()).isZero();
        assertThat(killSwitchService.isTripped()).isFalse();
    }

    @Test
    @DisplayName("Cloud emergency stop trips as CLOUD and closes positions when asked")
    void cloudEmergencyStop() throws Exception {
        pipeline.submit(open("open-1", "EURUSD", 0.1, "URGENT"));
        awaitStatus("open-1", CommandStatus.COMPLETED);

        pipeline.onCloudMessage(
                CloudCommandChannel.EVENT_EMERGENCY_STOP, "{\"reason\": \"cloud halt\", \"closePositions\": true}");

        assertThat(killSwitchService.isTripped()).isTrue();
        assertThat(killSwitchService.getStatus().getInitiator()).isEqualTo(TripInitiator.CLOUD);
        assertThat(killSwitchService.getStatus().getReason()).isEqualTo("cloud halt");
        awaitStatus("emergency_" + NOW.toEpochMilli(), CommandStatus.COMPLETED);
        assertThat(accountStateService.refresh().getOpenPositions()).isEmpty();
    }
}
