package com.tradeexecutor.orchestrator;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.config.OrchestratorConfig;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.connection.ConnectionDriver;
import com.tradeexecutor.connection.ConnectionNames;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.StrategyEvent;
import com.tradeexecutor.event.StrategyEventType;
import com.tradeexecutor.event.SystemEvent;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.platform.HeartbeatService;
import com.tradeexecutor.recovery.CrashMarker;
import com.tradeexecutor.recovery.ExecutionSnapshot;
import com.tradeexecutor.recovery.ReconciliationResult;
import com.tradeexecutor.recovery.StateReconciler;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.transport.CloudCommandChannel;
import com.tradeexecutor.transport.TerminalTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Brings the executor up once the application context is ready.
 *
 * <ol>
 *   <li>Recover from a crash if the previous run left its marker behind</li>
 *   <li>Write a fresh crash marker</li>
 *   <li>Register and open the supervised connections (terminal, cloud channel, platform API)</li>
 *   <li>Reconcile the strategy set and start monitoring</li>
 *   <li>Mark the executor ready and publish EXECUTOR_READY</li>
 * </ol>
 *
 * <p>Also counts fatal errors (monitor halts and dispatcher crashes). Reaching
 * {@code max-fatal-errors} inside the window trips the kill switch and exits the application.
 */
@Service
public class ExecutorOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutorOrchestrator.class);

    private final OrchestratorConfig orchestratorConfig;
    private final PlatformConfig platformConfig;
    private final CrashMarker crashMarker;
    private final StateReconciler stateReconciler;
    private final ConnectionSupervisor connectionSupervisor;
    private final TerminalTransport terminalTransport;
    private final CloudCommandChannel cloudCommandChannel;
    private final HeartbeatService heartbeatService;
    private final CommandPipeline commandPipeline;
    private final ExecutorStatusService executorStatusService;
    private final KillSwitchService killSwitchService;
    private final EventPublisherHelper eventPublisherHelper;
    private final ApplicationContext applicationContext;
    private final Clock clock;

    private final Deque<Instant> fatalErrors = new ArrayDeque<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    public ExecutorOrchestrator(
            OrchestratorConfig orchestratorConfig,
            PlatformConfig platformConfig,
            CrashMarker crashMarker,
            StateReconciler stateReconciler,
            ConnectionSupervisor connectionSupervisor,
            TerminalTransport terminalTransport,
            CloudCommandChannel cloudCommandChannel,
            HeartbeatService heartbeatService,
            CommandPipeline commandPipeline,
            ExecutorStatusService executorStatusService,
            KillSwitchService killSwitchService,
            EventPublisherHelper eventPublisherHelper,
            ApplicationContext applicationContext,
            Clock clock) {
        this.orchestratorConfig = orchestratorConfig;
        this.platformConfig = platformConfig;
        this.crashMarker = crashMarker;
        this.stateReconciler = stateReconciler;
        this.connectionSupervisor = connectionSupervisor;
        this.terminalTransport = terminalTransport;
        this.cloudCommandChannel = cloudCommandChannel;
        this.heartbeatService = heartbeatService;
        this.commandPipeline = commandPipeline;
        this.executorStatusService = executorStatusService;
        this.killSwitchService = killSwitchService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.applicationContext = applicationContext;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!orchestratorConfig.isAutoStart()) {
            log.info("Auto start disabled; executor waits for an explicit start");
            return;
        }
        start();
    }

    // ========================
    // STARTUP
    // ========================

    /**
     * Runs the startup sequence once. A failing step is logged and the sequence carries on,
     * so the executor still comes up in a degraded state rather than not at all.
     */
    public ReconciliationResult start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Executor already started");
            return null;
        }
        long startedAt = clock.millis();
        log.info("Starting executor...");

        Optional<ExecutionSnapshot> crashSnapshot = Optional.empty();
        if (crashMarker.exists()) {
            log.warn("Crash marker found at {}, previous run did not shut down cleanly", crashMarker.getPath());
            crashSnapshot = stateReconciler.recoverFromCrash();
        }
        writeCrashMarker();

        List<String> connections = registerConnections();
        connections.forEach(connectionSupervisor::connect);

        ReconciliationResult result = stateReconciler.reconcileOnStartup(crashSnapshot);

        executorStatusService.markReady();
        long durationMs = clock.millis() - startedAt;
        log.info(
                "Executor ready in {} ms: {} strategies from {}, connections {}",
                durationMs,
                result.getStrategyCount(),
                result.getSource(),
                connections);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.EXECUTOR_READY,
                "Executor ready with " + result.getStrategyCount() + " strategies",
                Map.of(
                        "strategies", result.getStrategyCount(),
                        "source", result.getSource().name(),
                        "crashRecovered", result.isCrashRecovered(),
                        "startupMs", durationMs));
        return result;
    }

    /** Binds each connection to its driver and loss callback; returns the names to open. */
    List<String> registerConnections() {
        List<String> names = new ArrayList<>();

        terminalTransport.onConnectionLost(
                reason -> connectionSupervisor.reportDisconnected(ConnectionNames.TERMINAL, reason));
        connectionSupervisor.register(ConnectionNames.TERMINAL, new ConnectionDriver() {
            @Override
            public void open() {
                terminalTransport.connect();
            }

            @Override
            public void close() {
                terminalTransport.disconnect();
            }
        });
        names.add(ConnectionNames.TERMINAL);

        if (cloudCommandChannel.isEnabled()) {
            cloudCommandChannel.onMessage(commandPipeline::onCloudMessage);
            cloudCommandChannel.onConnectionLost(
                    reason -> connectionSupervisor.reportDisconnected(ConnectionNames.CLOUD_CHANNEL, reason));
            connectionSupervisor.register(ConnectionNames.CLOUD_CHANNEL, new ConnectionDriver() {
                @Override
                public void open() {
                    cloudCommandChannel.connect();
                }

                @Override
                public void close() {
                    cloudCommandChannel.disconnect();
                }
            });
            names.add(ConnectionNames.CLOUD_CHANNEL);
        } else {
            log.info("Cloud command channel disabled; commands arrive over the REST API only");
        }

        if (platformConfig.isConfigured()) {
            connectionSupervisor.register(ConnectionNames.PLATFORM_API, heartbeatService.driver());
            names.add(ConnectionNames.PLATFORM_API);
        } else {
            log.info("Platform URL not configured; running detached");
        }
        return names;
    }

    private void writeCrashMarker() {
        try {
            crashMarker.write();
        } catch (StateStoreException e) {
            log.error("Crash marker could not be written; an unclean exit will go unnoticed: {}", e.getMessage());
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    // ========================
    // FATAL ERRORS
    // ========================

    @EventListener
    public void onStrategyEvent(StrategyEvent event) {
        if (event.getEventType() == StrategyEventType.MONITOR_ERROR) {
            recordFatalError("monitor " + event.getStrategyId() + ": " + event.getMessage());
        }
    }

    @EventListener
    public void onSystemEvent(SystemEvent event) {
        if (event.getEventType() == SystemEventType.DISPATCHER_CRASHED) {
            recordFatalError("dispatcher: " + event.getMessage());
        }
    }

    /**
     * Counts a fatal error inside the sliding window.
     *
     * @return true if this error reached the limit and shutdown was triggered
     */
    boolean recordFatalError(String description) {
        Instant now = clock.instant();
        int count;
        synchronized (fatalErrors) {
            fatalErrors.addLast(now);
            Instant cutoff = now.minus(Duration.ofMillis(orchestratorConfig.getFatalErrorWindowMs()));
            while (!fatalErrors.isEmpty() && fatalErrors.peekFirst().isBefore(cutoff)) {
                fatalErrors.removeFirst();
            }
            count = fatalErrors.size();
        }
        log.error("Fatal error {}/{}: {}", count, orchestratorConfig.getMaxFatalErrors(), description);
        if (count < orchestratorConfig.getMaxFatalErrors() || !exiting.compareAndSet(false, true)) {
            return false;
        }

        String reason = count + " fatal errors within " + orchestratorConfig.getFatalErrorWindowMs() + " ms";
        killSwitchService.trip(reason, TripInitiator.ERROR);
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.FATAL_ERROR, reason, Map.of("lastError", description));
        exitApplication(reason);
        return true;
    }

    public int getFatalErrorCount() {
        synchronized (fatalErrors) {
            return fatalErrors.size();
        }
    }

    private void exitApplication(String reason) {
        // Off the caller's thread: the caller may be a monitor or the dispatcher that shutdown stops.
        Thread exitThread = new Thread(
                () -> {
                    log.error("Shutting down executor: {}", reason);
                    int code = SpringApplication.exit(applicationContext, () -> 1);
                    log.info("Application context closed with exit code {}", code);
                },
                "fatal-shutdown");
        exitThread.setDaemon(false);
        exitThread.start();
    }
}
