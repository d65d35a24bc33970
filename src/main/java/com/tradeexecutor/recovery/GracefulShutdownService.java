package com.tradeexecutor.recovery;

import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.monitor.StrategyMonitor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown, run before the dispatcher and schedulers stop.
 *
 * <ol>
 *   <li>Announce SHUTTING_DOWN on the event bus</li>
 *   <li>Write a final execution snapshot</li>
 *   <li>Stop all strategy monitors (the persisted strategy set is kept for the next start)</li>
 *   <li>Disconnect every supervised connection</li>
 *   <li>Clear the crash marker</li>
 * </ol>
 *
 * <p>Open positions are left alone; nothing is closed on a routine shutdown.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final StateSnapshotService stateSnapshotService;
    private final StrategyMonitor strategyMonitor;
    private final ConnectionSupervisor connectionSupervisor;
    private final CrashMarker crashMarker;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            StateSnapshotService stateSnapshotService,
            StrategyMonitor strategyMonitor,
            ConnectionSupervisor connectionSupervisor,
            CrashMarker crashMarker,
            EventPublisherHelper eventPublisherHelper) {
        this.stateSnapshotService = stateSnapshotService;
        this.strategyMonitor = strategyMonitor;
        this.connectionSupervisor = connectionSupervisor;
        this.crashMarker = crashMarker;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Graceful shutdown initiated...");
        eventPublisherHelper.publishSystemEvent(this, SystemEventType.SHUTTING_DOWN, "Executor shutting down");

        saveFinalSnapshot();

        int stopped = strategyMonitor.stopAll();
        log.info("Stopped {} strategy monitors for shutdown", stopped);

        connectionSupervisor.disconnectAll();

        try {
            crashMarker.clear();
        } catch (StateStoreException e) {
            log.error("Crash marker could not be cleared; next start will run crash recovery: {}", e.getMessage());
        }
        log.info("Graceful shutdown completed");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Run before other Spring components shut down (higher phase = earlier shutdown)
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void saveFinalSnapshot() {
        try {
            stateSnapshotService.takeSnapshot();
        } catch (StateStoreException e) {
            log.warn("Final execution snapshot failed: {}", e.getMessage());
        }
    }
}
