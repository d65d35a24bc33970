package com.tradeexecutor.recovery;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.config.ReconcilerConfig;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.persistence.ExecutorStateStore;
import com.tradeexecutor.safety.KillSwitchService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Writes an {@link ExecutionSnapshot} on a fixed interval and keeps only the newest
 * {@code snapshotRetention} of them.
 *
 * <p>Keys are {@code snapshot:} plus the zero-padded epoch milliseconds, so lexical order
 * is chronological order.
 */
@Service
public class StateSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(StateSnapshotService.class);

    static final String KEY_PREFIX = "snapshot:";

    private final ExecutorStateStore executorStateStore;
    private final StrategyRegistry strategyRegistry;
    private final KillSwitchService killSwitchService;
    private final ConnectionSupervisor connectionSupervisor;
    private final CommandPipeline commandPipeline;
    private final ReconcilerConfig reconcilerConfig;
    private final Clock clock;

    public StateSnapshotService(
            ExecutorStateStore executorStateStore,
            StrategyRegistry strategyRegistry,
            KillSwitchService killSwitchService,
            ConnectionSupervisor connectionSupervisor,
            CommandPipeline commandPipeline,
            ReconcilerConfig reconcilerConfig,
            Clock clock) {
        this.executorStateStore = executorStateStore;
        this.strategyRegistry = strategyRegistry;
        this.killSwitchService = killSwitchService;
        this.connectionSupervisor = connectionSupervisor;
        this.commandPipeline = commandPipeline;
        this.reconcilerConfig = reconcilerConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${executor.reconciler.snapshot-interval-ms:3600000}",
            initialDelayString = "${executor.reconciler.snapshot-interval-ms:3600000}")
    public void scheduledSnapshot() {
        try {
            takeSnapshot();
        } catch (StateStoreException e) {
            log.error("Execution snapshot failed: {}", e.getMessage());
        }
    }

    public ExecutionSnapshot takeSnapshot() {
        Instant now = clock.instant();
        ExecutionSnapshot snapshot = ExecutionSnapshot.builder()
                .takenAt(now)
                .strategies(strategyRegistry.snapshot())
                .killSwitch(killSwitchService.getStatus())
                .connections(connectionSupervisor.getAllSnapshots())
                .queueStats(commandPipeline.getQueueStats())
                .build();
        String key = keyFor(now);
        executorStateStore.saveSnapshot(key, snapshot);
        int pruned = prune();
        log.info("Execution snapshot {} saved ({} strategies, {} pruned)", key, snapshot.getStrategies().size(), pruned);
        return snapshot;
    }

    public Optional<ExecutionSnapshot> latest() {
        List<String> keys = executorStateStore.listSnapshotKeys(KEY_PREFIX);
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        return executorStateStore.loadSnapshot(keys.get(keys.size() - 1), ExecutionSnapshot.class);
    }

    /** Deletes all but the newest {@code snapshotRetention} snapshots; returns how many went. */
    int prune() {
        List<String> keys = executorStateStore.listSnapshotKeys(KEY_PREFIX);
        int excess = keys.size() - Math.max(1, reconcilerConfig.getSnapshotRetention());
        for (int i = 0; i < excess; i++) {
            executorStateStore.deleteSnapshot(keys.get(i));
        }
        return Math.max(0, excess);
    }

    static String keyFor(Instant instant) {
        return KEY_PREFIX + String.format("%013d", instant.toEpochMilli());
    }
}
