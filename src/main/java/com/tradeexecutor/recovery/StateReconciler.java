package com.tradeexecutor.recovery;

import com.tradeexecutor.domain.enums.EaAttachmentStatus;
import com.tradeexecutor.domain.enums.ReconciliationSource;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.monitor.StrategyMonitor;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.persistence.ExecutorStateStore;
import com.tradeexecutor.platform.PlatformApiClient;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the active strategy set at startup.
 *
 * <p>Source of truth, in order:
 * <ol>
 *   <li>the control plane's active-strategy list, fetched with retry and backoff</li>
 *   <li>the locally persisted set</li>
 *   <li>the strategies in the last execution snapshot, when a crash was detected</li>
 * </ol>
 * Whatever wins is registered and monitored. A control-plane result also replaces the
 * persisted set, keeping the EA attachment flags that were recorded locally.
 */
@Service
public class StateReconciler {

    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    private final PlatformApiClient platformApiClient;
    private final Retry platformFetchRetry;
    private final ExecutorStateStore executorStateStore;
    private final StrategyRegistry strategyRegistry;
    private final StrategyMonitor strategyMonitor;
    private final StateSnapshotService stateSnapshotService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public StateReconciler(
            PlatformApiClient platformApiClient,
            @Qualifier("platformFetchRetry") Retry platformFetchRetry,
            ExecutorStateStore executorStateStore,
            StrategyRegistry strategyRegistry,
            StrategyMonitor strategyMonitor,
            StateSnapshotService stateSnapshotService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.platformApiClient = platformApiClient;
        this.platformFetchRetry = platformFetchRetry;
        this.executorStateStore = executorStateStore;
        this.strategyRegistry = strategyRegistry;
        this.strategyMonitor = strategyMonitor;
        this.stateSnapshotService = stateSnapshotService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // CRASH RECOVERY
    // ========================

    /** Loads and logs the last execution snapshot after an unclean shutdown. */
    public Optional<ExecutionSnapshot> recoverFromCrash() {
        Optional<ExecutionSnapshot> snapshot;
        try {
            snapshot = stateSnapshotService.latest();
        } catch (StateStoreException e) {
            log.error("Crash detected but the last execution snapshot is unreadable: {}", e.getMessage());
            snapshot = Optional.empty();
        }

        Map<String, Object> details = new HashMap<>();
        if (snapshot.isPresent()) {
            ExecutionSnapshot last = snapshot.get();
            List<String> ids = last.getStrategies().stream().map(ActiveStrategy::getId).toList();
            log.warn("Recovering from crash. Last snapshot at {}: strategies={}, killSwitch={}, queued={}",
                    last.getTakenAt(),
                    ids,
                    last.getKillSwitch() != null ? last.getKillSwitch().getState() : null,
                    last.getQueueStats() != null ? last.getQueueStats().queued() : 0);
            details.put("snapshotAt", String.valueOf(last.getTakenAt()));
            details.put("strategies", ids);
        } else {
            log.warn("Recovering from crash. No execution snapshot available");
        }
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.CRASH_RECOVERED, "Previous run ended without a clean shutdown", details);
        return snapshot;
    }

    // ========================
    // STARTUP RECONCILIATION
    // ========================

    public ReconciliationResult reconcileOnStartup(Optional<ExecutionSnapshot> crashSnapshot) {
        long started = clock.millis();
        AtomicInteger attempts = new AtomicInteger();

        Optional<List<ActiveStrategy>> fetched = fetchFromControlPlane(attempts);
        ReconciliationSource source;
        List<ActiveStrategy> strategies;

        if (fetched.isPresent()) {
            source = ReconciliationSource.CONTROL_PLANE;
            strategies = withStoredAttachments(fetched.get());
            replacePersisted(strategies);
        } else {
            strategies = loadPersisted();
            source = strategies.isEmpty() ? ReconciliationSource.EMPTY : ReconciliationSource.LOCAL_SNAPSHOT;
            if (strategies.isEmpty() && crashSnapshot.isPresent() && !crashSnapshot.get().getStrategies().isEmpty()) {
                strategies = crashSnapshot.get().getStrategies();
                source = ReconciliationSource.LOCAL_SNAPSHOT;
                log.warn("Restoring {} strategies from the last execution snapshot", strategies.size());
            }
        }

        strategyRegistry.replaceAll(strategies);
        for (ActiveStrategy strategy : strategies) {
            strategyMonitor.startMonitoring(strategy);
        }
        if (strategies.isEmpty()) {
            log.warn("Starting with no active strategies (source={})", source);
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .source(source)
                .strategyIds(strategies.stream().map(ActiveStrategy::getId).toList())
                .attempts(attempts.get())
                .crashRecovered(crashSnapshot.isPresent())
                .durationMs(clock.millis() - started)
                .build();
        log.info("State reconciled from {}: {} strategies after {} fetch attempt(s)",
                source, result.getStrategyCount(), attempts.get());

        Map<String, Object> details = new HashMap<>();
        details.put("source", source.name());
        details.put("strategies", result.getStrategyCount());
        details.put("attempts", attempts.get());
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.STATE_RECONCILED, "Reconciled from " + source, details);
        return result;
    }

    private Optional<List<ActiveStrategy>> fetchFromControlPlane(AtomicInteger attempts) {
        if (!platformApiClient.isConfigured()) {
            log.info("Control plane not configured, reconciling from local state");
            return Optional.empty();
        }
        try {
            List<ActiveStrategy> strategies = Retry.decorateSupplier(platformFetchRetry, () -> {
                        int attempt = attempts.incrementAndGet();
                        log.debug("Fetching active strategies, attempt {}", attempt);
                        return platformApiClient.fetchActiveStrategies();
                    })
                    .get();
            return Optional.of(strategies);
        } catch (PlatformApiException e) {
            log.warn("Control plane unavailable after {} attempt(s): {}", attempts.get(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Carries the locally recorded EA attachment flag over to freshly fetched strategies. */
    private List<ActiveStrategy> withStoredAttachments(List<ActiveStrategy> fetched) {
        Map<String, EaAttachmentStatus> stored = new HashMap<>();
        for (ActiveStrategy strategy : loadPersisted()) {
            stored.put(strategy.getId(), strategy.getEaAttachment());
        }
        List<ActiveStrategy> merged = new ArrayList<>(fetched.size());
        for (ActiveStrategy strategy : fetched) {
            EaAttachmentStatus attachment = stored.getOrDefault(strategy.getId(), EaAttachmentStatus.NEEDS_MANUAL_ATTACH);
            merged.add(strategy.toBuilder().eaAttachment(attachment).build());
        }
        return merged;
    }

    private void replacePersisted(List<ActiveStrategy> strategies) {
        try {
            executorStateStore.clearActiveStrategies();
            strategies.forEach(executorStateStore::saveActiveStrategy);
        } catch (StateStoreException e) {
            log.error("Failed to persist reconciled strategies: {}", e.getMessage());
        }
    }

    private List<ActiveStrategy> loadPersisted() {
        try {
            return executorStateStore.getActiveStrategies();
        } catch (StateStoreException e) {
            log.error("Cannot read persisted strategies: {}", e.getMessage());
            return List.of();
        }
    }
}
