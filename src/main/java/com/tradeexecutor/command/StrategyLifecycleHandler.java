package com.tradeexecutor.command;

import com.tradeexecutor.domain.enums.EaAttachmentStatus;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.StrategyEventType;
import com.tradeexecutor.exception.BaseException;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.monitor.StrategyMonitor;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.persistence.ExecutorStateStore;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.platform.StrategyDefinitionParser;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles START/STOP/PAUSE/RESUME/UPDATE_STRATEGY in-process. These never touch the
 * terminal, so they run synchronously on the submitting thread.
 *
 * <p>The persisted strategy set follows the registry: START and UPDATE save, PAUSE and RESUME
 * save the new status, STOP removes. A store failure is logged and noted in the result
 * message but does not fail the command; monitoring has already changed by then.
 */
@Component
public class StrategyLifecycleHandler {

    private static final Logger log = LoggerFactory.getLogger(StrategyLifecycleHandler.class);

    private final StrategyMonitor strategyMonitor;
    private final StrategyRegistry strategyRegistry;
    private final StrategyDefinitionParser strategyDefinitionParser;
    private final ExecutorStateStore executorStateStore;
    private final PlatformApiClient platformApiClient;
    private final EventPublisherHelper eventPublisherHelper;

    public StrategyLifecycleHandler(
            StrategyMonitor strategyMonitor,
            StrategyRegistry strategyRegistry,
            StrategyDefinitionParser strategyDefinitionParser,
            ExecutorStateStore executorStateStore,
            PlatformApiClient platformApiClient,
            EventPublisherHelper eventPublisherHelper) {
        this.strategyMonitor = strategyMonitor;
        this.strategyRegistry = strategyRegistry;
        this.strategyDefinitionParser = strategyDefinitionParser;
        this.executorStateStore = executorStateStore;
        this.platformApiClient = platformApiClient;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public CommandResult handle(Command command) {
        try {
            return switch (command.getKind()) {
                case START_STRATEGY -> start(command);
                case STOP_STRATEGY -> stop(command);
                case PAUSE_STRATEGY -> pause(command);
                case RESUME_STRATEGY -> resume(command);
                case UPDATE_STRATEGY -> update(command);
                default -> throw new IllegalArgumentException(command.getKind() + " is not a lifecycle command");
            };
        } catch (BaseException e) {
            log.warn("{} {} failed: {}", command.getKind(), command.getId(), e.getMessage());
            return CommandResult.failed(command, e.getMessage(), e.failureKind());
        }
    }

    // ========================
    // START / UPDATE
    // ========================

    private CommandResult start(Command command) {
        String strategyId = CommandNormalizer.strategyId(command.getParameters());
        Optional<ActiveStrategy> definition = resolveDefinition(command, strategyId);
        if (definition.isEmpty()) {
            return CommandResult.failed(command, "No definition found for strategy " + strategyId);
        }

        ActiveStrategy strategy = definition.get().toBuilder()
                .eaAttachment(eaAttachment(command))
                .build();
        strategyMonitor.startMonitoring(strategy);
        String persistWarning = persist(strategy);

        log.info("Strategy {} started on {} {}", strategy.getId(), strategy.primarySymbol(), strategy.getTimeframe());
        return CommandResult.completed(command, "Strategy " + strategy.getId() + " started" + persistWarning, summary(strategy));
    }

    private CommandResult update(Command command) {
        String strategyId = CommandNormalizer.strategyId(command.getParameters());
        Optional<ActiveStrategy> current = strategyRegistry.get(strategyId);
        if (current.isEmpty()) {
            return CommandResult.failed(command, "Strategy " + strategyId + " is not running");
        }
        Optional<Map<String, Object>> inline = inlineDefinition(command, strategyId);
        if (inline.isEmpty()) {
            return CommandResult.failed(command, "UPDATE_STRATEGY requires a strategy definition");
        }

        ActiveStrategy updated = strategyDefinitionParser.parse(inline.get()).toBuilder()
                .status(current.get().getStatus())
                .lastSignalAt(current.get().getLastSignalAt())
                .eaAttachment(current.get().getEaAttachment())
                .build();
        strategyMonitor.startMonitoring(updated);
        String persistWarning = persist(updated);
        eventPublisherHelper.publishStrategyEvent(
                this, strategyId, StrategyEventType.UPDATED, "Strategy definition updated");
        return CommandResult.completed(command, "Strategy " + strategyId + " updated" + persistWarning, summary(updated));
    }

    /** The definition carried by the command, or the control plane's copy when none was sent. */
    private Optional<ActiveStrategy> resolveDefinition(Command command, String strategyId) {
        Optional<Map<String, Object>> inline = inlineDefinition(command, strategyId);
        if (inline.isPresent()) {
            return Optional.of(strategyDefinitionParser.parse(inline.get()));
        }
        log.info("START_STRATEGY {} carries no definition, fetching from control plane", strategyId);
        return platformApiClient.fetchActiveStrategies().stream()
                .filter(s -> strategyId.equals(s.getId()))
                .findFirst();
    }

    /**
     * A nested {@code strategy} object, or the parameters themselves when they carry
     * {@code rules} next to {@code strategyId}, {@code strategyName}, {@code symbol} and
     * {@code timeframe}.
     */
    @SuppressWarnings("unchecked")
    private static Optional<Map<String, Object>> inlineDefinition(Command command, String strategyId) {
        Map<String, Object> params = command.getParameters();
        if (params.get("strategy") instanceof Map<?, ?> nested) {
            return Optional.of((Map<String, Object>) nested);
        }
        if (!(params.get("rules") instanceof Map<?, ?>)) {
            return Optional.empty();
        }
        Map<String, Object> flat = new LinkedHashMap<>(params);
        flat.remove("strategyId");
        flat.putIfAbsent("id", strategyId);
        Object name = params.get("strategyName");
        if (name != null) {
            flat.putIfAbsent("name", name);
        }
        return Optional.of(flat);
    }

    private static EaAttachmentStatus eaAttachment(Command command) {
        return Boolean.parseBoolean(command.stringParameter("eaAttached"))
                ? EaAttachmentStatus.ATTACHED_RECORDED
                : EaAttachmentStatus.NEEDS_MANUAL_ATTACH;
    }

    // ========================
    // STOP / PAUSE / RESUME
    // ========================

    private CommandResult stop(Command command) {
        String strategyId = command.stringParameter("strategyId");
        boolean wasRunning = strategyMonitor.stop(strategyId);
        String persistWarning = "";
        try {
            executorStateStore.removeActiveStrategy(strategyId);
        } catch (StateStoreException e) {
            log.warn("Failed to remove strategy {} from the state store: {}", strategyId, e.getMessage());
            persistWarning = " (not removed from local store: " + e.getMessage() + ")";
        }
        String message = wasRunning ? "Strategy " + strategyId + " stopped" : "Strategy " + strategyId + " was not running";
        return CommandResult.completed(command, message + persistWarning, Map.of("strategyId", strategyId, "wasRunning", wasRunning));
    }

    private CommandResult pause(Command command) {
        String strategyId = command.stringParameter("strategyId");
        if (!strategyRegistry.contains(strategyId)) {
            return CommandResult.failed(command, "Strategy " + strategyId + " is not running");
        }
        boolean changed = strategyMonitor.pause(strategyId);
        String persistWarning = strategyRegistry.get(strategyId).map(this::persist).orElse("");
        return CommandResult.completed(command,
                (changed ? "Strategy " + strategyId + " paused" : "Strategy " + strategyId + " already paused") + persistWarning,
                Map.of("strategyId", strategyId));
    }

    private CommandResult resume(Command command) {
        String strategyId = command.stringParameter("strategyId");
        if (!strategyRegistry.contains(strategyId)) {
            return CommandResult.failed(command, "Strategy " + strategyId + " is not running");
        }
        boolean changed = strategyMonitor.resume(strategyId);
        String persistWarning = strategyRegistry.get(strategyId).map(this::persist).orElse("");
        return CommandResult.completed(command,
                (changed ? "Strategy " + strategyId + " resumed" : "Strategy " + strategyId + " already active") + persistWarning,
                Map.of("strategyId", strategyId));
    }

    /** Saves the strategy; returns a message suffix describing a store failure, or empty. */
    private String persist(ActiveStrategy strategy) {
        try {
            executorStateStore.saveActiveStrategy(strategy);
            return "";
        } catch (StateStoreException e) {
            log.warn("Failed to persist strategy {}: {}", strategy.getId(), e.getMessage());
            return " (not persisted: " + e.getMessage() + ")";
        }
    }

    private static Map<String, Object> summary(ActiveStrategy strategy) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("strategyId", strategy.getId());
        data.put("name", String.valueOf(strategy.getName()));
        data.put("symbols", strategy.getSymbols());
        data.put("timeframe", String.valueOf(strategy.getTimeframe()));
        data.put("status", strategy.getStatus().name());
        data.put("eaAttachment", strategy.getEaAttachment().name());
        return data;
    }
}
