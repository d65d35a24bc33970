package com.tradeexecutor.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.domain.model.ProposedTrade;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.event.CommandEventType;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SignalEvent;
import com.tradeexecutor.exception.CommandValidationException;
import com.tradeexecutor.mapper.JsonHelper;
import com.tradeexecutor.orchestrator.ExecutorStatusService;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.safety.OpenTradePurger;
import com.tradeexecutor.safety.SafetyDecision;
import com.tradeexecutor.safety.SafetyGate;
import com.tradeexecutor.transport.CloudCommandChannel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Front door for every command, whatever its source: the cloud channel, the REST surface,
 * strategy signals and exit management.
 *
 * <p>Routing after normalization:
 * <ul>
 *   <li>lifecycle kinds run synchronously through {@link StrategyLifecycleHandler}</li>
 *   <li>EMERGENCY_STOP trips the kill switch</li>
 *   <li>GET_STATUS is answered from the local status service</li>
 *   <li>OPEN_POSITION passes the {@link SafetyGate} before going any further</li>
 *   <li>HIGH/URGENT trade kinds and every CLOSE_* kind dispatch out-of-band</li>
 *   <li>everything else waits in the bounded {@link CommandQueue}</li>
 * </ul>
 */
@Service
public class CommandPipeline implements OpenTradePurger {

    private static final Logger log = LoggerFactory.getLogger(CommandPipeline.class);

    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String DUPLICATE = "Duplicate command";

    private final CommandNormalizer commandNormalizer;
    private final CommandQueue commandQueue;
    private final CommandDispatcher commandDispatcher;
    private final StrategyLifecycleHandler strategyLifecycleHandler;
    private final CommandResultReporter commandResultReporter;
    private final CommandHistory commandHistory;
    private final InFlightGuard inFlightGuard;
    private final SafetyGate safetyGate;
    private final KillSwitchService killSwitchService;
    private final AccountStateService accountStateService;
    private final EventPublisherHelper eventPublisherHelper;
    private final RateLimiter commandRateLimiter;
    private final CommandConfig commandConfig;
    private final ExecutorService dispatchExecutor;
    private final ObjectProvider<ExecutorStatusService> executorStatusService;
    private final Clock clock;

    public CommandPipeline(
            CommandNormalizer commandNormalizer,
            CommandQueue commandQueue,
            CommandDispatcher commandDispatcher,
            StrategyLifecycleHandler strategyLifecycleHandler,
            CommandResultReporter commandResultReporter,
            CommandHistory commandHistory,
            InFlightGuard inFlightGuard,
            SafetyGate safetyGate,
            KillSwitchService killSwitchService,
            AccountStateService accountStateService,
            EventPublisherHelper eventPublisherHelper,
            RateLimiter commandRateLimiter,
            CommandConfig commandConfig,
            @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
            ObjectProvider<ExecutorStatusService> executorStatusService,
            Clock clock) {
        this.commandNormalizer = commandNormalizer;
        this.commandQueue = commandQueue;
        this.commandDispatcher = commandDispatcher;
        this.strategyLifecycleHandler = strategyLifecycleHandler;
        this.commandResultReporter = commandResultReporter;
        this.commandHistory = commandHistory;
        this.inFlightGuard = inFlightGuard;
        this.safetyGate = safetyGate;
        this.killSwitchService = killSwitchService;
        this.accountStateService = accountStateService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.commandRateLimiter = commandRateLimiter;
        this.commandConfig = commandConfig;
        this.dispatchExecutor = dispatchExecutor;
        this.executorStatusService = executorStatusService;
        this.clock = clock;
    }

    // ========================
    // INBOUND
    // ========================

    /** Listener for the cloud channel's inbound events. */
    public void onCloudMessage(String event, String data) {
        switch (event) {
            case CloudCommandChannel.EVENT_COMMAND_RECEIVED -> submit(data);
            case CloudCommandChannel.EVENT_COMMAND_CANCEL -> cancelFromCloud(data);
            case CloudCommandChannel.EVENT_EMERGENCY_STOP -> emergencyStopFromCloud(data);
            default -> log.debug("Ignoring cloud event {}", event);
        }
    }

    /** Normalizes and submits a raw JSON command. Invalid messages are logged and dropped. */
    public CommandReceipt submit(String rawJson) {
        Command command;
        try {
            command = commandNormalizer.normalize(rawJson);
        } catch (CommandValidationException e) {
            log.warn("Dropping malformed command: {}", e.getMessage());
            return new CommandReceipt(null, CommandStatus.UNKNOWN, e.getMessage());
        }
        return submitCommand(command);
    }

    public CommandReceipt submit(Map<String, Object> raw) {
        Command command;
        try {
            command = commandNormalizer.normalize(raw);
        } catch (CommandValidationException e) {
            log.warn("Dropping malformed command: {}", e.getMessage());
            return new CommandReceipt(null, CommandStatus.UNKNOWN, e.getMessage());
        }
        return submitCommand(command);
    }

    /** Routes an already-normalized command. */
    public CommandReceipt submitCommand(Command command) {
        CommandStatus existing = getCommandStatus(command.getId());
        if (existing != CommandStatus.UNKNOWN || !commandHistory.claim(command.getId())) {
            // A concurrent submit of the same id may hold the claim without being queued yet
            CommandStatus current = existing != CommandStatus.UNKNOWN ? existing : CommandStatus.PROCESSING;
            log.warn("Duplicate command {} ignored (currently {})", command.getId(), current);
            return new CommandReceipt(command.getId(), current, DUPLICATE);
        }
        eventPublisherHelper.publishCommandEvent(
                this, command.getId(), command.getKind(), CommandEventType.RECEIVED, "Command received");
        log.info("Received {}", command);

        CommandKind kind = command.getKind();
        if (kind.isLifecycle()) {
            return finish(command, strategyLifecycleHandler.handle(command));
        }
        if (kind == CommandKind.EMERGENCY_STOP) {
            return emergencyStop(command);
        }
        if (kind == CommandKind.GET_STATUS) {
            return finish(command, CommandResult.completed(command, "Executor status", statusSummary()));
        }
        if (kind.opensExposure()) {
            String denial = openTradeDenial(command);
            if (denial != null) {
                return finish(command, CommandResult.denied(command, denial));
            }
        }

        if (isOutOfBand(command)) {
            return dispatchOutOfBand(command);
        }
        if (!commandQueue.offer(command)) {
            eventPublisherHelper.publishCommandEvent(
                    this, command.getId(), kind, CommandEventType.REJECTED, QUEUE_FULL);
            return finish(command, CommandResult.failed(command, QUEUE_FULL));
        }
        eventPublisherHelper.publishCommandEvent(
                this, command.getId(), kind, CommandEventType.QUEUED, "Queued at " + command.getPriority());
        return new CommandReceipt(command.getId(), CommandStatus.QUEUED, "Queued");
    }

    /** Turns an approved strategy signal into an OPEN_POSITION command. */
    @EventListener
    public void onSignal(SignalEvent event) {
        Signal signal = event.getSignal();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", signal.getSymbol());
        params.put("type", signal.getDirection().name());
        params.put("volume", signal.getVolume());
        if (signal.getStopLoss() != null) {
            params.put("stopLoss", signal.getStopLoss());
        }
        if (signal.getTakeProfit() != null) {
            params.put("takeProfit", signal.getTakeProfit());
        }
        params.put("strategyId", signal.getStrategyId());
        params.put("signalId", signal.getId());
        params.put("comment", signal.getStrategyId());

        submitCommand(Command.builder()
                .id(signal.commandId())
                .kind(CommandKind.OPEN_POSITION)
                .parameters(params)
                .priority(CommandPriority.NORMAL)
                .createdAt(clock.instant())
                .maxRetries(commandConfig.getMaxRetries())
                .build());
    }

    // ========================
    // ROUTING HELPERS
    // ========================

    /** Returns the reason an open-trade command may not proceed, or null when it may. */
    private String openTradeDenial(Command command) {
        if (killSwitchService.isTripped()) {
            return "Kill switch is tripped";
        }
        ProposedTrade trade = ProposedTrade.builder()
                .strategyId(command.stringParameter("strategyId"))
                .symbol(command.stringParameter("symbol"))
                .side(TradeSide.fromWire(command.stringParameter("type")).orElse(null))
                .volume(command.decimalParameter("volume"))
                .build();
        SafetyDecision decision = safetyGate.check(trade, accountStateService.current());
        return decision.isDenied() ? decision.getReason() : null;
    }

    static boolean isOutOfBand(Command command) {
        CommandKind kind = command.getKind();
        if (kind.name().startsWith("CLOSE_")) {
            return true;
        }
        boolean tradeKind = kind.opensExposure() || kind.reducesExposure();
        return tradeKind && command.getPriority().isOutOfBand();
    }

    private CommandReceipt dispatchOutOfBand(Command command) {
        try {
            dispatchExecutor.submit(() -> commandDispatcher.process(command));
        } catch (RejectedExecutionException e) {
            log.error("Out-of-band executor rejected {}", command.getId(), e);
            return finish(command, CommandResult.failed(command, "Dispatch executor unavailable"));
        }
        log.info("Dispatching {} out-of-band", command);
        return new CommandReceipt(command.getId(), CommandStatus.PROCESSING, "Dispatched out-of-band");
    }

    private CommandReceipt emergencyStop(Command command) {
        String reason = command.hasParameter("reason")
                ? command.stringParameter("reason")
                : "Emergency stop command " + command.getId();
        boolean tripped = killSwitchService.trip(reason, TripInitiator.CLOUD);
        CommandReceipt receipt = finish(command, CommandResult.completed(
                command, tripped ? "Kill switch tripped" : "Kill switch already tripped", Map.of("tripped", true)));
        if (Boolean.parseBoolean(command.stringParameter("closePositions"))) {
            closeAllPositions("emergency_" + command.getId(), reason);
        }
        return receipt;
    }

    /** Submits an urgent CLOSE_ALL_POSITIONS. */
    public CommandReceipt closeAllPositions(String commandId, String reason) {
        return submitCommand(Command.builder()
                .id(commandId)
                .kind(CommandKind.CLOSE_ALL_POSITIONS)
                .parameters(Map.of("reason", reason))
                .priority(CommandPriority.URGENT)
                .createdAt(clock.instant())
                .maxRetries(commandConfig.getMaxRetries())
                .build());
    }

    private CommandReceipt finish(Command command, CommandResult result) {
        commandResultReporter.report(command, result);
        return new CommandReceipt(command.getId(), result.getStatus(), result.getMessage());
    }

    private Map<String, Object> statusSummary() {
        ExecutorStatusService statusService = executorStatusService.getIfAvailable();
        return statusService != null ? statusService.getStatusSummary() : Map.of("killSwitchTripped", killSwitchService.isTripped());
    }

    // ========================
    // CANCEL / PURGE
    // ========================

    /**
     * Cancels a queued command. Commands already being sent cannot be cancelled.
     *
     * @return true if the command was removed from the queue
     */
    public boolean cancel(String commandId) {
        Command removed = commandQueue.remove(commandId);
        if (removed == null) {
            log.info("Cancel of {} ignored: status {}", commandId, getCommandStatus(commandId));
            return false;
        }
        commandResultReporter.report(removed, CommandResult.cancelled(removed, "Cancelled by request"));
        return true;
    }

    private void cancelFromCloud(String data) {
        try {
            JsonNode node = JsonHelper.readTree(data);
            String commandId = node.hasNonNull("commandId") ? node.get("commandId").asText() : node.path("id").asText(null);
            if (commandId == null || commandId.isBlank()) {
                log.warn("command-cancel without a command id: {}", data);
                return;
            }
            cancel(commandId);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed command-cancel message: {}", e.getOriginalMessage());
        }
    }

    private void emergencyStopFromCloud(String data) {
        String reason = "Emergency stop from cloud";
        boolean closePositions = false;
        if (data != null && !data.isBlank()) {
            try {
                JsonNode node = JsonHelper.readTree(data);
                if (node.hasNonNull("reason")) {
                    reason = node.get("reason").asText();
                }
                closePositions = node.path("closePositions").asBoolean(false);
            } catch (JsonProcessingException e) {
                log.warn("emergency-stop payload unreadable, tripping with default reason: {}", e.getOriginalMessage());
            }
        }
        killSwitchService.trip(reason, TripInitiator.CLOUD);
        if (closePositions) {
            closeAllPositions("emergency_" + clock.millis(), reason);
        }
    }

    @Override
    public int purgeOpenTrades(String reason) {
        List<Command> removed = commandQueue.removeIf(c -> c.getKind().opensExposure());
        for (Command command : removed) {
            commandResultReporter.report(command, CommandResult.cancelled(command, reason));
        }
        return removed.size();
    }

    // ========================
    // STATUS
    // ========================

    public CommandStatus getCommandStatus(String commandId) {
        if (commandId == null) {
            return CommandStatus.UNKNOWN;
        }
        if (inFlightGuard.isInFlight(commandId)) {
            return CommandStatus.PROCESSING;
        }
        if (commandQueue.contains(commandId)) {
            return CommandStatus.QUEUED;
        }
        return commandHistory.status(commandId).orElse(CommandStatus.UNKNOWN);
    }

    public QueueStats getQueueStats() {
        return new QueueStats(
                commandQueue.size(),
                commandQueue.getCapacity(),
                inFlightGuard.size(),
                commandHistory.getCompletedCount(),
                commandHistory.getFailedCount(),
                commandHistory.getCancelledCount(),
                commandRateLimiter.getMetrics().getAvailablePermissions());
    }
}
