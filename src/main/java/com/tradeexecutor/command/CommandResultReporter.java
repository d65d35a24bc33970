package com.tradeexecutor.command;

import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.event.CommandEventType;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.transport.CloudCommandChannel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Single exit point for finished commands.
 *
 * <p>{@link CommandHistory#complete} decides whether a result is the first for its id; only
 * then is the terminal {@code CommandEvent} published and the result pushed upstream.
 * Upstream delivery (cloud channel, platform REST) runs on {@code eventExecutor}, is
 * best-effort and never fails or delays the command.
 */
@Component
public class CommandResultReporter {

    private static final Logger log = LoggerFactory.getLogger(CommandResultReporter.class);

    private final CommandHistory commandHistory;
    private final EventPublisherHelper eventPublisherHelper;
    private final CloudCommandChannel cloudCommandChannel;
    private final PlatformApiClient platformApiClient;
    private final ExecutorProperties executorProperties;
    private final Executor upstreamExecutor;

    public CommandResultReporter(
            CommandHistory commandHistory,
            EventPublisherHelper eventPublisherHelper,
            CloudCommandChannel cloudCommandChannel,
            PlatformApiClient platformApiClient,
            ExecutorProperties executorProperties,
            @Qualifier("eventExecutor") Executor upstreamExecutor) {
        this.commandHistory = commandHistory;
        this.eventPublisherHelper = eventPublisherHelper;
        this.cloudCommandChannel = cloudCommandChannel;
        this.platformApiClient = platformApiClient;
        this.executorProperties = executorProperties;
        this.upstreamExecutor = upstreamExecutor;
    }

    /**
     * Reports a terminal result.
     *
     * @return false when a result for this command was already reported
     */
    public boolean report(Command command, CommandResult result) {
        if (!commandHistory.complete(result)) {
            log.warn("Result for command {} already reported, dropping {}", result.getCommandId(), result.getStatus());
            return false;
        }

        switch (result.getStatus()) {
            case COMPLETED -> log.info("Command {} ({}) completed after {} attempt(s): {}",
                    command.getId(), command.getKind(), result.getAttempts(), result.getMessage());
            case CANCELLED -> log.info("Command {} ({}) cancelled: {}", command.getId(), command.getKind(), result.getMessage());
            default -> log.error("Command {} ({}) failed after {} attempt(s): {}",
                    command.getId(), command.getKind(), result.getAttempts(), result.getMessage());
        }

        eventPublisherHelper.publishCommandEvent(
                this,
                command.getId(),
                command.getKind(),
                eventType(result),
                result.getMessage(),
                result.getData(),
                result.getFailureKind());

        try {
            upstreamExecutor.execute(() -> deliverUpstream(command, result));
        } catch (RejectedExecutionException e) {
            log.warn("Upstream delivery of {} rejected: {}", result.getCommandId(), e.getMessage());
        }
        return true;
    }

    private void deliverUpstream(Command command, CommandResult result) {
        sendToCloud(result);
        try {
            platformApiClient.reportCommandResult(result);
            if (result.isSuccess() && command.getKind() == CommandKind.OPEN_POSITION) {
                platformApiClient.reportTrade(tradeReport(command, result));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to report result of {} to the platform: {}", result.getCommandId(), e.getMessage());
        }
    }

    private void sendToCloud(CommandResult result) {
        if (!cloudCommandChannel.isConnected()) {
            log.debug("Cloud channel not connected, result of {} not pushed", result.getCommandId());
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("commandId", result.getCommandId());
        payload.put("type", result.getKind());
        payload.put("status", result.getStatus().name());
        payload.put("success", result.isSuccess());
        payload.put("message", result.getMessage());
        payload.put("result", result.getData());
        payload.put("executorId", executorProperties.getId());
        payload.put("timestamp", result.getCompletedAt() != null ? result.getCompletedAt().toString() : null);
        try {
            cloudCommandChannel.send(CloudCommandChannel.EVENT_COMMAND_RESULT, payload);
        } catch (RuntimeException e) {
            log.warn("Failed to push result of {} to the cloud channel: {}", result.getCommandId(), e.getMessage());
        }
    }

    private static Map<String, Object> tradeReport(Command command, CommandResult result) {
        Map<String, Object> trade = new LinkedHashMap<>(result.getData());
        trade.put("commandId", command.getId());
        trade.putIfAbsent("symbol", command.stringParameter("symbol"));
        trade.putIfAbsent("type", command.stringParameter("type"));
        trade.putIfAbsent("volume", command.decimalParameter("volume"));
        trade.put("stopLoss", command.decimalParameter("stopLoss"));
        trade.put("takeProfit", command.decimalParameter("takeProfit"));
        if (command.hasParameter("strategyId")) {
            trade.put("strategyId", command.stringParameter("strategyId"));
        }
        if (command.hasParameter("signalId")) {
            trade.put("signalId", command.stringParameter("signalId"));
        }
        return trade;
    }

    private static CommandEventType eventType(CommandResult result) {
        return switch (result.getStatus()) {
            case COMPLETED -> CommandEventType.COMPLETED;
            case CANCELLED -> CommandEventType.CANCELLED;
            default -> CommandEventType.FAILED;
        };
    }
}
