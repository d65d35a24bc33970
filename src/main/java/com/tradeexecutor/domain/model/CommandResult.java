package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.CommandFailureKind;
import com.tradeexecutor.domain.enums.CommandStatus;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Terminal outcome of a command, reported exactly once. */
@Value
@Builder(toBuilder = true)
public class CommandResult {

    String commandId;
    String kind;
    CommandStatus status;
    String message;
    Map<String, Object> data;
    int attempts;
    Instant completedAt;

    /** Set for FAILED results only. */
    CommandFailureKind failureKind;

    public boolean isSuccess() {
        return status == CommandStatus.COMPLETED;
    }

    public static CommandResult completed(Command command, String message, Map<String, Object> data) {
        return of(command, CommandStatus.COMPLETED, message, data);
    }

    public static CommandResult failed(Command command, String message) {
        return failed(command, message, CommandFailureKind.REJECTED);
    }

    public static CommandResult denied(Command command, String message) {
        return failed(command, message, CommandFailureKind.SAFETY_DENIED);
    }

    public static CommandResult executionFailed(Command command, String message) {
        return failed(command, message, CommandFailureKind.EXECUTION);
    }

    public static CommandResult failed(Command command, String message, CommandFailureKind failureKind) {
        return of(command, CommandStatus.FAILED, message, Map.of()).toBuilder()
                .failureKind(failureKind)
                .build();
    }

    public static CommandResult cancelled(Command command, String message) {
        return of(command, CommandStatus.CANCELLED, message, Map.of());
    }

    private static CommandResult of(
            Command command, CommandStatus status, String message, Map<String, Object> data) {
        return CommandResult.builder()
                .commandId(command.getId())
                .kind(command.getKind() != null ? command.getKind().name() : null)
                .status(status)
                .message(message)
                .data(data != null ? Map.copyOf(data) : Map.of())
                .attempts(command.getRetryCount() + 1)
                .completedAt(Instant.now())
                .build();
    }
}
