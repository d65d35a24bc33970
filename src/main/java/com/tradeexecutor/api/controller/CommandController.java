package com.tradeexecutor.api.controller;

import com.tradeexecutor.command.CommandHistory;
import com.tradeexecutor.command.CommandNormalizer;
import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.exception.ErrorCode;
import com.tradeexecutor.exception.ResourceNotFoundException;
import com.tradeexecutor.exception.SafetyViolationException;
import com.tradeexecutor.safety.KillSwitchService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local command entry point, used when the cloud channel is disabled.
 *
 * <ul>
 *   <li>POST /api/commands -- submit a raw command in the cloud wire format</li>
 *   <li>GET /api/commands/{id} -- current status, with the result once finished</li>
 *   <li>DELETE /api/commands/{id} -- cancel a command still waiting in the queue</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/commands")
public class CommandController {

    private final CommandNormalizer commandNormalizer;
    private final CommandPipeline commandPipeline;
    private final CommandHistory commandHistory;
    private final KillSwitchService killSwitchService;

    public CommandController(
            CommandNormalizer commandNormalizer,
            CommandPipeline commandPipeline,
            CommandHistory commandHistory,
            KillSwitchService killSwitchService) {
        this.commandNormalizer = commandNormalizer;
        this.commandPipeline = commandPipeline;
        this.commandHistory = commandHistory;
        this.killSwitchService = killSwitchService;
    }

    /**
     * Malformed commands are rejected with 400 and trades refused by the kill switch or the
     * safety gate with 409/422. Accepted commands answer 202 with their receipt.
     */
    @PostMapping
    public ResponseEntity<CommandReceipt> submit(@RequestBody Map<String, Object> body) {
        Command command = commandNormalizer.normalize(body);
        CommandReceipt receipt = commandPipeline.submitCommand(command);
        if (command.getKind().opensExposure() && isDenial(receipt)) {
            ErrorCode errorCode = killSwitchService.isTripped()
                    ? ErrorCode.KILL_SWITCH_ACTIVE
                    : ErrorCode.SAFETY_LIMIT_EXCEEDED;
            throw new SafetyViolationException(errorCode, receipt.message(), Map.of("commandId", command.getId()));
        }
        HttpStatus status = receipt.accepted() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(receipt);
    }

    private static boolean isDenial(CommandReceipt receipt) {
        return receipt.status() == CommandStatus.FAILED
                && !CommandPipeline.QUEUE_FULL.equals(receipt.message())
                && !CommandPipeline.DUPLICATE.equals(receipt.message());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getCommand(@PathVariable String id) {
        CommandStatus status = commandPipeline.getCommandStatus(id);
        if (status == CommandStatus.UNKNOWN) {
            throw new ResourceNotFoundException("Command", id);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("commandId", id);
        body.put("status", status);
        commandHistory.get(id).ifPresent(result -> body.put("result", result));
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        CommandStatus before = commandPipeline.getCommandStatus(id);
        if (before == CommandStatus.UNKNOWN) {
            throw new ResourceNotFoundException("Command", id);
        }
        boolean cancelled = commandPipeline.cancel(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("commandId", id);
        body.put("cancelled", cancelled);
        body.put("status", commandPipeline.getCommandStatus(id));
        return ResponseEntity.ok(body);
    }
}
