package com.tradeexecutor.api.controller;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.exception.ResourceNotFoundException;
import com.tradeexecutor.monitor.StrategyRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Strategy listing and local lifecycle control.
 *
 * <p>Control requests go through the command pipeline like cloud commands, so they are
 * recorded in the command history and reported upstream.
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private static final Logger log = LoggerFactory.getLogger(StrategyController.class);

    private final StrategyRegistry strategyRegistry;
    private final CommandPipeline commandPipeline;
    private final Clock clock;

    public StrategyController(StrategyRegistry strategyRegistry, CommandPipeline commandPipeline, Clock clock) {
        this.strategyRegistry = strategyRegistry;
        this.commandPipeline = commandPipeline;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<ActiveStrategy>> getStrategies() {
        return ResponseEntity.ok(strategyRegistry.snapshot());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ActiveStrategy> getStrategy(@PathVariable String id) {
        return ResponseEntity.ok(strategyRegistry.get(id).orElseThrow(() -> new ResourceNotFoundException("Strategy", id)));
    }

    /** Stopping an unknown strategy still succeeds, with a "was not running" message. */
    @PostMapping("/{id}/stop")
    public ResponseEntity<CommandReceipt> stop(@PathVariable String id) {
        return ResponseEntity.ok(submit(CommandKind.STOP_STRATEGY, id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<CommandReceipt> pause(@PathVariable String id) {
        requireRegistered(id);
        return ResponseEntity.ok(submit(CommandKind.PAUSE_STRATEGY, id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<CommandReceipt> resume(@PathVariable String id) {
        requireRegistered(id);
        return ResponseEntity.ok(submit(CommandKind.RESUME_STRATEGY, id));
    }

    private void requireRegistered(String id) {
        if (!strategyRegistry.contains(id)) {
            throw new ResourceNotFoundException("Strategy", id);
        }
    }

    private CommandReceipt submit(CommandKind kind, String strategyId) {
        long now = clock.millis();
        String commandId = "api_" + kind.name().toLowerCase(Locale.ROOT) + "_" + strategyId + "_" + now;
        log.info("{} of strategy {} requested via API", kind, strategyId);
        return commandPipeline.submitCommand(Command.builder()
                .id(commandId)
                .kind(kind)
                .parameters(Map.of("strategyId", strategyId))
                .priority(CommandPriority.HIGH)
                .createdAt(clock.instant())
                .build());
    }
}
