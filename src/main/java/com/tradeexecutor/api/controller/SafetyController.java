package com.tradeexecutor.api.controller;

import com.tradeexecutor.api.dto.request.KillSwitchRequest;
import com.tradeexecutor.api.dto.request.KillSwitchResetRequest;
import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.safety.KillSwitchStatus;
import com.tradeexecutor.safety.SafetyLimits;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual kill switch and the active risk limits.
 *
 * <ul>
 *   <li>POST /api/safety/kill-switch -- trip (initiator MANUAL), optionally closing all positions</li>
 *   <li>POST /api/safety/kill-switch/reset -- re-arm after an operator decision</li>
 *   <li>GET /api/safety/kill-switch -- current state</li>
 *   <li>GET /api/safety/limits -- limits loaded at startup</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/safety")
public class SafetyController {

    private static final Logger log = LoggerFactory.getLogger(SafetyController.class);

    private final KillSwitchService killSwitchService;
    private final CommandPipeline commandPipeline;
    private final SafetyLimits safetyLimits;
    private final Clock clock;

    public SafetyController(
            KillSwitchService killSwitchService, CommandPipeline commandPipeline, SafetyLimits safetyLimits, Clock clock) {
        this.killSwitchService = killSwitchService;
        this.commandPipeline = commandPipeline;
        this.safetyLimits = safetyLimits;
        this.clock = clock;
    }

    @PostMapping("/kill-switch")
    public ResponseEntity<Map<String, Object>> trip(@Valid @RequestBody KillSwitchRequest request) {
        log.warn("Manual kill switch requested: {} (closePositions={})", request.getReason(), request.isClosePositions());
        boolean tripped = killSwitchService.trip(request.getReason(), TripInitiator.MANUAL);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tripped", tripped);
        if (request.isClosePositions()) {
            CommandReceipt receipt =
                    commandPipeline.closeAllPositions("manual_close_" + clock.millis(), request.getReason());
            body.put("closeAll", receipt);
        }
        body.put("killSwitch", killSwitchService.getStatus());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/kill-switch/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestBody(required = false) KillSwitchResetRequest request) {
        String operator = request != null && request.getOperator() != null && !request.getOperator().isBlank()
                ? request.getOperator()
                : "api";
        boolean reset = killSwitchService.reset(operator);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reset", reset);
        body.put("killSwitch", killSwitchService.getStatus());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/kill-switch")
    public ResponseEntity<KillSwitchStatus> getKillSwitch() {
        return ResponseEntity.ok(killSwitchService.getStatus());
    }

    @GetMapping("/limits")
    public ResponseEntity<SafetyLimits> getLimits() {
        return ResponseEntity.ok(safetyLimits);
    }
}
