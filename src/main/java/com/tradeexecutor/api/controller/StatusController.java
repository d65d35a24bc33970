package com.tradeexecutor.api.controller;

import com.tradeexecutor.connection.ConnectionSnapshot;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.exception.ResourceNotFoundException;
import com.tradeexecutor.monitor.RecentSignalBuffer;
import com.tradeexecutor.orchestrator.ActivityEntry;
import com.tradeexecutor.orchestrator.ActivityLog;
import com.tradeexecutor.orchestrator.ExecutorStatus;
import com.tradeexecutor.orchestrator.ExecutorStatusService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only status surface plus connection control.
 *
 * <ul>
 *   <li>GET /api/status -- full executor status</li>
 *   <li>GET /api/connections -- per-connection state and overall health</li>
 *   <li>POST /api/connections/{name}/reconnect -- force an immediate reconnect</li>
 *   <li>GET /api/signals -- most recent approved signals</li>
 *   <li>GET /api/logs -- activity log, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class StatusController {

    private static final Logger log = LoggerFactory.getLogger(StatusController.class);

    private static final int MAX_LIMIT = 500;

    private final ExecutorStatusService executorStatusService;
    private final ConnectionSupervisor connectionSupervisor;
    private final RecentSignalBuffer recentSignalBuffer;
    private final ActivityLog activityLog;

    public StatusController(
            ExecutorStatusService executorStatusService,
            ConnectionSupervisor connectionSupervisor,
            RecentSignalBuffer recentSignalBuffer,
            ActivityLog activityLog) {
        this.executorStatusService = executorStatusService;
        this.connectionSupervisor = connectionSupervisor;
        this.recentSignalBuffer = recentSignalBuffer;
        this.activityLog = activityLog;
    }

    @GetMapping("/status")
    public ResponseEntity<ExecutorStatus> getStatus() {
        return ResponseEntity.ok(executorStatusService.getStatus());
    }

    @GetMapping("/connections")
    public ResponseEntity<Map<String, Object>> getConnections() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("health", connectionSupervisor.getHealth());
        body.put("connections", connectionSupervisor.getAllSnapshots());
        return ResponseEntity.ok(body);
    }

    /** Resets the attempt counter, so this also revives a connection that gave up reconnecting. */
    @PostMapping("/connections/{name}/reconnect")
    public ResponseEntity<ConnectionSnapshot> reconnect(@PathVariable String name) {
        if (connectionSupervisor.getSnapshot(name) == null) {
            throw new ResourceNotFoundException("Connection", name);
        }
        log.info("Reconnect of {} requested via API", name);
        connectionSupervisor.forceReconnect(name);
        return ResponseEntity.ok(connectionSupervisor.getSnapshot(name));
    }

    @GetMapping("/signals")
    public ResponseEntity<List<Signal>> getSignals(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(recentSignalBuffer.recent(clamp(limit)));
    }

    @GetMapping("/logs")
    public ResponseEntity<List<ActivityEntry>> getLogs(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(activityLog.recent(clamp(limit)));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
