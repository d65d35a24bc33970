package com.tradeexecutor.orchestrator;

import com.tradeexecutor.command.QueueStats;
import com.tradeexecutor.connection.ConnectionHealth;
import com.tradeexecutor.connection.ConnectionSnapshot;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.monitor.StrategyMonitor.MonitorStatus;
import com.tradeexecutor.safety.KillSwitchStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Everything {@code GET /api/status} reports, assembled in one read. */
@Value
@Builder
public class ExecutorStatus {

    String executorId;
    String tradingMode;
    boolean ready;
    Instant startedAt;
    Instant timestamp;

    ConnectionHealth connectionHealth;
    List<ConnectionSnapshot> connections;

    List<ActiveStrategy> strategies;
    List<MonitorStatus> monitors;
    List<Signal> recentSignals;

    SystemHealth systemHealth;
    KillSwitchStatus killSwitch;
    QueueStats queueStats;
    AccountSnapshot account;

    @Value
    @Builder
    public static class SystemHealth {

        int evaluationsPerMinute;
        double averageTickLatencyMs;
        double cacheHitRate;
        int activeMonitors;
        long uptimeSeconds;
    }
}
