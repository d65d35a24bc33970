package com.tradeexecutor.orchestrator;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.QueueStats;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.connection.ConnectionHealth;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.marketdata.MarketDataService;
import com.tradeexecutor.monitor.RecentSignalBuffer;
import com.tradeexecutor.monitor.StrategyMonitor;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.observability.ExecutorMetricsService;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.safety.KillSwitchService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Service;

/**
 * Read model behind the status surface. Every part comes from its owner's snapshot
 * accessor; nothing here holds state besides the start time and the ready flag.
 */
@Service
public class ExecutorStatusService {

    static final int RECENT_SIGNALS = 20;

    private final ExecutorProperties executorProperties;
    private final ConnectionSupervisor connectionSupervisor;
    private final StrategyRegistry strategyRegistry;
    private final StrategyMonitor strategyMonitor;
    private final RecentSignalBuffer recentSignalBuffer;
    private final ExecutorMetricsService executorMetricsService;
    private final MarketDataService marketDataService;
    private final KillSwitchService killSwitchService;
    private final CommandPipeline commandPipeline;
    private final AccountStateService accountStateService;
    private final Clock clock;

    private final Instant startedAt;
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public ExecutorStatusService(
            ExecutorProperties executorProperties,
            ConnectionSupervisor connectionSupervisor,
            StrategyRegistry strategyRegistry,
            StrategyMonitor strategyMonitor,
            RecentSignalBuffer recentSignalBuffer,
            ExecutorMetricsService executorMetricsService,
            MarketDataService marketDataService,
            KillSwitchService killSwitchService,
            CommandPipeline commandPipeline,
            AccountStateService accountStateService,
            Clock clock) {
        this.executorProperties = executorProperties;
        this.connectionSupervisor = connectionSupervisor;
        this.strategyRegistry = strategyRegistry;
        this.strategyMonitor = strategyMonitor;
        this.recentSignalBuffer = recentSignalBuffer;
        this.executorMetricsService = executorMetricsService;
        this.marketDataService = marketDataService;
        this.killSwitchService = killSwitchService;
        this.commandPipeline = commandPipeline;
        this.accountStateService = accountStateService;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public ExecutorStatus getStatus() {
        Instant now = clock.instant();
        return ExecutorStatus.builder()
                .executorId(executorProperties.getId())
                .tradingMode(executorProperties.getTradingMode())
                .ready(ready.get())
                .startedAt(startedAt)
                .timestamp(now)
                .connectionHealth(connectionSupervisor.getHealth())
                .connections(connectionSupervisor.getAllSnapshots())
                .strategies(strategyRegistry.snapshot())
                .monitors(strategyMonitor.getMonitorStatuses())
                .recentSignals(recentSignalBuffer.recent(RECENT_SIGNALS))
                .systemHealth(systemHealth(now))
                .killSwitch(killSwitchService.getStatus())
                .queueStats(commandPipeline.getQueueStats())
                .account(accountStateService.current())
                .build();
    }

    /** Flat summary used for GET_STATUS command results and heartbeat-style reports. */
    public Map<String, Object> getStatusSummary() {
        ConnectionHealth health = connectionSupervisor.getHealth();
        QueueStats queue = commandPipeline.getQueueStats();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("executorId", executorProperties.getId());
        summary.put("ready", ready.get());
        summary.put("connectionsHealthy", health.isHealthy());
        summary.put("connected", health.getConnected());
        summary.put("activeStrategies", strategyRegistry.size());
        summary.put("killSwitchTripped", killSwitchService.isTripped());
        summary.put("queued", queue.queued());
        summary.put("processing", queue.processing());
        summary.put("evaluationsPerMinute", executorMetricsService.evaluationsPerMinute());
        summary.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());
        return summary;
    }

    private ExecutorStatus.SystemHealth systemHealth(Instant now) {
        return ExecutorStatus.SystemHealth.builder()
                .evaluationsPerMinute(executorMetricsService.evaluationsPerMinute())
                .averageTickLatencyMs(executorMetricsService.averageTickLatencyMs())
                .cacheHitRate(marketDataService.cacheHitRate())
                .activeMonitors(strategyMonitor.activeMonitorCount())
                .uptimeSeconds(Duration.between(startedAt, now).toSeconds())
                .build();
    }

    public boolean isReady() {
        return ready.get();
    }

    void markReady() {
        ready.set(true);
    }
}
