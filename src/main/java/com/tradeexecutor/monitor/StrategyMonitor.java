package com.tradeexecutor.monitor;

import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.StrategyStatus;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.event.AccountRefreshedEvent;
import com.tradeexecutor.event.CommandEvent;
import com.tradeexecutor.event.CommandEventType;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.StrategyEventType;
import com.tradeexecutor.marketdata.MarketDataService;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.monitor.ConditionEvaluator.Evaluation;
import com.tradeexecutor.monitor.FilterEvaluator.FilterOutcome;
import com.tradeexecutor.observability.ExecutorMetricsService;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.safety.EmergencyStopMonitor;
import com.tradeexecutor.safety.KillSwitchService;
import com.tradeexecutor.safety.MonitorHalter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs one periodic evaluation loop per active strategy.
 *
 * <p>Each strategy gets a fixed-delay task on the {@code monitorScheduler}, so ticks of one
 * strategy never overlap while different strategies tick in parallel. Interval comes from
 * the strategy's timeframe (M1 every second up to D1 every five minutes).
 *
 * <p><b>Tick pipeline:</b>
 * <ol>
 *   <li>Skip if the monitor is inactive or paused, or the kill switch is tripped</li>
 *   <li>Fetch the cached market snapshot; no data skips the tick</li>
 *   <li>Filters; any rejection suppresses the signal silently</li>
 *   <li>Signal cooldown and the one-position-per-strategy guard</li>
 *   <li>Entry conditions under AND/OR logic</li>
 *   <li>Exit levels, sizing and the safety gate (via {@link SignalFactory})</li>
 *   <li>Re-check active + kill switch, then publish the {@link Signal}</li>
 * </ol>
 *
 * <p>The command pipeline turns a published signal into an OPEN_POSITION command. The
 * strategy stays blocked from new signals until that command fails or is cancelled, or
 * until the resulting position is seen closed.
 *
 * <p>Every tick runs inside a catch-all. More than {@code max-consecutive-errors} failures
 * in a row stop the monitor and publish MONITOR_ERROR.
 */
@Service
public class StrategyMonitor implements MonitorHalter {

    private static final Logger log = LoggerFactory.getLogger(StrategyMonitor.class);

    /** What a single tick did; returned for tests and debug logging. */
    public enum TickOutcome {
        INACTIVE,
        PAUSED,
        KILL_SWITCH,
        NO_DATA,
        FILTERED,
        COOLDOWN,
        POSITION_OPEN,
        CONDITIONS_NOT_MET,
        DENIED,
        SUPPRESSED,
        SIGNAL,
        ERROR
    }

    private final StrategyRegistry strategyRegistry;
    private final MarketDataService marketDataService;
    private final FilterEvaluator filterEvaluator;
    private final ConditionEvaluator conditionEvaluator;
    private final SignalFactory signalFactory;
    private final KillSwitchService killSwitchService;
    private final AccountStateService accountStateService;
    private final EmergencyStopMonitor emergencyStopMonitor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ExecutorMetricsService executorMetricsService;
    private final MonitorConfig monitorConfig;
    private final TaskScheduler monitorScheduler;
    private final Clock clock;

    private final Map<String, MonitorHandle> monitors = new ConcurrentHashMap<>();

    /** Signal command id to strategy id, until the command resolves. */
    private final Map<String, String> pendingCommands = new ConcurrentHashMap<>();

    public StrategyMonitor(
            StrategyRegistry strategyRegistry,
            MarketDataService marketDataService,
            FilterEvaluator filterEvaluator,
            ConditionEvaluator conditionEvaluator,
            SignalFactory signalFactory,
            KillSwitchService killSwitchService,
            AccountStateService accountStateService,
            EmergencyStopMonitor emergencyStopMonitor,
            EventPublisherHelper eventPublisherHelper,
            ExecutorMetricsService executorMetricsService,
            MonitorConfig monitorConfig,
            @Qualifier("monitorScheduler") TaskScheduler monitorScheduler,
            Clock clock) {
        this.strategyRegistry = strategyRegistry;
        this.marketDataService = marketDataService;
        this.filterEvaluator = filterEvaluator;
        this.conditionEvaluator = conditionEvaluator;
        this.signalFactory = signalFactory;
        this.killSwitchService = killSwitchService;
        this.accountStateService = accountStateService;
        this.emergencyStopMonitor = emergencyStopMonitor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.executorMetricsService = executorMetricsService;
        this.monitorConfig = monitorConfig;
        this.monitorScheduler = monitorScheduler;
        this.clock = clock;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Registers the strategy and schedules its tick. A strategy that is already monitored
     * is rescheduled with the new definition (used by UPDATE_STRATEGY).
     */
    public void startMonitoring(ActiveStrategy strategy) {
        strategyRegistry.register(strategy);
        MonitorHandle previous = monitors.remove(strategy.getId());
        if (previous != null) {
            previous.deactivate();
            log.info("Restarting monitor for strategy {}", strategy.getId());
        }

        MonitorHandle handle = new MonitorHandle(strategy.getId(), strategy.getLastSignalAt());
        handle.paused = !strategy.isActive();
        Duration interval = strategy.getTimeframe() != null
                ? strategy.getTimeframe().getCheckInterval()
                : Timeframe.DEFAULT_CHECK_INTERVAL;
        monitors.put(strategy.getId(), handle);
        handle.future = monitorScheduler.scheduleWithFixedDelay(() -> runTick(strategy.getId()), interval);

        log.info("Monitoring strategy {} ({}) on {} {} every {}s",
                strategy.getId(), strategy.getName(), strategy.primarySymbol(), strategy.getTimeframe(),
                interval.toSeconds());
        eventPublisherHelper.publishStrategyEvent(
                this, strategy.getId(), StrategyEventType.STARTED, "Monitoring started for " + strategy.getName());
    }

    /**
     * Stops the strategy's loop and unregisters it. Idempotent: only the call that actually
     * stops an active monitor publishes DEACTIVATED.
     *
     * @return true if a running monitor was stopped
     */
    public boolean stop(String strategyId) {
        MonitorHandle handle = monitors.remove(strategyId);
        if (handle == null) {
            return false;
        }
        handle.deactivate();
        strategyRegistry.unregister(strategyId);
        log.info("Stopped monitoring strategy {}", strategyId);
        eventPublisherHelper.publishStrategyEvent(
                this, strategyId, StrategyEventType.DEACTIVATED, "Monitoring stopped");
        return true;
    }

    @Override
    public int stopAll() {
        int stopped = 0;
        for (String strategyId : new ArrayList<>(monitors.keySet())) {
            if (stop(strategyId)) {
                stopped++;
            }
        }
        if (stopped > 0) {
            log.warn("Stopped all {} strategy monitors", stopped);
        }
        return stopped;
    }

    public boolean pause(String strategyId) {
        MonitorHandle handle = monitors.get(strategyId);
        if (handle == null || handle.paused) {
            return false;
        }
        handle.paused = true;
        strategyRegistry.updateStatus(strategyId, StrategyStatus.PAUSED);
        log.info("Paused strategy {}", strategyId);
        eventPublisherHelper.publishStrategyEvent(this, strategyId, StrategyEventType.PAUSED, "Monitoring paused");
        return true;
    }

    public boolean resume(String strategyId) {
        MonitorHandle handle = monitors.get(strategyId);
        if (handle == null || !handle.paused) {
            return false;
        }
        handle.paused = false;
        handle.consecutiveErrors.set(0);
        strategyRegistry.updateStatus(strategyId, StrategyStatus.ACTIVE);
        log.info("Resumed strategy {}", strategyId);
        eventPublisherHelper.publishStrategyEvent(this, strategyId, StrategyEventType.RESUMED, "Monitoring resumed");
        return true;
    }

    /** Allows the strategy to signal again once its position (or pending entry) is gone. */
    public void markPositionClosed(String strategyId) {
        MonitorHandle handle = monitors.get(strategyId);
        if (handle != null && handle.positionPending) {
            handle.positionPending = false;
            log.info("Strategy {} position closed; entries re-enabled", strategyId);
        }
    }

    public boolean isMonitoring(String strategyId) {
        MonitorHandle handle = monitors.get(strategyId);
        return handle != null && handle.active;
    }

    public int activeMonitorCount() {
        return monitors.size();
    }

    // ========================
    // TICK
    // ========================

    /** One evaluation of a strategy; never throws. */
    public TickOutcome runTick(String strategyId) {
        MonitorHandle handle = monitors.get(strategyId);
        if (handle == null || !handle.active) {
            return TickOutcome.INACTIVE;
        }
        long started = System.nanoTime();
        try {
            TickOutcome outcome = tick(handle);
            handle.consecutiveErrors.set(0);
            log.debug("Tick {} -> {}", strategyId, outcome);
            return outcome;
        } catch (RuntimeException e) {
            onTickError(handle, e);
            return TickOutcome.ERROR;
        } finally {
            handle.ticks.incrementAndGet();
            handle.lastTickAt = clock.instant();
            executorMetricsService.recordTick(System.nanoTime() - started);
        }
    }

    private TickOutcome tick(MonitorHandle handle) {
        Optional<ActiveStrategy> registered = strategyRegistry.get(handle.strategyId);
        if (registered.isEmpty()) {
            return TickOutcome.INACTIVE;
        }
        ActiveStrategy strategy = registered.get();
        if (handle.paused || !strategy.isActive()) {
            return TickOutcome.PAUSED;
        }
        if (killSwitchService.isTripped()) {
            return TickOutcome.KILL_SWITCH;
        }

        String symbol = strategy.primarySymbol();
        Optional<MarketSnapshot> fetched = marketDataService.getSnapshot(symbol, strategy.getTimeframe());
        if (fetched.isEmpty()) {
            log.debug("No market data for {} {}, skipping tick of {}", symbol, strategy.getTimeframe(), strategy.getId());
            return TickOutcome.NO_DATA;
        }
        MarketSnapshot snapshot = fetched.get();
        AccountSnapshot account = accountStateService.current();

        FilterOutcome filters = filterEvaluator.evaluate(strategy.getFilters(), snapshot, account.getOpenPositions());
        if (!filters.passed()) {
            return TickOutcome.FILTERED;
        }

        Instant now = clock.instant();
        Duration cooldown = Duration.ofMinutes(monitorConfig.getSignalCooldownMinutes());
        if (handle.lastSignalAt != null && handle.lastSignalAt.plus(cooldown).isAfter(now)) {
            return TickOutcome.COOLDOWN;
        }
        if (handle.positionPending || hasOpenPosition(account, strategy.getId(), symbol)) {
            return TickOutcome.POSITION_OPEN;
        }

        Evaluation evaluation = conditionEvaluator.evaluate(strategy.getConditions(), strategy.getEntryLogic(), snapshot);
        if (!evaluation.met()) {
            return TickOutcome.CONDITIONS_NOT_MET;
        }

        SignalFactory.Outcome outcome = signalFactory.create(strategy, snapshot, evaluation, account);
        if (!outcome.approved()) {
            return TickOutcome.DENIED;
        }

        synchronized (handle) {
            if (!handle.active || killSwitchService.isTripped()) {
                log.info("Signal for strategy {} suppressed: monitor stopped or kill switch tripped", strategy.getId());
                return TickOutcome.SUPPRESSED;
            }
            Signal signal = outcome.signal();
            handle.lastSignalAt = signal.getCreatedAt();
            handle.positionPending = true;
            pendingCommands.put(signal.commandId(), strategy.getId());
            strategyRegistry.recordSignal(strategy.getId(), signal.getCreatedAt());
            log.info("Signal {} for strategy {}: {} {} {} @ {} (SL {}, TP {})",
                    signal.getId(), strategy.getId(), signal.getDirection(), signal.getVolume(), signal.getSymbol(),
                    signal.getEntryPrice(), signal.getStopLoss(), signal.getTakeProfit());
            eventPublisherHelper.publishSignal(this, signal);
        }
        return TickOutcome.SIGNAL;
    }

    private static boolean hasOpenPosition(AccountSnapshot account, String strategyId, String symbol) {
        for (OpenPosition position : account.getOpenPositions()) {
            if (strategyId.equals(position.getStrategyId()) && symbol != null && symbol.equals(position.getSymbol())) {
                return true;
            }
        }
        return false;
    }

    private void onTickError(MonitorHandle handle, RuntimeException e) {
        if (!handle.active) {
            log.debug("Tick of stopped strategy {} ended with {}", handle.strategyId, e.toString());
            return;
        }
        int errors = handle.consecutiveErrors.incrementAndGet();
        log.error("Tick failed for strategy {} ({} consecutive): {}", handle.strategyId, errors, e.getMessage(), e);
        emergencyStopMonitor.recordError();
        if (errors > monitorConfig.getMaxConsecutiveErrors()) {
            log.error("Too many consecutive errors, stopping strategy {}", handle.strategyId);
            stop(handle.strategyId);
            eventPublisherHelper.publishStrategyEvent(
                    this,
                    handle.strategyId,
                    StrategyEventType.MONITOR_ERROR,
                    errors + " consecutive tick errors, last: " + e.getMessage());
        }
    }

    // ========================
    // POSITION TRACKING
    // ========================

    /** A signal's command that did not open a position re-enables entries. */
    @EventListener
    public void onCommandEvent(CommandEvent event) {
        if (event.getKind() != CommandKind.OPEN_POSITION) {
            return;
        }
        CommandEventType type = event.getEventType();
        if (type == CommandEventType.COMPLETED) {
            pendingCommands.remove(event.getCommandId());
            return;
        }
        if (type == CommandEventType.FAILED || type == CommandEventType.CANCELLED || type == CommandEventType.REJECTED) {
            String strategyId = pendingCommands.remove(event.getCommandId());
            if (strategyId != null) {
                log.info("Entry command {} for strategy {} ended {}; entries re-enabled",
                        event.getCommandId(), strategyId, type);
                markPositionClosed(strategyId);
            }
        }
    }

    @EventListener
    public void onAccountRefreshed(AccountRefreshedEvent event) {
        for (OpenPosition closed : event.getClosedPositions()) {
            if (closed.getStrategyId() != null) {
                markPositionClosed(closed.getStrategyId());
            }
        }
    }

    // ========================
    // STATUS
    // ========================

    public record MonitorStatus(
            String strategyId,
            boolean paused,
            boolean positionPending,
            int consecutiveErrors,
            long ticks,
            Instant lastTickAt,
            Instant lastSignalAt) {}

    public List<MonitorStatus> getMonitorStatuses() {
        return monitors.values().stream()
                .map(MonitorHandle::status)
                .sorted(Comparator.comparing(MonitorStatus::strategyId))
                .toList();
    }

    private static final class MonitorHandle {

        private final String strategyId;
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        private final AtomicLong ticks = new AtomicLong();

        private volatile boolean active = true;
        private volatile boolean paused;
        private volatile boolean positionPending;
        private volatile Instant lastSignalAt;
        private volatile Instant lastTickAt;
        private volatile ScheduledFuture<?> future;

        MonitorHandle(String strategyId, Instant lastSignalAt) {
            this.strategyId = strategyId;
            this.lastSignalAt = lastSignalAt;
        }

        void deactivate() {
            synchronized (this) {
                active = false;
            }
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(true);
            }
        }

        MonitorStatus status() {
            return new MonitorStatus(
                    strategyId, paused, positionPending, consecutiveErrors.get(), ticks.get(), lastTickAt, lastSignalAt);
        }
    }
}
