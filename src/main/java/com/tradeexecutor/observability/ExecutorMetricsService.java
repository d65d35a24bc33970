package com.tradeexecutor.observability;

import com.tradeexecutor.event.CommandEvent;
import com.tradeexecutor.event.CommandEventType;
import com.tradeexecutor.event.SafetyEvent;
import com.tradeexecutor.event.SafetyEventType;
import com.tradeexecutor.event.SignalEvent;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.safety.KillSwitchService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters of the executor:
 * <ul>
 *   <li><b>executor.commands.completed</b> / <b>executor.commands.failed</b> (counters)</li>
 *   <li><b>executor.signals.emitted</b> (counter)</li>
 *   <li><b>executor.trades.denied</b> (counter): safety gate denials</li>
 *   <li><b>executor.tick.latency</b> (timer): one strategy evaluation</li>
 *   <li><b>executor.strategies.active</b> and <b>executor.killswitch.tripped</b> (gauges)</li>
 * </ul>
 *
 * <p>Also keeps the two figures the status surface shows directly: evaluations in the last
 * minute and the average tick latency.
 */
@Service
public class ExecutorMetricsService {

    private static final Duration EVALUATION_WINDOW = Duration.ofMinutes(1);

    private final Counter commandsCompletedCounter;
    private final Counter commandsFailedCounter;
    private final Counter signalsEmittedCounter;
    private final Counter tradesDeniedCounter;
    private final Timer tickLatencyTimer;
    private final Clock clock;

    private final Deque<Instant> recentEvaluations = new ArrayDeque<>();
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong tickNanos = new AtomicLong();

    public ExecutorMetricsService(
            MeterRegistry meterRegistry,
            StrategyRegistry strategyRegistry,
            KillSwitchService killSwitchService,
            Clock clock) {
        this.clock = clock;
        this.commandsCompletedCounter = Counter.builder("executor.commands.completed")
                .description("Commands completed successfully")
                .register(meterRegistry);
        this.commandsFailedCounter = Counter.builder("executor.commands.failed")
                .description("Commands that failed or were rejected")
                .register(meterRegistry);
        this.signalsEmittedCounter = Counter.builder("executor.signals.emitted")
                .description("Signals that passed the safety gate")
                .register(meterRegistry);
        this.tradesDeniedCounter = Counter.builder("executor.trades.denied")
                .description("Trades refused by the safety gate")
                .register(meterRegistry);
        this.tickLatencyTimer = Timer.builder("executor.tick.latency")
                .description("Duration of one strategy evaluation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        meterRegistry.gauge("executor.strategies.active", strategyRegistry, StrategyRegistry::size);
        meterRegistry.gauge("executor.killswitch.tripped", killSwitchService, ks -> ks.isTripped() ? 1.0 : 0.0);
    }

    public void recordTick(long elapsedNanos) {
        tickLatencyTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        tickCount.incrementAndGet();
        tickNanos.addAndGet(elapsedNanos);
        synchronized (recentEvaluations) {
            recentEvaluations.addLast(clock.instant());
            prune();
        }
    }

    public int evaluationsPerMinute() {
        synchronized (recentEvaluations) {
            prune();
            return recentEvaluations.size();
        }
    }

    public double averageTickLatencyMs() {
        long count = tickCount.get();
        return count == 0 ? 0.0 : tickNanos.get() / (double) count / 1_000_000.0;
    }

    @EventListener
    @Order(20)
    public void onCommandEvent(CommandEvent event) {
        if (event.getEventType() == CommandEventType.COMPLETED) {
            commandsCompletedCounter.increment();
        } else if (event.getEventType() == CommandEventType.FAILED || event.getEventType() == CommandEventType.REJECTED) {
            commandsFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSignal(SignalEvent event) {
        signalsEmittedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onSafetyEvent(SafetyEvent event) {
        if (event.getEventType() == SafetyEventType.TRADE_DENIED) {
            tradesDeniedCounter.increment();
        }
    }

    private void prune() {
        Instant cutoff = clock.instant().minus(EVALUATION_WINDOW);
        while (!recentEvaluations.isEmpty() && recentEvaluations.peekFirst().isBefore(cutoff)) {
            recentEvaluations.pollFirst();
        }
    }

    Counter getCommandsCompletedCounter() {
        return commandsCompletedCounter;
    }

    Counter getCommandsFailedCounter() {
        return commandsFailedCounter;
    }

    Counter getTradesDeniedCounter() {
        return tradesDeniedCounter;
    }
}
