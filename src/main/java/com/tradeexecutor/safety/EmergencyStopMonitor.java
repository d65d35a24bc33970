package com.tradeexecutor.safety;

import com.tradeexecutor.config.EmergencyConfig;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.event.AccountRefreshedEvent;
import com.tradeexecutor.event.CommandEvent;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SafetyEventType;
import com.tradeexecutor.event.Severity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Trips the kill switch automatically (initiator AUTOMATIC) after an account refresh when:
 * <ul>
 *   <li>the daily loss breaches its absolute or percent limit</li>
 *   <li>the drawdown breaches its absolute or percent limit</li>
 *   <li>consecutive losing closes reach {@code max-consecutive-losses}</li>
 *   <li>errors in the last minute reach {@code max-error-rate-per-minute}</li>
 * </ul>
 *
 * <p>At 80% of the daily-loss or drawdown limit a LIMIT_WARNING is published once, and again
 * only after the value falls back below 80%. This monitor never resets the kill switch.
 */
@Component
public class EmergencyStopMonitor {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopMonitor.class);

    private static final Duration ERROR_WINDOW = Duration.ofMinutes(1);
    private static final BigDecimal WARNING_FRACTION = new BigDecimal("0.8");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final EmergencyConfig emergencyConfig;
    private final SafetyLimits safetyLimits;
    private final KillSwitchService killSwitchService;
    private final AccountStateService accountStateService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Deque<Instant> recentErrors = new ArrayDeque<>();
    private final Set<String> activeWarnings = ConcurrentHashMap.newKeySet();

    public EmergencyStopMonitor(
            EmergencyConfig emergencyConfig,
            SafetyLimits safetyLimits,
            KillSwitchService killSwitchService,
            AccountStateService accountStateService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.emergencyConfig = emergencyConfig;
        this.safetyLimits = safetyLimits;
        this.killSwitchService = killSwitchService;
        this.accountStateService = accountStateService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @EventListener
    public void onAccountRefreshed(AccountRefreshedEvent event) {
        evaluate(event.getSnapshot());
    }

    /** Only send faults count; safety denials and rejections are decisions, not errors. */
    @EventListener
    public void onCommandEvent(CommandEvent event) {
        if (event.isExecutionFailure()) {
            recordError();
        }
    }

    /** Runs the auto-trip checks against a snapshot; returns true if it tripped the switch. */
    public boolean evaluate(AccountSnapshot snapshot) {
        if (!emergencyConfig.isAutoTriggerEnabled() || killSwitchService.isTripped()) {
            return false;
        }

        BigDecimal dailyLoss = snapshot.dailyLoss();
        if (breached(dailyLoss, safetyLimits.getMaxDailyLoss())
                || breached(percent(dailyLoss, snapshot.getDailyStartBalance()), safetyLimits.getMaxDailyLossPercent())) {
            return trip("Daily loss limit breached: " + dailyLoss.toPlainString());
        }
        warnIfApproaching("dailyLoss", dailyLoss, safetyLimits.getMaxDailyLoss());

        BigDecimal drawdown = snapshot.drawdown();
        if (breached(drawdown, safetyLimits.getMaxDrawdown())
                || breached(percent(drawdown, snapshot.getPeakEquity()), safetyLimits.getMaxDrawdownPercent())) {
            return trip("Drawdown limit breached: " + drawdown.toPlainString());
        }
        warnIfApproaching("drawdown", drawdown, safetyLimits.getMaxDrawdown());

        int losses = accountStateService.getConsecutiveLosses();
        if (emergencyConfig.getMaxConsecutiveLosses() > 0 && losses >= emergencyConfig.getMaxConsecutiveLosses()) {
            return trip(losses + " consecutive losing trades");
        }

        int errors = errorsInLastMinute();
        if (errorRateBreached(errors)) {
            return trip("Error rate " + errors + "/min reached limit " + emergencyConfig.getMaxErrorRatePerMinute());
        }
        return false;
    }

    /** Records one monitor or dispatch error and trips when the per-minute limit is reached. */
    public void recordError() {
        int errors;
        synchronized (recentErrors) {
            recentErrors.addLast(clock.instant());
            errors = pruneAndCount();
        }
        if (emergencyConfig.isAutoTriggerEnabled() && !killSwitchService.isTripped() && errorRateBreached(errors)) {
            trip("Error rate " + errors + "/min reached limit " + emergencyConfig.getMaxErrorRatePerMinute());
        }
    }

    public int errorsInLastMinute() {
        synchronized (recentErrors) {
            return pruneAndCount();
        }
    }

    private int pruneAndCount() {
        Instant cutoff = clock.instant().minus(ERROR_WINDOW);
        while (!recentErrors.isEmpty() && recentErrors.peekFirst().isBefore(cutoff)) {
            recentErrors.pollFirst();
        }
        return recentErrors.size();
    }

    private boolean errorRateBreached(int errors) {
        return emergencyConfig.getMaxErrorRatePerMinute() > 0 && errors >= emergencyConfig.getMaxErrorRatePerMinute();
    }

    private boolean trip(String reason) {
        log.error("Emergency stop condition met: {}", reason);
        return killSwitchService.trip(reason, TripInitiator.AUTOMATIC);
    }

    private void warnIfApproaching(String limitName, BigDecimal value, BigDecimal limit) {
        if (limit == null || limit.signum() <= 0) {
            return;
        }
        boolean approaching = value.compareTo(limit.multiply(WARNING_FRACTION)) >= 0;
        if (!approaching) {
            activeWarnings.remove(limitName);
            return;
        }
        if (activeWarnings.add(limitName)) {
            log.warn("Approaching {} limit: {} of {}", limitName, value.toPlainString(), limit.toPlainString());
            eventPublisherHelper.publishSafetyEvent(
                    this,
                    SafetyEventType.LIMIT_WARNING,
                    Severity.WARNING,
                    "Approaching " + limitName + " limit",
                    Map.of("limit", limitName, "value", value, "max", limit));
        }
    }

    private static boolean breached(BigDecimal value, BigDecimal limit) {
        return value != null && limit != null && limit.signum() > 0 && value.compareTo(limit) >= 0;
    }

    private static BigDecimal percent(BigDecimal amount, BigDecimal base) {
        if (base == null || base.signum() <= 0) {
            return null;
        }
        return amount.multiply(HUNDRED).divide(base, 2, RoundingMode.HALF_UP);
    }
}
