package com.tradeexecutor.safety;

import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.ProposedTrade;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SafetyEventType;
import com.tradeexecutor.event.Severity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade risk gate for every trade that opens exposure.
 *
 * <p>Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>Kill switch tripped</li>
 *   <li>Daily loss at or over the limit (absolute, or percent of the day's start balance)</li>
 *   <li>Drawdown from peak equity at or over the limit (absolute or percent)</li>
 *   <li>Open positions at the maximum</li>
 *   <li>Requested lot size over the maximum</li>
 *   <li>Correlation with an open position's symbol over the maximum</li>
 *   <li>Total exposure after the trade over the maximum</li>
 * </ol>
 *
 * <p>{@link #validate} is pure given its inputs, the immutable limits and the kill switch
 * flag. {@link #check} additionally publishes a TRADE_DENIED event on denial.
 */
@Service
public class SafetyGate {

    private static final Logger log = LoggerFactory.getLogger(SafetyGate.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SafetyLimits safetyLimits;
    private final KillSwitchService killSwitchService;
    private final CorrelationTable correlationTable;
    private final EventPublisherHelper eventPublisherHelper;

    public SafetyGate(
            SafetyLimits safetyLimits,
            KillSwitchService killSwitchService,
            CorrelationTable correlationTable,
            EventPublisherHelper eventPublisherHelper) {
        this.safetyLimits = safetyLimits;
        this.killSwitchService = killSwitchService;
        this.correlationTable = correlationTable;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Validates and publishes a TRADE_DENIED warning when the trade is refused. */
    public SafetyDecision check(ProposedTrade trade, AccountSnapshot account) {
        SafetyDecision decision = validate(trade, account);
        if (decision.isDenied()) {
            log.warn(
                    "Trade denied for strategy {} ({} {} {}): {}",
                    trade.getStrategyId(),
                    trade.getSide(),
                    trade.getVolume(),
                    trade.getSymbol(),
                    decision.getReason());
            Map<String, Object> details = new LinkedHashMap<>(decision.getDetails());
            details.put("check", decision.getFailedCheck().name());
            details.put("symbol", trade.getSymbol());
            if (trade.getStrategyId() != null) {
                details.put("strategyId", trade.getStrategyId());
            }
            eventPublisherHelper.publishSafetyEvent(
                    this, SafetyEventType.TRADE_DENIED, Severity.WARNING, decision.getReason(), details);
        }
        return decision;
    }

    public SafetyDecision validate(ProposedTrade trade, AccountSnapshot account) {
        // 1. Kill switch
        if (killSwitchService.isTripped()) {
            return SafetyDecision.denied(
                    SafetyCheck.KILL_SWITCH,
                    "Kill switch is tripped: " + killSwitchService.getStatus().getReason(),
                    Map.of());
        }

        // 2. Daily loss
        BigDecimal dailyLoss = account.dailyLoss();
        if (exceeds(dailyLoss, safetyLimits.getMaxDailyLoss())) {
            return SafetyDecision.denied(
                    SafetyCheck.DAILY_LOSS,
                    "Max daily loss reached: daily loss " + plain(dailyLoss) + " >= " + plain(safetyLimits.getMaxDailyLoss()),
                    Map.of("dailyLoss", dailyLoss, "limit", safetyLimits.getMaxDailyLoss()));
        }
        BigDecimal dailyLossPercent = percentOf(dailyLoss, account.getDailyStartBalance());
        if (dailyLossPercent != null && exceeds(dailyLossPercent, safetyLimits.getMaxDailyLossPercent())) {
            return SafetyDecision.denied(
                    SafetyCheck.DAILY_LOSS,
                    "Max daily loss reached: daily loss " + plain(dailyLossPercent) + "% >= "
                            + plain(safetyLimits.getMaxDailyLossPercent()) + "%",
                    Map.of("dailyLossPercent", dailyLossPercent, "limit", safetyLimits.getMaxDailyLossPercent()));
        }

        // 3. Drawdown
        BigDecimal drawdown = account.drawdown();
        if (exceeds(drawdown, safetyLimits.getMaxDrawdown())) {
            return SafetyDecision.denied(
                    SafetyCheck.DRAWDOWN,
                    "Max drawdown reached: " + plain(drawdown) + " >= " + plain(safetyLimits.getMaxDrawdown()),
                    Map.of("drawdown", drawdown, "limit", safetyLimits.getMaxDrawdown()));
        }
        BigDecimal drawdownPercent = percentOf(drawdown, account.getPeakEquity());
        if (drawdownPercent != null && exceeds(drawdownPercent, safetyLimits.getMaxDrawdownPercent())) {
            return SafetyDecision.denied(
                    SafetyCheck.DRAWDOWN,
                    "Max drawdown reached: " + plain(drawdownPercent) + "% >= "
                            + plain(safetyLimits.getMaxDrawdownPercent()) + "%",
                    Map.of("drawdownPercent", drawdownPercent, "limit", safetyLimits.getMaxDrawdownPercent()));
        }

        // 4. Open positions
        int openPositions = account.openPositionCount();
        if (openPositions >= safetyLimits.getMaxPositions()) {
            return SafetyDecision.denied(
                    SafetyCheck.MAX_POSITIONS,
                    "Max positions reached: " + openPositions + "/" + safetyLimits.getMaxPositions(),
                    Map.of("openPositions", openPositions, "limit", safetyLimits.getMaxPositions()));
        }

        // 5. Lot size
        BigDecimal volume = trade.getVolume() != null ? trade.getVolume() : BigDecimal.ZERO;
        if (safetyLimits.getMaxLotSize() != null && volume.compareTo(safetyLimits.getMaxLotSize()) > 0) {
            return SafetyDecision.denied(
                    SafetyCheck.LOT_SIZE,
                    "Lot size " + plain(volume) + " exceeds max " + plain(safetyLimits.getMaxLotSize()),
                    Map.of("volume", volume, "limit", safetyLimits.getMaxLotSize()));
        }

        // 6. Correlation
        for (OpenPosition position : account.getOpenPositions()) {
            double correlation = correlationTable.correlation(trade.getSymbol(), position.getSymbol());
            if (Math.abs(correlation) > safetyLimits.getMaxCorrelation()) {
                return SafetyDecision.denied(
                        SafetyCheck.CORRELATION,
                        "High correlation with open " + position.getSymbol() + " position: " + correlation,
                        Map.of("symbol", position.getSymbol(), "correlation", correlation,
                                "limit", safetyLimits.getMaxCorrelation()));
            }
        }

        // 7. Total exposure
        BigDecimal exposure = exposure(account.totalOpenVolume().add(volume));
        if (safetyLimits.getMaxTotalExposure() != null && exposure.compareTo(safetyLimits.getMaxTotalExposure()) > 0) {
            return SafetyDecision.denied(
                    SafetyCheck.TOTAL_EXPOSURE,
                    "Total exposure " + plain(exposure) + " would exceed max " + plain(safetyLimits.getMaxTotalExposure()),
                    Map.of("exposure", exposure, "limit", safetyLimits.getMaxTotalExposure()));
        }

        return SafetyDecision.allow();
    }

    /** Margin-style exposure: {@code lots * contractSize / leverage}. */
    public BigDecimal exposure(BigDecimal lots) {
        BigDecimal leverage = safetyLimits.getLeverage();
        if (leverage == null || leverage.signum() <= 0) {
            return lots.multiply(safetyLimits.getContractSize());
        }
        return lots.multiply(safetyLimits.getContractSize()).divide(leverage, 2, RoundingMode.HALF_UP);
    }

    public SafetyLimits getLimits() {
        return safetyLimits;
    }

    private static boolean exceeds(BigDecimal value, BigDecimal limit) {
        return limit != null && limit.signum() > 0 && value.compareTo(limit) >= 0;
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        if (base == null || base.signum() <= 0) {
            return null;
        }
        return amount.multiply(HUNDRED).divide(base, 2, RoundingMode.HALF_UP);
    }

    private static String plain(BigDecimal value) {
        return value == null ? "n/a" : value.stripTrailingZeros().toPlainString();
    }
}
