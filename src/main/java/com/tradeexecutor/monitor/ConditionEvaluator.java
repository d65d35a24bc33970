package com.tradeexecutor.monitor;

import com.tradeexecutor.domain.enums.ConditionOperator;
import com.tradeexecutor.domain.enums.EntryLogic;
import com.tradeexecutor.domain.model.StrategyCondition;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.marketdata.indicator.IndicatorCalculator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates entry conditions of the form {@code indicator(params) operator value}.
 *
 * <p>The comparison value is a number, the literal {@code price} (last close) or another
 * indicator written as {@code <IND>_<period>}, e.g. {@code EMA_50}. Cross operators compare
 * both sides on the previous bar and on the current bar:
 * <ul>
 *   <li>CROSSES_ABOVE: {@code prev <= prevValue && cur > curValue}</li>
 *   <li>CROSSES_BELOW: {@code prev >= prevValue && cur < curValue}</li>
 * </ul>
 *
 * <p>A disabled condition, or one whose indicator or comparison value cannot be computed,
 * is not met. An empty list never fires.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    static final double EQUALS_TOLERANCE = 0.0001;

    private static final Pattern INDICATOR_REFERENCE = Pattern.compile("^([A-Z]+(?:_[A-Z]+)*)_(\\d+)$");

    private final IndicatorCalculator indicatorCalculator;

    public ConditionEvaluator(IndicatorCalculator indicatorCalculator) {
        this.indicatorCalculator = indicatorCalculator;
    }

    /** Outcome of one condition; {@code currentValue} is NaN when it could not be computed. */
    public record ConditionResult(String conditionId, String indicator, double currentValue, boolean met, String reason) {}

    /** Combined outcome of a condition list under AND/OR logic. */
    public record Evaluation(boolean met, List<ConditionResult> results) {

        public List<String> metReasons() {
            return results.stream().filter(ConditionResult::met).map(ConditionResult::reason).toList();
        }
    }

    public Evaluation evaluate(List<StrategyCondition> conditions, EntryLogic logic, MarketSnapshot snapshot) {
        if (conditions == null || conditions.isEmpty()) {
            return new Evaluation(false, List.of());
        }
        List<ConditionResult> results =
                conditions.stream().map(condition -> evaluate(condition, snapshot)).toList();
        boolean met = logic == EntryLogic.OR
                ? results.stream().anyMatch(ConditionResult::met)
                : results.stream().allMatch(ConditionResult::met);
        return new Evaluation(met, results);
    }

    public ConditionResult evaluate(StrategyCondition condition, MarketSnapshot snapshot) {
        String indicator = condition.getIndicator();
        if (!condition.isEnabled()) {
            return new ConditionResult(condition.getId(), indicator, Double.NaN, false, indicator + " disabled");
        }
        if (condition.getOperator() == null || indicator == null) {
            return new ConditionResult(condition.getId(), indicator, Double.NaN, false, "incomplete condition");
        }

        OptionalDouble current = indicatorCalculator.value(snapshot, indicator, condition.getParams(), 0);
        OptionalDouble target = comparisonValue(condition.getValue(), snapshot, 0);
        if (current.isEmpty() || target.isEmpty()) {
            log.debug("Condition {} not computable on {} ({} bars)", indicator, snapshot.getSymbol(), snapshot.barCount());
            return new ConditionResult(condition.getId(), indicator, Double.NaN, false, indicator + " unavailable");
        }

        double cur = current.getAsDouble();
        double value = target.getAsDouble();
        ConditionOperator operator = condition.getOperator();
        boolean met = switch (operator) {
            case GREATER_THAN -> cur > value;
            case LESS_THAN -> cur < value;
            case EQUALS -> Math.abs(cur - value) < EQUALS_TOLERANCE;
            case GREATER_OR_EQUAL -> cur >= value;
            case LESS_OR_EQUAL -> cur <= value;
            case CROSSES_ABOVE, CROSSES_BELOW -> crossed(condition, snapshot, cur, value);
        };
        return new ConditionResult(condition.getId(), indicator, cur, met, describe(indicator, cur, operator, value, met));
    }

    private boolean crossed(StrategyCondition condition, MarketSnapshot snapshot, double cur, double value) {
        OptionalDouble previous = indicatorCalculator.value(snapshot, condition.getIndicator(), condition.getParams(), 1);
        OptionalDouble previousTarget = comparisonValue(condition.getValue(), snapshot, 1);
        if (previous.isEmpty() || previousTarget.isEmpty()) {
            return false;
        }
        double prev = previous.getAsDouble();
        double prevValue = previousTarget.getAsDouble();
        if (condition.getOperator() == ConditionOperator.CROSSES_ABOVE) {
            return prev <= prevValue && cur > value;
        }
        return prev >= prevValue && cur < value;
    }

    /** Resolves a comparison value at {@code barsAgo}; numbers are constant across bars. */
    OptionalDouble comparisonValue(String value, MarketSnapshot snapshot, int barsAgo) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        try {
            return OptionalDouble.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            log.trace("Comparison value {} is not numeric", trimmed);
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if ("PRICE".equals(upper) || "CLOSE".equals(upper)) {
            return indicatorCalculator.value(snapshot, "PRICE", Map.of(), barsAgo);
        }
        Matcher matcher = INDICATOR_REFERENCE.matcher(upper);
        if (matcher.matches()) {
            double period = Double.parseDouble(matcher.group(2));
            return indicatorCalculator.value(snapshot, matcher.group(1), Map.of("period", period), barsAgo);
        }
        log.warn("Unknown comparison value '{}'", value);
        return OptionalDouble.empty();
    }

    private static String describe(String indicator, double cur, ConditionOperator operator, double value, boolean met) {
        return String.format(Locale.ROOT, "%s %s(%.5f) %s %.5f",
                met ? "met" : "not met", indicator, cur, operator.name().toLowerCase(Locale.ROOT), value);
    }
}
