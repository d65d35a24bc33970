package com.tradeexecutor.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeexecutor.domain.enums.ConditionOperator;
import com.tradeexecutor.domain.enums.EntryLogic;
import com.tradeexecutor.domain.enums.FilterType;
import com.tradeexecutor.domain.enums.SizingMethod;
import com.tradeexecutor.domain.enums.StopLossType;
import com.tradeexecutor.domain.enums.StrategyStatus;
import com.tradeexecutor.domain.enums.TakeProfitType;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.PartialExitRule;
import com.tradeexecutor.domain.model.RiskParameters;
import com.tradeexecutor.domain.model.StopLossRule;
import com.tradeexecutor.domain.model.StrategyCondition;
import com.tradeexecutor.domain.model.StrategyFilter;
import com.tradeexecutor.domain.model.TakeProfitRule;
import com.tradeexecutor.domain.model.TrailingStopRule;
import com.tradeexecutor.exception.CommandValidationException;
import com.tradeexecutor.mapper.JsonHelper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a strategy definition from the control plane into an {@link ActiveStrategy}.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li><b>Platform layout</b>: {@code rules.entry.conditions[]} with lower-case indicator
 *       names such as {@code "ema_20"}, {@code rules.exit.stopLoss / takeProfit / trailing},
 *       {@code rules.riskManagement}, {@code rules.dynamicRisk} and per-filter blocks
 *       ({@code rules.sessionFilter}, {@code rules.spreadFilter}, ...)</li>
 *   <li><b>Executor layout</b>: top-level {@code conditions[]}, {@code filters[]},
 *       {@code exitRules} and {@code riskParameters}, as written by the state store</li>
 * </ul>
 *
 * <p>Conditions with an unknown operator are dropped with a warning. A definition without
 * an id or a symbol is rejected.
 */
@Component
public class StrategyDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(StrategyDefinitionParser.class);

    private static final Pattern NAME_WITH_PERIOD = Pattern.compile("^([A-Za-z]+(?:_[A-Za-z]+)*)_(\\d+)$");

    private static final Map<String, String> INDICATOR_ALIASES = Map.of(
            "STOCHASTIC", "STOCH_K",
            "STOCHASTIC_K", "STOCH_K",
            "STOCHASTIC_D", "STOCH_D",
            "BOLLINGER_UPPER", "BB_UPPER",
            "BOLLINGER_LOWER", "BB_LOWER",
            "BOLLINGER_MIDDLE", "BB_MIDDLE",
            "CLOSE", "PRICE");

    public ActiveStrategy parse(Map<String, Object> definition) {
        return parse(JsonHelper.mapper().<JsonNode>valueToTree(definition));
    }

    public ActiveStrategy parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CommandValidationException("Strategy definition must be an object");
        }
        String id = text(node, "id");
        if (id == null) {
            throw new CommandValidationException("Strategy definition has no id");
        }
        List<String> symbols = symbols(node);
        if (symbols.isEmpty()) {
            throw new CommandValidationException("Strategy " + id + " has no symbol", Map.of("strategyId", id));
        }

        JsonNode rules = node.path("rules");
        boolean platformLayout = rules.isObject();

        ActiveStrategy.ActiveStrategyBuilder builder = ActiveStrategy.builder()
                .id(id)
                .name(text(node, "name") != null ? text(node, "name") : id)
                .symbols(symbols)
                .timeframe(Timeframe.parse(text(node, "timeframe"), Timeframe.M15))
                .status(parseStatus(text(node, "status")));

        if (platformLayout) {
            JsonNode entry = rules.path("entry");
            JsonNode exit = rules.path("exit");
            builder.entryLogic(parseLogic(text(entry, "logic")))
                    .side(parseSide(firstText(entry, "direction", "side")))
                    .conditions(platformConditions(entry.path("conditions")))
                    .filters(platformFilters(rules))
                    .exitRules(platformExitRules(exit))
                    .riskParameters(platformRisk(rules));
        } else {
            builder.entryLogic(parseLogic(firstText(node, "entryLogic", "logic")))
                    .side(parseSide(firstText(node, "side", "direction")))
                    .conditions(executorConditions(node.path("conditions")))
                    .filters(executorFilters(node.path("filters")))
                    .exitRules(executorExitRules(node.path("exitRules")))
                    .riskParameters(executorRisk(node.path("riskParameters")));
        }

        ActiveStrategy strategy = builder.build();
        log.debug(
                "Parsed strategy {} ({} layout): {} conditions, {} filters, logic={}",
                id,
                platformLayout ? "platform" : "executor",
                strategy.getConditions().size(),
                strategy.getFilters().size(),
                strategy.getEntryLogic());
        return strategy;
    }

    // ========================
    // PLATFORM LAYOUT
    // ========================

    private List<StrategyCondition> platformConditions(JsonNode conditions) {
        List<StrategyCondition> result = new ArrayList<>();
        int index = 0;
        for (JsonNode cond : conditions) {
            String rawIndicator = text(cond, "indicator");
            String rawOperator = firstText(cond, "condition", "operator", "comparison");
            ConditionOperator operator = ConditionOperator.fromWire(rawOperator).orElse(null);
            if (rawIndicator == null || operator == null) {
                log.warn("Dropping condition {}: indicator={}, operator={}", index, rawIndicator, rawOperator);
                index++;
                continue;
            }

            Map<String, Double> params = new LinkedHashMap<>();
            String indicator = rawIndicator.toUpperCase(Locale.ROOT);
            Matcher matcher = NAME_WITH_PERIOD.matcher(rawIndicator);
            if (matcher.matches()) {
                indicator = matcher.group(1).toUpperCase(Locale.ROOT);
                params.put("period", Double.parseDouble(matcher.group(2)));
            }
            indicator = INDICATOR_ALIASES.getOrDefault(indicator, indicator);
            copyNumber(cond, "period", params);
            copyNumber(cond, "fastPeriod", params);
            copyNumber(cond, "slowPeriod", params);
            copyNumber(cond, "signalPeriod", params);
            copyNumber(cond, "stdDev", params);
            copyNumber(cond, "kPeriod", params);

            result.add(StrategyCondition.builder()
                    .id("cond_" + index)
                    .indicator(indicator)
                    .params(params)
                    .operator(operator)
                    .value(comparisonValue(cond.get("value")))
                    .enabled(!cond.has("enabled") || cond.path("enabled").asBoolean(true))
                    .build());
            index++;
        }
        return result;
    }

    private List<StrategyFilter> platformFilters(JsonNode rules) {
        List<StrategyFilter> filters = new ArrayList<>();
        addPlatformFilter(filters, rules.path("sessionFilter"), FilterType.SESSION);
        addPlatformFilter(filters, rules.path("spreadFilter"), FilterType.SPREAD);
        addPlatformFilter(filters, rules.path("volatilityFilter"), FilterType.VOLATILITY);
        addPlatformFilter(filters, rules.path("timeFilter"), FilterType.TIME);
        addPlatformFilter(filters, rules.path("dayFilter"), FilterType.DAY_OF_WEEK);
        addPlatformFilter(filters, rules.path("newsFilter"), FilterType.NEWS);
        addPlatformFilter(filters, rules.path("correlationFilter"), FilterType.CORRELATION);
        return filters;
    }

    private void addPlatformFilter(List<StrategyFilter> filters, JsonNode block, FilterType type) {
        if (!block.isObject() || !block.path("enabled").asBoolean(false)) {
            return;
        }
        Map<String, Object> config = new LinkedHashMap<>(JsonHelper.toMap(block));
        config.remove("enabled");
        filters.add(StrategyFilter.builder().type(type).enabled(true).config(config).build());
    }

    private ExitRules platformExitRules(JsonNode exit) {
        if (!exit.isObject()) {
            return ExitRules.none();
        }
        StopLossRule stopLoss = null;
        JsonNode sl = exit.path("stopLoss");
        if (sl.isObject()) {
            StopLossType type = parseStopLossType(text(sl, "type"));
            double value = type == StopLossType.ATR && sl.has("atrMultiplier")
                    ? sl.path("atrMultiplier").asDouble()
                    : sl.path("value").asDouble(50);
            stopLoss = StopLossRule.builder()
                    .type(type)
                    .value(value)
                    .atrPeriod(sl.path("atrPeriod").asInt(14))
                    .build();
        }
        TakeProfitRule takeProfit = null;
        JsonNode tp = exit.path("takeProfit");
        if (tp.isObject()) {
            TakeProfitType type = parseTakeProfitType(text(tp, "type"));
            double value = type == TakeProfitType.RATIO && tp.has("rrRatio")
                    ? tp.path("rrRatio").asDouble()
                    : tp.path("value").asDouble(100);
            takeProfit = TakeProfitRule.builder().type(type).value(value).build();
        }
        TrailingStopRule trailing = null;
        JsonNode tr = exit.path("trailing");
        if (tr.isObject() && tr.path("enabled").asBoolean(false)) {
            double distance = tr.path("distance").asDouble(30);
            trailing = TrailingStopRule.builder()
                    .enabled(true)
                    .distancePips(distance)
                    .activationPips(tr.path("activation").asDouble(distance))
                    .build();
        }
        PartialExitRule partial = null;
        JsonNode pe = exit.path("partialExits");
        if (pe.isObject() && pe.path("enabled").asBoolean(false)) {
            JsonNode level = pe.path("levels").path(0);
            partial = PartialExitRule.builder()
                    .enabled(true)
                    .atRiskMultiple(level.path("atRR").asDouble(1.0))
                    .closeFraction(level.path("percentage").asDouble(50) / 100.0)
                    .build();
        }
        return ExitRules.builder()
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .trailingStop(trailing)
                .partialExit(partial)
                .build();
    }

    private RiskParameters platformRisk(JsonNode rules) {
        JsonNode risk = rules.path("riskManagement");
        JsonNode dynamic = rules.path("dynamicRisk");
        RiskParameters.RiskParametersBuilder builder = RiskParameters.builder();
        if (risk.has("lotSize")) {
            builder.lotSize(decimal(risk.get("lotSize")));
        }
        if (dynamic.isObject() && dynamic.path("enabled").asBoolean(dynamic.has("riskPercentage"))) {
            builder.riskPercent(dynamic.path("riskPercentage").asDouble(1.0));
            if (dynamic.path("useATRSizing").asBoolean(false)) {
                builder.sizingMethod(SizingMethod.ATR_BASED)
                        .atrMultiplier(dynamic.path("atrMultiplier").asDouble(1.5));
            } else {
                builder.sizingMethod(SizingMethod.PERCENTAGE_RISK);
            }
        }
        return builder.build();
    }

    // ========================
    // EXECUTOR LAYOUT
    // ========================

    private List<StrategyCondition> executorConditions(JsonNode conditions) {
        List<StrategyCondition> result = new ArrayList<>();
        int index = 0;
        for (JsonNode cond : conditions) {
            ConditionOperator operator = ConditionOperator.fromWire(firstText(cond, "operator", "comparison", "condition"))
                    .orElse(null);
            String indicator = text(cond, "indicator");
            if (indicator == null || operator == null) {
                log.warn("Dropping condition {}: indicator={}, operator={}", index, indicator, operator);
                index++;
                continue;
            }
            Map<String, Double> params = new LinkedHashMap<>();
            cond.path("params").fields().forEachRemaining(field -> {
                if (field.getValue().isNumber()) {
                    params.put(field.getKey(), field.getValue().asDouble());
                }
            });
            copyNumber(cond, "period", params);
            String normalized = INDICATOR_ALIASES.getOrDefault(
                    indicator.toUpperCase(Locale.ROOT), indicator.toUpperCase(Locale.ROOT));
            result.add(StrategyCondition.builder()
                    .id(text(cond, "id") != null ? text(cond, "id") : "cond_" + index)
                    .indicator(normalized)
                    .params(params)
                    .operator(operator)
                    .value(comparisonValue(cond.get("value")))
                    .enabled(cond.path("enabled").asBoolean(true))
                    .build());
            index++;
        }
        return result;
    }

    private List<StrategyFilter> executorFilters(JsonNode filters) {
        List<StrategyFilter> result = new ArrayList<>();
        for (JsonNode filter : filters) {
            JsonNode config = filter.has("config") ? filter.get("config") : filter.path("params");
            result.add(StrategyFilter.builder()
                    .type(FilterType.fromWire(text(filter, "type")))
                    .enabled(filter.path("enabled").asBoolean(true))
                    .config(JsonHelper.toMap(config.isObject() ? config : null))
                    .build());
        }
        return result;
    }

    private ExitRules executorExitRules(JsonNode exitRules) {
        if (!exitRules.isObject()) {
            return ExitRules.none();
        }
        return JsonHelper.mapper().convertValue(exitRules, ExitRules.class);
    }

    private RiskParameters executorRisk(JsonNode risk) {
        if (!risk.isObject()) {
            return RiskParameters.defaults();
        }
        return JsonHelper.mapper().convertValue(risk, RiskParameters.class);
    }

    // ========================
    // HELPERS
    // ========================

    private static List<String> symbols(JsonNode node) {
        List<String> symbols = new ArrayList<>();
        JsonNode array = node.path("symbols");
        if (array.isArray()) {
            array.forEach(s -> {
                if (!s.asText().isBlank()) {
                    symbols.add(s.asText().trim().toUpperCase(Locale.ROOT));
                }
            });
        }
        String single = text(node, "symbol");
        if (symbols.isEmpty() && single != null) {
            symbols.add(single.trim().toUpperCase(Locale.ROOT));
        }
        return symbols;
    }

    /** Keeps numbers as text; indicator references are upper-cased ({@code ema_50} becomes {@code EMA_50}). */
    private static String comparisonValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asText();
        }
        String text = value.asText().trim();
        if (text.equalsIgnoreCase("price")) {
            return "price";
        }
        try {
            Double.parseDouble(text);
            return text;
        } catch (NumberFormatException e) {
            return text.toUpperCase(Locale.ROOT);
        }
    }

    private static StrategyStatus parseStatus(String status) {
        return status != null && status.equalsIgnoreCase("paused") ? StrategyStatus.PAUSED : StrategyStatus.ACTIVE;
    }

    private static EntryLogic parseLogic(String logic) {
        return logic != null && logic.equalsIgnoreCase("OR") ? EntryLogic.OR : EntryLogic.AND;
    }

    private static TradeSide parseSide(String side) {
        return TradeSide.fromWire(side).orElse(null);
    }

    private static StopLossType parseStopLossType(String type) {
        if (type == null) {
            return StopLossType.FIXED;
        }
        String normalized = type.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("atr")) {
            return StopLossType.ATR;
        }
        if (normalized.startsWith("percent")) {
            return StopLossType.PERCENT;
        }
        return StopLossType.FIXED;
    }

    private static TakeProfitType parseTakeProfitType(String type) {
        if (type == null) {
            return TakeProfitType.FIXED;
        }
        String normalized = type.toLowerCase(Locale.ROOT);
        if (normalized.contains("ratio") || normalized.equals("rr")) {
            return TakeProfitType.RATIO;
        }
        if (normalized.startsWith("percent")) {
            return TakeProfitType.PERCENT;
        }
        return TakeProfitType.FIXED;
    }

    private static void copyNumber(JsonNode node, String field, Map<String, Double> params) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            params.put(field, value.asDouble());
        }
    }

    private static BigDecimal decimal(JsonNode value) {
        try {
            return new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
