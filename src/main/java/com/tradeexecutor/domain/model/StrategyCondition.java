package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.ConditionOperator;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry condition: {@code indicator(params) operator value}.
 *
 * <p>{@code value} is kept in its textual form: a number ({@code "30"}), the literal
 * {@code "price"}, or another indicator reference such as {@code "EMA_50"}.
 */
@Value
@Builder
@Jacksonized
public class StrategyCondition {

    String id;
    String indicator;

    @Builder.Default
    Map<String, Double> params = Map.of();

    ConditionOperator operator;
    String value;

    @Builder.Default
    boolean enabled = true;

    public int period(int defaultPeriod) {
        Double period = params.get("period");
        return period != null ? period.intValue() : defaultPeriod;
    }
}
