package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** One-shot trade recommendation produced by a strategy tick. Never persisted. */
@Value
@Builder
public class Signal {

    String id;
    String strategyId;
    String symbol;
    TradeSide direction;
    BigDecimal entryPrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal volume;
    int confidence;
    List<String> reasons;
    Instant createdAt;

    /** Id of the OPEN_POSITION command submitted for this signal. */
    public String commandId() {
        return "cmd_" + id;
    }
}
