package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class OpenPosition {

    String ticket;
    String symbol;
    TradeSide side;
    BigDecimal volume;
    BigDecimal openPrice;
    BigDecimal currentPrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal profit;
    String strategyId;
    Instant openedAt;

    public boolean isProfitable() {
        return profit != null && profit.signum() > 0;
    }

    public boolean isLosing() {
        return profit != null && profit.signum() < 0;
    }
}
