package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** The trade a strategy or command wants to open, as seen by the safety gate. */
@Value
@Builder
public class ProposedTrade {

    String strategyId;
    String symbol;
    TradeSide side;
    BigDecimal volume;
}
