package com.tradeexecutor.transport.simulator;

import com.tradeexecutor.domain.enums.TradeSide;
import java.time.Instant;
import lombok.Data;

/** Open position held by the simulated terminal. */
@Data
class SimulatedPosition {

    private final long ticket;
    private final String symbol;
    private final TradeSide side;
    private double volume;
    private final double openPrice;
    private double stopLoss;
    private double takeProfit;
    private final String comment;
    private final String magic;
    private final Instant openTime;
}
