package com.tradeexecutor.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Exit configuration of a strategy. Stop-loss and take-profit are resolved to prices once,
 * when a signal is created; trailing and partial exits are applied later against live
 * positions. Any rule may be null.
 */
@Value
@Builder
@Jacksonized
public class ExitRules {

    StopLossRule stopLoss;
    TakeProfitRule takeProfit;
    TrailingStopRule trailingStop;
    PartialExitRule partialExit;

    public static ExitRules none() {
        return ExitRules.builder().build();
    }

    public boolean hasRuntimeManagement() {
        return (trailingStop != null && trailingStop.isEnabled()) || (partialExit != null && partialExit.isEnabled());
    }
}
