package com.tradeexecutor.transport;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One request to the terminal. Trade requests carry
 * {@code {symbol, type, volume, price, stopLoss, takeProfit, comment, magic, slippage}}.
 */
@Value
@Builder
public class TerminalRequest {

    TerminalAction action;

    @Builder.Default
    Map<String, Object> params = Map.of();

    public static TerminalRequest of(TerminalAction action) {
        return TerminalRequest.builder().action(action).build();
    }

    public static TerminalRequest of(TerminalAction action, Map<String, Object> params) {
        return TerminalRequest.builder().action(action).params(params).build();
    }
}
