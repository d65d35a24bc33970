package com.tradeexecutor.safety;

/** Removes queued open-trade commands when the kill switch trips. */
public interface OpenTradePurger {

    /** Cancels every queued OPEN_POSITION command and returns how many were removed. */
    int purgeOpenTrades(String reason);
}
