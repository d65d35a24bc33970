package com.tradeexecutor.safety;

/** Stops every running strategy monitor when the kill switch trips. */
public interface MonitorHalter {

    /** Returns the number of monitors stopped. */
    int stopAll();
}
