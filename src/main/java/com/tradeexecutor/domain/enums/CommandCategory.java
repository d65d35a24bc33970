package com.tradeexecutor.domain.enums;

/** Routing class of a {@link CommandKind}. */
public enum CommandCategory {
    /** Mutates the strategy registry in-process; never touches the terminal. */
    LIFECYCLE,
    /** Opens new exposure; must pass the safety gate and is refused while the kill switch is tripped. */
    OPEN_TRADE,
    /** Reduces or amends existing exposure (close, modify); allowed while the kill switch is tripped. */
    REDUCE_TRADE,
    /** Read-only terminal or executor query. */
    QUERY,
    EMERGENCY
}
