package com.tradeexecutor.transport;

/** Request verbs understood by the terminal-side bridge. */
public enum TerminalAction {
    PING,
    OPEN_TRADE,
    CLOSE_TRADE,
    MODIFY_TRADE,
    GET_POSITIONS,
    GET_ACCOUNT_INFO,
    GET_SYMBOL_INFO,
    GET_BARS,
    GET_QUOTE
}
