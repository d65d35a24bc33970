package com.tradeexecutor.domain.enums;

/**
 * Lifecycle of one supervised transport connection.
 *
 * <p>Legal transitions: DISCONNECTED -> CONNECTING -> CONNECTED, CONNECTED -> ERROR ->
 * CONNECTING -> CONNECTED, and any state -> DISCONNECTED on an explicit disconnect.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
