package com.tradeexecutor.transport;

/** Receives inbound control-plane messages; {@code data} is the raw JSON payload. */
@FunctionalInterface
public interface CloudMessageListener {

    void onMessage(String event, String data);
}
