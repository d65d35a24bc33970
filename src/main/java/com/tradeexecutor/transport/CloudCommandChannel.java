package com.tradeexecutor.transport;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Pub/sub channel to the cloud control plane.
 *
 * <p>Inbound events are {@code command-received}, {@code command-cancel} and
 * {@code emergency-stop}. Outbound events are command results.
 */
public interface CloudCommandChannel {

    String EVENT_COMMAND_RECEIVED = "command-received";
    String EVENT_COMMAND_CANCEL = "command-cancel";
    String EVENT_EMERGENCY_STOP = "emergency-stop";
    String EVENT_COMMAND_RESULT = "client-command-result";

    void connect();

    void disconnect();

    boolean isConnected();

    /** False for the no-op channel, which the supervisor then does not register. */
    default boolean isEnabled() {
        return true;
    }

    void send(String event, Map<String, Object> payload);

    void onMessage(CloudMessageListener listener);

    void onConnectionLost(Consumer<String> listener);
}
