package com.tradeexecutor.transport;

import com.tradeexecutor.exception.TransportException;
import java.util.function.Consumer;

/**
 * Request/reply link to the trading terminal.
 *
 * <p>Implementations throw {@link TransportException} for connection faults and timeouts;
 * the command dispatcher retries those. A {@link TerminalResponse} with
 * {@code success=false} is final.
 */
public interface TerminalTransport {

    void connect();

    void disconnect();

    boolean isConnected();

    TerminalResponse request(TerminalRequest request);

    /** Registers a callback invoked with a reason when the link drops unexpectedly. */
    void onConnectionLost(Consumer<String> listener);
}
