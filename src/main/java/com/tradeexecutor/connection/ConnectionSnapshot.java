package com.tradeexecutor.connection;

import com.tradeexecutor.domain.enums.ConnectionState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Read-only copy of one supervised connection. */
@Value
@Builder
@Jacksonized
public class ConnectionSnapshot {

    String name;
    ConnectionState state;
    int attempts;
    String lastError;
    Instant lastConnectedAt;
    Instant nextRetryAt;

    /** True once max attempts were reached; only {@code forceReconnect} retries after that. */
    boolean maxAttemptsReached;
}
