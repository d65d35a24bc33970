package com.tradeexecutor.connection;

import com.tradeexecutor.domain.enums.ConnectionState;
import java.util.Collection;
import lombok.Builder;
import lombok.Value;

/** Aggregate view over every supervised connection. */
@Value
@Builder
public class ConnectionHealth {

    int total;
    int connected;
    int disconnected;
    int reconnecting;
    int errors;
    boolean healthy;

    public static ConnectionHealth of(Collection<ConnectionSnapshot> snapshots) {
        int connected = count(snapshots, ConnectionState.CONNECTED);
        return ConnectionHealth.builder()
                .total(snapshots.size())
                .connected(connected)
                .disconnected(count(snapshots, ConnectionState.DISCONNECTED))
                .reconnecting(count(snapshots, ConnectionState.CONNECTING))
                .errors(count(snapshots, ConnectionState.ERROR))
                .healthy(!snapshots.isEmpty() && connected == snapshots.size())
                .build();
    }

    private static int count(Collection<ConnectionSnapshot> snapshots, ConnectionState state) {
        return (int) snapshots.stream().filter(s -> s.getState() == state).count();
    }
}
