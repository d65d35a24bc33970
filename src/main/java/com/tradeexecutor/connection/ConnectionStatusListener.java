package com.tradeexecutor.connection;

@FunctionalInterface
public interface ConnectionStatusListener {

    void onStatusChange(ConnectionSnapshot snapshot);
}
