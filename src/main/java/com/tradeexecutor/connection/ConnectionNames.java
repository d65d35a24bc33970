package com.tradeexecutor.connection;

/** Names of the connections registered with the {@link ConnectionSupervisor}. */
public final class ConnectionNames {

    public static final String CLOUD_CHANNEL = "cloud-channel";
    public static final String TERMINAL = "terminal";
    public static final String PLATFORM_API = "platform-api";

    private ConnectionNames() {}
}
