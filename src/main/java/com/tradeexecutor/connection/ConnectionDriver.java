package com.tradeexecutor.connection;

/**
 * Transport-specific connect and close actions driven by the {@link ConnectionSupervisor}.
 *
 * <p>{@link #open()} returning normally means the transport is connected; throwing means the
 * attempt failed and the supervisor schedules a retry.
 */
public interface ConnectionDriver {

    void open() throws Exception;

    void close();
}
