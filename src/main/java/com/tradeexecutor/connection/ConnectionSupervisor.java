package com.tradeexecutor.connection;

import com.tradeexecutor.config.ConnectionConfig;
import com.tradeexecutor.domain.enums.ConnectionState;
import com.tradeexecutor.event.ConnectionEventType;
import com.tradeexecutor.event.EventPublisherHelper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle state of every named transport connection.
 *
 * <p>Each connection moves DISCONNECTED -> CONNECTING -> CONNECTED, and on failure
 * CONNECTED -> ERROR -> CONNECTING (after backoff) -> CONNECTED. Transitions for one name are
 * serialized by that connection's lock; different names never block each other.
 *
 * <p>Drivers report outcomes back through {@link #reportConnected}, {@link #reportDisconnected}
 * and {@link #reportError}. A failed attempt schedules a retry on the connection scheduler
 * using {@link BackoffPolicy}. At {@code struggling-threshold} attempts a STRUGGLING alert is
 * published; at {@code max-attempts} MAX_ATTEMPTS_REACHED is published and no further retry
 * is scheduled until {@link #forceReconnect(String)}.
 *
 * <p>A connection registered without a driver (the platform API) is only moved by reports.
 */
@Service
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final ConnectionConfig connectionConfig;
    private final BackoffPolicy backoffPolicy;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler connectionScheduler;
    private final Clock clock;

    private final Map<String, ManagedConnection> connections = new ConcurrentHashMap<>();

    public ConnectionSupervisor(
            ConnectionConfig connectionConfig,
            BackoffPolicy backoffPolicy,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("connectionScheduler") TaskScheduler connectionScheduler,
            Clock clock) {
        this.connectionConfig = connectionConfig;
        this.backoffPolicy = backoffPolicy;
        this.eventPublisherHelper = eventPublisherHelper;
        this.connectionScheduler = connectionScheduler;
        this.clock = clock;
    }

    // ========================
    // REGISTRATION
    // ========================

    /** Registers (or re-binds) the driver used to open and close {@code name}. */
    public void register(String name, ConnectionDriver driver) {
        connections.computeIfAbsent(name, ManagedConnection::new).driver = driver;
    }

    public void onStatusChange(String name, ConnectionStatusListener listener) {
        connections.computeIfAbsent(name, ManagedConnection::new).listeners.add(listener);
    }

    // ========================
    // COMMANDS
    // ========================

    /** DISCONNECTED/ERROR -> CONNECTING, then runs the driver's open action on the calling thread. */
    public void connect(String name) {
        ManagedConnection connection = connections.computeIfAbsent(name, ManagedConnection::new);
        connection.lock.lock();
        try {
            if (connection.state == ConnectionState.CONNECTED || connection.state == ConnectionState.CONNECTING) {
                log.debug("Connection {} already {}", name, connection.state);
                return;
            }
            connection.autoReconnect = true;
            connection.cancelRetry();
            transition(connection, ConnectionState.CONNECTING);
        } finally {
            connection.lock.unlock();
        }
        openDriver(connection);
    }

    /** Moves to DISCONNECTED, cancels any pending retry and stops reconnecting. */
    public void disconnect(String name) {
        ManagedConnection connection = connections.get(name);
        if (connection == null) {
            return;
        }
        connection.lock.lock();
        try {
            connection.autoReconnect = false;
            connection.cancelRetry();
            if (connection.state != ConnectionState.DISCONNECTED) {
                transition(connection, ConnectionState.DISCONNECTED);
            }
        } finally {
            connection.lock.unlock();
        }
        closeDriver(connection);
        log.info("Connection {} disconnected", name);
    }

    public void disconnectAll() {
        new ArrayList<>(connections.keySet()).forEach(this::disconnect);
    }

    /** Resets attempts and reconnects immediately, also after max attempts were reached. */
    public void forceReconnect(String name) {
        ManagedConnection connection = connections.computeIfAbsent(name, ManagedConnection::new);
        connection.lock.lock();
        try {
            connection.cancelRetry();
            connection.attempts = 0;
            connection.exhausted = false;
            connection.autoReconnect = true;
            if (connection.state == ConnectionState.CONNECTED) {
                closeDriver(connection);
            }
            transition(connection, ConnectionState.CONNECTING);
        } finally {
            connection.lock.unlock();
        }
        log.info("Forced reconnect of {}", name);
        openDriver(connection);
    }

    // ========================
    // DRIVER REPORTS
    // ========================

    public void reportConnected(String name) {
        ManagedConnection connection = connections.computeIfAbsent(name, ManagedConnection::new);
        connection.lock.lock();
        try {
            if (connection.state == ConnectionState.CONNECTED) {
                return;
            }
            if (connection.state == ConnectionState.DISCONNECTED && !connection.autoReconnect && connection.driver != null) {
                log.debug("Ignoring late connect report for {} after explicit disconnect", name);
                return;
            }
            connection.attempts = 0;
            connection.exhausted = false;
            connection.lastError = null;
            connection.nextRetryAt = null;
            connection.lastConnectedAt = clock.instant();
            connection.cancelRetry();
            transition(connection, ConnectionState.CONNECTED);
        } finally {
            connection.lock.unlock();
        }
        log.info("Connection {} established", name);
    }

    /** An unexpected loss of an established connection is handled like an error. */
    public void reportDisconnected(String name, String reason) {
        reportError(name, reason != null ? reason : "connection lost");
    }

    public void reportError(String name, String error) {
        ManagedConnection connection = connections.computeIfAbsent(name, ManagedConnection::new);
        connection.lock.lock();
        try {
            if (connection.state == ConnectionState.DISCONNECTED && !connection.autoReconnect && connection.driver != null) {
                log.debug("Ignoring error for explicitly disconnected {}: {}", name, error);
                return;
            }
            if (connection.exhausted) {
                connection.lastError = error;
                return;
            }
            connection.attempts++;
            connection.lastError = error;
            transition(connection, ConnectionState.ERROR);

            int attempts = connection.attempts;
            if (attempts == connectionConfig.getStrugglingThreshold()) {
                log.warn("Connection {} struggling after {} attempts: {}", name, attempts, error);
                eventPublisherHelper.publishConnectionAlert(
                        this, name, ConnectionEventType.STRUGGLING, connection.state, attempts, error);
            }

            if (attempts >= connectionConfig.getMaxAttempts()) {
                connection.exhausted = true;
                connection.nextRetryAt = null;
                log.error("Connection {} gave up after {} attempts: {}", name, attempts, error);
                eventPublisherHelper.publishConnectionAlert(
                        this, name, ConnectionEventType.MAX_ATTEMPTS_REACHED, connection.state, attempts, error);
                notifyListeners(connection);
                return;
            }

            if (connection.autoReconnect) {
                scheduleRetry(connection);
            } else {
                log.warn("Connection {} failed: {}", name, error);
            }
        } finally {
            connection.lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public ConnectionSnapshot getSnapshot(String name) {
        ManagedConnection connection = connections.get(name);
        if (connection == null) {
            return null;
        }
        connection.lock.lock();
        try {
            return connection.snapshot();
        } finally {
            connection.lock.unlock();
        }
    }

    public List<ConnectionSnapshot> getAllSnapshots() {
        List<ConnectionSnapshot> snapshots = new ArrayList<>();
        connections.keySet().stream().sorted().forEach(name -> {
            ConnectionSnapshot snapshot = getSnapshot(name);
            if (snapshot != null) {
                snapshots.add(snapshot);
            }
        });
        return snapshots;
    }

    public ConnectionHealth getHealth() {
        return ConnectionHealth.of(getAllSnapshots());
    }

    public boolean isConnected(String name) {
        ConnectionSnapshot snapshot = getSnapshot(name);
        return snapshot != null && snapshot.getState() == ConnectionState.CONNECTED;
    }

    // ========================
    // INTERNALS
    // ========================

    private void scheduleRetry(ManagedConnection connection) {
        Duration delay = backoffPolicy.delayFor(connection.attempts);
        Instant retryAt = clock.instant().plus(delay);
        connection.nextRetryAt = retryAt;
        connection.cancelRetry();
        connection.retryFuture = connectionScheduler.schedule(() -> retry(connection.name), retryAt);
        log.warn(
                "Connection {} failed (attempt {}/{}), retrying in {} ms: {}",
                connection.name,
                connection.attempts,
                connectionConfig.getMaxAttempts(),
                delay.toMillis(),
                connection.lastError);
        notifyListeners(connection);
    }

    private void retry(String name) {
        ManagedConnection connection = connections.get(name);
        if (connection == null) {
            return;
        }
        connection.lock.lock();
        try {
            connection.retryFuture = null;
            if (!connection.autoReconnect || connection.exhausted || connection.state == ConnectionState.CONNECTED) {
                return;
            }
            connection.nextRetryAt = null;
            transition(connection, ConnectionState.CONNECTING);
        } finally {
            connection.lock.unlock();
        }
        openDriver(connection);
    }

    private void openDriver(ManagedConnection connection) {
        ConnectionDriver driver = connection.driver;
        if (driver == null) {
            return;
        }
        try {
            driver.open();
            reportConnected(connection.name);
        } catch (Exception e) {
            reportError(connection.name, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void closeDriver(ManagedConnection connection) {
        ConnectionDriver driver = connection.driver;
        if (driver == null) {
            return;
        }
        try {
            driver.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection {}: {}", connection.name, e.getMessage());
        }
    }

    private void transition(ManagedConnection connection, ConnectionState next) {
        ConnectionState previous = connection.state;
        connection.state = next;
        log.debug("Connection {}: {} -> {}", connection.name, previous, next);
        eventPublisherHelper.publishConnectionStatus(
                this, connection.name, previous, next, connection.attempts, connection.lastError);
        notifyListeners(connection);
    }

    private void notifyListeners(ManagedConnection connection) {
        ConnectionSnapshot snapshot = connection.snapshot();
        for (ConnectionStatusListener listener : connection.listeners) {
            try {
                listener.onStatusChange(snapshot);
            } catch (RuntimeException e) {
                log.warn("Connection listener for {} failed: {}", connection.name, e.getMessage());
            }
        }
    }

    private static final class ManagedConnection {

        private final String name;
        private final ReentrantLock lock = new ReentrantLock();
        private final List<ConnectionStatusListener> listeners = new CopyOnWriteArrayList<>();

        private volatile ConnectionDriver driver;
        private ConnectionState state = ConnectionState.DISCONNECTED;
        private int attempts;
        private String lastError;
        private Instant lastConnectedAt;
        private Instant nextRetryAt;
        private ScheduledFuture<?> retryFuture;
        private boolean autoReconnect = true;
        private boolean exhausted;

        private ManagedConnection(String name) {
            this.name = name;
        }

        private void cancelRetry() {
            if (retryFuture != null) {
                retryFuture.cancel(false);
                retryFuture = null;
            }
        }

        private ConnectionSnapshot snapshot() {
            return ConnectionSnapshot.builder()
                    .name(name)
                    .state(state)
                    .attempts(attempts)
                    .lastError(lastError)
                    .lastConnectedAt(lastConnectedAt)
                    .nextRetryAt(nextRetryAt)
                    .maxAttemptsReached(exhausted)
                    .build();
        }
    }
}
