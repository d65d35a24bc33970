package com.tradeexecutor.monitor;

import com.tradeexecutor.domain.enums.EaAttachmentStatus;
import com.tradeexecutor.domain.enums.StrategyStatus;
import com.tradeexecutor.domain.model.ActiveStrategy;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The executor's set of active strategies.
 *
 * <p>Single owner of that state: every mutation runs under the write lock and replaces
 * the stored {@link ActiveStrategy} with a new immutable copy. Readers take the read lock
 * and get values or copied lists, never the live map.
 */
@Component
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, ActiveStrategy> strategies = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Adds or replaces a strategy; returns the previous entry if one existed. */
    public Optional<ActiveStrategy> register(ActiveStrategy strategy) {
        lock.writeLock().lock();
        try {
            ActiveStrategy previous = strategies.put(strategy.getId(), strategy);
            log.debug("Registered strategy {} (replaced={})", strategy.getId(), previous != null);
            return Optional.ofNullable(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ActiveStrategy> unregister(String strategyId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(strategies.remove(strategyId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ActiveStrategy> updateStatus(String strategyId, StrategyStatus status) {
        return update(strategyId, s -> s.toBuilder().status(status).build());
    }

    public Optional<ActiveStrategy> recordSignal(String strategyId, Instant signalAt) {
        return update(strategyId, s -> s.toBuilder().lastSignalAt(signalAt).build());
    }

    public Optional<ActiveStrategy> updateEaAttachment(String strategyId, EaAttachmentStatus attachment) {
        return update(strategyId, s -> s.toBuilder().eaAttachment(attachment).build());
    }

    /** Atomically swaps the whole set, as done by reconciliation. */
    public void replaceAll(Collection<ActiveStrategy> replacement) {
        lock.writeLock().lock();
        try {
            strategies.clear();
            for (ActiveStrategy strategy : replacement) {
                strategies.put(strategy.getId(), strategy);
            }
            log.info("Strategy registry replaced with {} strategies", strategies.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ActiveStrategy> get(String strategyId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(strategies.get(strategyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ActiveStrategy> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(strategies.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String strategyId) {
        return get(strategyId).isPresent();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return strategies.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Optional<ActiveStrategy> update(String strategyId, UnaryOperator<ActiveStrategy> change) {
        lock.writeLock().lock();
        try {
            ActiveStrategy current = strategies.get(strategyId);
            if (current == null) {
                return Optional.empty();
            }
            ActiveStrategy updated = change.apply(current);
            strategies.put(strategyId, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
