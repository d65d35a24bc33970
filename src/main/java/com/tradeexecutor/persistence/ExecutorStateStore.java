package com.tradeexecutor.persistence;

import com.tradeexecutor.domain.model.ActiveStrategy;
import java.util.List;
import java.util.Optional;

/**
 * Local key-value persistence for the executor's durable state: the set of active strategies
 * (one entry per strategy id) and named snapshots.
 *
 * <p>Implementations throw {@link com.tradeexecutor.exception.StateStoreException} when the
 * backing store cannot be read or written.
 */
public interface ExecutorStateStore {

    void saveActiveStrategy(ActiveStrategy strategy);

    void removeActiveStrategy(String strategyId);

    List<ActiveStrategy> getActiveStrategies();

    void clearActiveStrategies();

    void saveSnapshot(String key, Object value);

    <T> Optional<T> loadSnapshot(String key, Class<T> type);

    /** Snapshot keys starting with {@code prefix}, in ascending lexical order. */
    List<String> listSnapshotKeys(String prefix);

    void deleteSnapshot(String key);
}
