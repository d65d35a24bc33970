package com.tradeexecutor.persistence;

import com.tradeexecutor.config.PersistenceConfig;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed state store, for executors that share a Redis instance with other services.
 *
 * <p>Key schema (prefix from {@code executor.persistence.redis-key-prefix}):
 * <pre>
 *   {prefix}:strategies          hash: strategy id -> strategy JSON
 *   {prefix}:snapshot:{key}      snapshot JSON
 *   {prefix}:snapshots           set of snapshot keys
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "executor.persistence", name = "store", havingValue = "redis")
public class RedisStateStore implements ExecutorStateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStateStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String strategiesKey;
    private final String snapshotPrefix;
    private final String snapshotIndexKey;

    public RedisStateStore(StringRedisTemplate redisTemplate, PersistenceConfig persistenceConfig) {
        this.redisTemplate = redisTemplate;
        String prefix = persistenceConfig.getRedisKeyPrefix();
        this.strategiesKey = prefix + ":strategies";
        this.snapshotPrefix = prefix + ":snapshot:";
        this.snapshotIndexKey = prefix + ":snapshots";
    }

    @Override
    public void saveActiveStrategy(ActiveStrategy strategy) {
        try {
            redisTemplate.opsForHash().put(strategiesKey, strategy.getId(), JsonHelper.toJson(strategy));
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot save strategy " + strategy.getId(), e);
        }
    }

    @Override
    public void removeActiveStrategy(String strategyId) {
        try {
            redisTemplate.opsForHash().delete(strategiesKey, strategyId);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot remove strategy " + strategyId, e);
        }
    }

    @Override
    public List<ActiveStrategy> getActiveStrategies() {
        Map<Object, Object> entries;
        try {
            entries = redisTemplate.opsForHash().entries(strategiesKey);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot read strategies", e);
        }
        List<ActiveStrategy> strategies = new ArrayList<>();
        entries.forEach((id, json) -> {
            try {
                ActiveStrategy strategy = JsonHelper.fromJson(json.toString(), ActiveStrategy.class);
                if (strategy != null) {
                    strategies.add(strategy);
                }
            } catch (IllegalStateException e) {
                log.warn("Skipping unreadable strategy {}: {}", id, e.getMessage());
            }
        });
        return strategies;
    }

    @Override
    public void clearActiveStrategies() {
        try {
            redisTemplate.delete(strategiesKey);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot clear strategies", e);
        }
    }

    @Override
    public void saveSnapshot(String key, Object value) {
        try {
            redisTemplate.opsForValue().set(snapshotPrefix + key, JsonHelper.toJson(value));
            redisTemplate.opsForSet().add(snapshotIndexKey, key);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot save snapshot " + key, e);
        }
    }

    @Override
    public <T> Optional<T> loadSnapshot(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(snapshotPrefix + key);
            return Optional.ofNullable(JsonHelper.fromJson(json, type));
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot load snapshot " + key, e);
        }
    }

    @Override
    public List<String> listSnapshotKeys(String prefix) {
        Set<String> keys;
        try {
            keys = redisTemplate.opsForSet().members(snapshotIndexKey);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot list snapshots", e);
        }
        if (keys == null) {
            return List.of();
        }
        return keys.stream().filter(key -> key.startsWith(prefix)).sorted().toList();
    }

    @Override
    public void deleteSnapshot(String key) {
        try {
            redisTemplate.delete(snapshotPrefix + key);
            redisTemplate.opsForSet().remove(snapshotIndexKey, key);
        } catch (DataAccessException e) {
            throw new StateStoreException("Cannot delete snapshot " + key, e);
        }
    }
}
