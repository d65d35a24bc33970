package com.tradeexecutor.persistence;

import com.tradeexecutor.config.PersistenceConfig;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.mapper.JsonHelper;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * JSON-file state store. Layout under the configured directory:
 * <pre>
 *   strategies/{id}.json   one file per active strategy
 *   snapshots/{key}.json   named snapshots
 * </pre>
 * File names are URL-encoded keys. Writes go to a temp file first and are moved into place,
 * so a crash mid-write never leaves a truncated entry.
 */
@Component
@ConditionalOnProperty(prefix = "executor.persistence", name = "store", havingValue = "file", matchIfMissing = true)
public class FileStateStore implements ExecutorStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private static final String SUFFIX = ".json";

    private final Path strategiesDir;
    private final Path snapshotsDir;

    @Autowired
    public FileStateStore(PersistenceConfig persistenceConfig) {
        this(Path.of(persistenceConfig.getDirectory()));
    }

    public FileStateStore(Path baseDirectory) {
        this.strategiesDir = baseDirectory.resolve("strategies");
        this.snapshotsDir = baseDirectory.resolve("snapshots");
        try {
            Files.createDirectories(strategiesDir);
            Files.createDirectories(snapshotsDir);
        } catch (IOException e) {
            throw new StateStoreException("Cannot create state directory " + baseDirectory, e);
        }
        log.info("File state store at {}", baseDirectory.toAbsolutePath());
    }

    // ========================
    // STRATEGIES
    // ========================

    @Override
    public void saveActiveStrategy(ActiveStrategy strategy) {
        write(strategiesDir.resolve(fileName(strategy.getId())), JsonHelper.toJson(strategy));
    }

    @Override
    public void removeActiveStrategy(String strategyId) {
        delete(strategiesDir.resolve(fileName(strategyId)));
    }

    @Override
    public List<ActiveStrategy> getActiveStrategies() {
        List<ActiveStrategy> strategies = new ArrayList<>();
        for (Path file : list(strategiesDir)) {
            try {
                ActiveStrategy strategy = JsonHelper.fromJson(Files.readString(file), ActiveStrategy.class);
                if (strategy != null) {
                    strategies.add(strategy);
                }
            } catch (IOException e) {
                throw new StateStoreException("Cannot read " + file, e);
            } catch (IllegalStateException e) {
                log.warn("Skipping unreadable strategy file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return strategies;
    }

    @Override
    public void clearActiveStrategies() {
        list(strategiesDir).forEach(this::delete);
    }

    // ========================
    // SNAPSHOTS
    // ========================

    @Override
    public void saveSnapshot(String key, Object value) {
        write(snapshotsDir.resolve(fileName(key)), JsonHelper.toJson(value));
    }

    @Override
    public <T> Optional<T> loadSnapshot(String key, Class<T> type) {
        Path file = snapshotsDir.resolve(fileName(key));
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(JsonHelper.fromJson(Files.readString(file), type));
        } catch (IOException e) {
            throw new StateStoreException("Cannot read snapshot " + key, e);
        }
    }

    @Override
    public List<String> listSnapshotKeys(String prefix) {
        return list(snapshotsDir).stream()
                .map(FileStateStore::keyOf)
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .toList();
    }

    @Override
    public void deleteSnapshot(String key) {
        delete(snapshotsDir.resolve(fileName(key)));
    }

    // ========================
    // FILE HELPERS
    // ========================

    private void write(Path target, String json) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot write " + target, e);
        }
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StateStoreException("Cannot delete " + file, e);
        }
    }

    private List<Path> list(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.comparing(Path::getFileName))
                    .toList();
        } catch (IOException e) {
            throw new StateStoreException("Cannot list " + directory, e);
        }
    }

    private static String fileName(String key) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX;
    }

    private static String keyOf(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
    }
}
