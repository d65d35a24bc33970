package com.tradeexecutor.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.ReconcilerConfig;
import com.tradeexecutor.exception.StateStoreException;
import com.tradeexecutor.mapper.JsonHelper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * File that exists while the executor runs. Written at startup, removed by a clean shutdown;
 * finding it at the next startup means the previous run crashed.
 */
@Component
public class CrashMarker {

    private static final Logger log = LoggerFactory.getLogger(CrashMarker.class);

    private final Path path;
    private final ExecutorProperties executorProperties;
    private final Clock clock;

    public CrashMarker(ReconcilerConfig reconcilerConfig, ExecutorProperties executorProperties, Clock clock) {
        this.path = Path.of(reconcilerConfig.getCrashMarkerPath());
        this.executorProperties = executorProperties;
        this.clock = clock;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /** Records this process as running. */
    public void write() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("pid", ProcessHandle.current().pid());
        content.put("executorId", executorProperties.getId());
        content.put("startedAt", clock.instant().toString());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, JsonHelper.toJson(content), StandardCharsets.UTF_8);
            log.debug("Crash marker written to {}", path);
        } catch (IOException e) {
            throw new StateStoreException("Cannot write crash marker " + path, e);
        }
    }

    /** Contents of a marker left by a previous run, if readable. */
    public Optional<Map<String, Object>> read() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonHelper.toMap(JsonHelper.readTree(Files.readString(path, StandardCharsets.UTF_8))));
        } catch (JsonProcessingException e) {
            log.warn("Crash marker {} is not valid JSON: {}", path, e.getOriginalMessage());
            return Optional.of(Map.of());
        } catch (IOException e) {
            throw new StateStoreException("Cannot read crash marker " + path, e);
        }
    }

    public void clear() {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Crash marker cleared");
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot delete crash marker " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
