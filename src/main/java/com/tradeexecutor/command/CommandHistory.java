package com.tradeexecutor.command;

import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.model.CommandResult;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Bounded record of finished commands.
 *
 * <p>{@link #claim} is the exactly-once gate for acceptance: an id is claimed when it is
 * submitted and released when its result is recorded. {@link #complete} is the
 * exactly-once gate for completion reporting: only the first result recorded for an id is
 * accepted. Evicted entries lose that protection, so the size
 * should comfortably exceed the number of commands that can be in the system at once.
 */
@Component
public class CommandHistory {

    private final int maxSize;
    private final Map<String, CommandResult> results = new LinkedHashMap<>();
    private final Set<String> claimed = new LinkedHashSet<>();

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();

    public CommandHistory(CommandConfig commandConfig) {
        this.maxSize = Math.max(1, commandConfig.getHistorySize());
    }

    /**
     * Atomically accepts a command id for processing.
     *
     * @return false if the id is already claimed or already has a result
     */
    public synchronized boolean claim(String commandId) {
        if (results.containsKey(commandId) || !claimed.add(commandId)) {
            return false;
        }
        if (claimed.size() > maxSize) {
            Iterator<String> oldest = claimed.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    /**
     * Records the result unless one already exists for the same command id.
     *
     * @return true if this call recorded it and the caller should report it
     */
    public synchronized boolean complete(CommandResult result) {
        if (results.containsKey(result.getCommandId())) {
            return false;
        }
        results.put(result.getCommandId(), result);
        claimed.remove(result.getCommandId());
        if (results.size() > maxSize) {
            Iterator<String> oldest = results.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        switch (result.getStatus()) {
            case COMPLETED -> completed.incrementAndGet();
            case CANCELLED -> cancelled.incrementAndGet();
            default -> failed.incrementAndGet();
        }
        return true;
    }

    public synchronized Optional<CommandResult> get(String commandId) {
        return Optional.ofNullable(results.get(commandId));
    }

    public synchronized boolean contains(String commandId) {
        return results.containsKey(commandId);
    }

    public Optional<CommandStatus> status(String commandId) {
        return get(commandId).map(CommandResult::getStatus);
    }

    public synchronized int size() {
        return results.size();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getCancelledCount() {
        return cancelled.get();
    }
}
