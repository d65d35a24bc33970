package com.tradeexecutor.command;

import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.model.Command;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded priority queue feeding the {@link CommandDispatcher}.
 *
 * <p>Two-level ordering:
 * <ol>
 *   <li>Priority level (lower first): URGENT(0) before LOW(3)</li>
 *   <li>Sequence number: FIFO within the same priority</li>
 * </ol>
 *
 * <p>{@link PriorityBlockingQueue} is unbounded, so the capacity check and the insert run
 * under the queue's own monitor; {@link #offer} refuses once {@code queueCapacity} is reached.
 */
@Component
public class CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private final int capacity;

    /** Monotonically increasing counter for FIFO ordering within the same priority. */
    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final PriorityBlockingQueue<QueuedCommand> queue = new PriorityBlockingQueue<>(
            INITIAL_CAPACITY,
            Comparator.<QueuedCommand>comparingInt(q -> q.getCommand().getPriority().getLevel())
                    .thenComparingLong(QueuedCommand::getSequenceNumber));

    public CommandQueue(CommandConfig commandConfig) {
        this.capacity = commandConfig.getQueueCapacity();
    }

    /**
     * Enqueues a command.
     *
     * @return false when the queue is at capacity; the command is not added
     */
    public boolean offer(Command command) {
        synchronized (queue) {
            if (queue.size() >= capacity) {
                log.warn("Command queue full ({}), rejecting {}", capacity, command.getId());
                return false;
            }
            queue.put(QueuedCommand.builder()
                    .command(command)
                    .sequenceNumber(sequenceCounter.incrementAndGet())
                    .enqueuedAt(System.currentTimeMillis())
                    .build());
        }
        log.debug("Command enqueued: id={}, kind={}, priority={}, queueSize={}",
                command.getId(), command.getKind(), command.getPriority(), queue.size());
        return true;
    }

    /** Blocks until a command is available, then removes and returns the highest-priority one. */
    public QueuedCommand take() throws InterruptedException {
        return queue.take();
    }

    /** Non-blocking variant used by the shutdown drain. */
    public QueuedCommand poll() {
        return queue.poll();
    }

    public boolean contains(String commandId) {
        return queue.stream().anyMatch(q -> q.getCommand().getId().equals(commandId));
    }

    /** Removes a queued command by id, returning it if it was still waiting. */
    public Command remove(String commandId) {
        synchronized (queue) {
            for (QueuedCommand queued : queue) {
                if (queued.getCommand().getId().equals(commandId) && queue.remove(queued)) {
                    return queued.getCommand();
                }
            }
        }
        return null;
    }

    /** Removes every queued command matching {@code filter} and returns them. */
    public List<Command> removeIf(Predicate<Command> filter) {
        List<Command> removed = new ArrayList<>();
        synchronized (queue) {
            for (QueuedCommand queued : queue) {
                if (filter.test(queued.getCommand()) && queue.remove(queued)) {
                    removed.add(queued.getCommand());
                }
            }
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} commands from the queue", removed.size());
        }
        return removed;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }
}
