package com.tradeexecutor.command;

import com.tradeexecutor.domain.model.Command;
import lombok.Builder;
import lombok.Data;

/**
 * Wraps a {@link Command} with ordering metadata for the {@link CommandQueue}.
 *
 * <p>Sorted by priority level first, then by the sequence number assigned at enqueue time,
 * which keeps commands of equal priority in arrival order. {@code enqueuedAt} feeds the
 * queue-latency log line.
 */
@Data
@Builder
public class QueuedCommand {

    private Command command;
    private long sequenceNumber;
    private long enqueuedAt;
}
