package com.tradeexecutor.orchestrator;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** One structured line of the in-memory activity log. */
@Value
@Builder
public class ActivityEntry {

    Instant timestamp;

    /** Emitting area: CONNECTION, COMMAND, STRATEGY, SIGNAL, SAFETY or SYSTEM. */
    String category;

    String type;
    String level;
    String message;

    @Builder.Default
    Map<String, Object> details = Map.of();
}
