package com.tradeexecutor.recovery;

import com.tradeexecutor.command.QueueStats;
import com.tradeexecutor.connection.ConnectionSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.safety.KillSwitchStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Hourly picture of executor state, kept for post-crash diagnosis. */
@Value
@Builder
@Jacksonized
public class ExecutionSnapshot {

    Instant takenAt;

    @Builder.Default
    List<ActiveStrategy> strategies = List.of();

    KillSwitchStatus killSwitch;

    @Builder.Default
    List<ConnectionSnapshot> connections = List.of();

    QueueStats queueStats;
}
