package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.EaAttachmentStatus;
import com.tradeexecutor.domain.enums.EntryLogic;
import com.tradeexecutor.domain.enums.StrategyStatus;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.enums.TradeSide;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A strategy the executor is currently running.
 *
 * <p>Instances are immutable snapshots. The strategy registry replaces an entry with a
 * {@link #toBuilder()} copy whenever status or last-signal time changes, so a reference
 * handed to a reader can never change underneath it. The same shape is persisted by the
 * state store and restored after a crash.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ActiveStrategy {

    String id;
    String name;

    @Builder.Default
    List<String> symbols = List.of();

    Timeframe timeframe;

    @Builder.Default
    StrategyStatus status = StrategyStatus.ACTIVE;

    @Builder.Default
    EntryLogic entryLogic = EntryLogic.AND;

    /** Fixed trade direction; null lets the monitor infer it from the conditions. */
    TradeSide side;

    @Builder.Default
    List<StrategyCondition> conditions = List.of();

    @Builder.Default
    List<StrategyFilter> filters = List.of();

    @Builder.Default
    ExitRules exitRules = ExitRules.none();

    @Builder.Default
    RiskParameters riskParameters = RiskParameters.defaults();

    Instant lastSignalAt;

    @Builder.Default
    EaAttachmentStatus eaAttachment = EaAttachmentStatus.UNKNOWN;

    /** First configured symbol; strategies trade one instrument at a time. */
    public String primarySymbol() {
        return symbols.isEmpty() ? null : symbols.get(0);
    }

    public boolean isActive() {
        return status == StrategyStatus.ACTIVE;
    }
}
