package com.tradeexecutor.recovery;

import com.tradeexecutor.domain.enums.ReconciliationSource;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of startup reconciliation: where the strategy set came from and what it holds. */
@Value
@Builder
public class ReconciliationResult {

    ReconciliationSource source;

    @Builder.Default
    List<String> strategyIds = List.of();

    /** Control-plane fetch attempts made; zero when the platform is not configured. */
    int attempts;

    boolean crashRecovered;

    long durationMs;

    public int getStrategyCount() {
        return strategyIds.size();
    }
}
