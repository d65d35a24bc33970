package com.tradeexecutor.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Trail the stop {@code distancePips} behind price once profit exceeds {@code activationPips}. */
@Value
@Builder
@Jacksonized
public class TrailingStopRule {

    boolean enabled;
    double activationPips;
    double distancePips;
}
