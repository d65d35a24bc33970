package com.tradeexecutor.safety;

import com.tradeexecutor.domain.enums.KillSwitchState;
import com.tradeexecutor.domain.enums.TripInitiator;
import com.tradeexecutor.event.Severity;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class KillSwitchStatus {

    @Builder.Default
    KillSwitchState state = KillSwitchState.IDLE;

    String reason;
    TripInitiator initiator;
    Severity severity;
    Instant trippedAt;
    Instant resetAt;
    String resetBy;
    int tripCount;

    public static KillSwitchStatus idle() {
        return KillSwitchStatus.builder().build();
    }

    public boolean isTripped() {
        return state == KillSwitchState.TRIPPED;
    }
}
