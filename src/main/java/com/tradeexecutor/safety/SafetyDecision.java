package com.tradeexecutor.safety;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Outcome of a safety gate evaluation. A denial names the first check that failed. */
@Value
@Builder
public class SafetyDecision {

    private static final SafetyDecision ALLOWED = SafetyDecision.builder().allowed(true).build();

    boolean allowed;
    SafetyCheck failedCheck;
    String reason;

    @Builder.Default
    Map<String, Object> details = Map.of();

    public static SafetyDecision allow() {
        return ALLOWED;
    }

    public static SafetyDecision denied(SafetyCheck check, String reason, Map<String, Object> details) {
        return SafetyDecision.builder()
                .allowed(false)
                .failedCheck(check)
                .reason(reason)
                .details(details != null ? Map.copyOf(details) : Map.of())
                .build();
    }

    public boolean isDenied() {
        return !allowed;
    }
}
