package com.tradeexecutor.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Body of a manual kill-switch trip. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitchRequest {

    @NotBlank(message = "Reason is required")
    private String reason;

    /** Also submit an urgent close of every open position. */
    private boolean closePositions;
}
