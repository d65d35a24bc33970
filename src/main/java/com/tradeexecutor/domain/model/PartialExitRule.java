package com.tradeexecutor.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Close {@code closeFraction} of a position once profit reaches {@code atRiskMultiple} times the initial risk. */
@Value
@Builder
@Jacksonized
public class PartialExitRule {

    boolean enabled;
    double atRiskMultiple;
    double closeFraction;
}
