package com.tradeexecutor.domain.enums;

/** How a strategy's entry condition results combine: all true, or at least one true. */
public enum EntryLogic {
    AND,
    OR
}
