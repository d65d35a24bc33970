package com.tradeexecutor.domain.enums;

/**
 * Recorded state of the operator's manual expert-advisor attachment in the terminal.
 * The executor cannot attach the advisor itself; it only reports what was last recorded.
 */
public enum EaAttachmentStatus {
    UNKNOWN,
    ATTACHED_RECORDED,
    NEEDS_MANUAL_ATTACH
}
