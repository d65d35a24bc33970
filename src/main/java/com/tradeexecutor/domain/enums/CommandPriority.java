package com.tradeexecutor.domain.enums;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dispatch priority. Lower level dequeues first; HIGH and URGENT commands skip the
 * shared queue and are dispatched out-of-band.
 */
@Getter
@RequiredArgsConstructor
public enum CommandPriority {
    URGENT(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int level;

    public boolean isOutOfBand() {
        return this == URGENT || this == HIGH;
    }

    /** Lenient parse; anything unrecognised is NORMAL. */
    public static CommandPriority fromWire(Object value) {
        if (value == null) {
            return NORMAL;
        }
        String text = value.toString().trim().toUpperCase(Locale.ROOT);
        for (CommandPriority priority : values()) {
            if (priority.name().equals(text)) {
                return priority;
            }
        }
        return NORMAL;
    }
}
