package com.tradeexecutor.domain.enums;

import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Canonical command kinds accepted from the control plane.
 *
 * <p>Wire names are matched case-insensitively and may use dashes instead of underscores
 * ({@code close-position} and {@code CLOSE_POSITION} are the same kind).
 */
@Getter
@RequiredArgsConstructor
public enum CommandKind {
    START_STRATEGY(CommandCategory.LIFECYCLE),
    STOP_STRATEGY(CommandCategory.LIFECYCLE),
    PAUSE_STRATEGY(CommandCategory.LIFECYCLE),
    RESUME_STRATEGY(CommandCategory.LIFECYCLE),
    UPDATE_STRATEGY(CommandCategory.LIFECYCLE),

    OPEN_POSITION(CommandCategory.OPEN_TRADE),

    CLOSE_POSITION(CommandCategory.REDUCE_TRADE),
    CLOSE_ALL_POSITIONS(CommandCategory.REDUCE_TRADE),
    MODIFY_POSITION(CommandCategory.REDUCE_TRADE),
    CLOSE_PROFITABLE(CommandCategory.REDUCE_TRADE),
    CLOSE_LOSING(CommandCategory.REDUCE_TRADE),
    CLOSE_BY_SYMBOL(CommandCategory.REDUCE_TRADE),
    CLOSE_BY_STRATEGY(CommandCategory.REDUCE_TRADE),

    GET_POSITIONS(CommandCategory.QUERY),
    GET_ACCOUNT_INFO(CommandCategory.QUERY),
    GET_SYMBOL_INFO(CommandCategory.QUERY),
    GET_STATUS(CommandCategory.QUERY),

    EMERGENCY_STOP(CommandCategory.EMERGENCY);

    private final CommandCategory category;

    public boolean isLifecycle() {
        return category == CommandCategory.LIFECYCLE;
    }

    public boolean opensExposure() {
        return category == CommandCategory.OPEN_TRADE;
    }

    public boolean reducesExposure() {
        return category == CommandCategory.REDUCE_TRADE;
    }

    /** Resolves a wire name, returning empty for blank or unknown names. */
    public static Optional<CommandKind> fromWire(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CommandKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
