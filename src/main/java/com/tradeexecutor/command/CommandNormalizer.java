package com.tradeexecutor.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.exception.CommandValidationException;
import com.tradeexecutor.mapper.JsonHelper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns inbound control-plane messages into canonical {@link Command}s.
 *
 * <p>Two layouts reach the executor and this is the only class that knows both:
 * <ul>
 *   <li>channel messages: {@code {id, type, payload, priority, timestamp}}</li>
 *   <li>REST and queued commands: {@code {id, command, parameters, priority, createdAt}}</li>
 * </ul>
 *
 * <p>Anything that cannot become a valid command raises {@link CommandValidationException}.
 */
@Component
public class CommandNormalizer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final CommandConfig commandConfig;
    private final Clock clock;

    public CommandNormalizer(CommandConfig commandConfig, Clock clock) {
        this.commandConfig = commandConfig;
        this.clock = clock;
    }

    public Command normalize(String json) {
        if (json == null || json.isBlank()) {
            throw new CommandValidationException("Empty command message");
        }
        Map<String, Object> raw;
        try {
            raw = JsonHelper.mapper().readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new CommandValidationException("Command message is not valid JSON: " + e.getOriginalMessage());
        }
        return normalize(raw);
    }

    public Command normalize(Map<String, Object> raw) {
        if (raw == null) {
            throw new CommandValidationException("Empty command message");
        }
        String id = text(raw.get("id"));
        if (id == null) {
            throw new CommandValidationException("Command id is required");
        }

        String kindName = text(raw.get("type"));
        if (kindName == null) {
            kindName = text(raw.get("command"));
        }
        if (kindName == null) {
            throw new CommandValidationException("Command " + id + " has no type", Map.of("commandId", id));
        }
        final String wireKind = kindName;
        CommandKind kind = CommandKind.fromWire(kindName)
                .orElseThrow(() -> new CommandValidationException(
                        "Unknown command type '" + wireKind + "'", Map.of("commandId", id, "type", wireKind)));

        Map<String, Object> parameters = parameters(raw);
        validate(id, kind, parameters);

        return Command.builder()
                .id(id)
                .kind(kind)
                .parameters(parameters)
                .priority(CommandPriority.fromWire(raw.get("priority")))
                .createdAt(createdAt(raw))
                .sourceExecutorId(text(raw.get("executorId")))
                .timeout(timeout(raw.get("timeout")))
                .maxRetries(maxRetries(raw.get("maxRetries")))
                .build();
    }

    // ========================
    // KIND-SPECIFIC CHECKS
    // ========================

    private void validate(String id, CommandKind kind, Map<String, Object> params) {
        switch (kind) {
            case OPEN_POSITION -> {
                require(id, params, "symbol");
                if (TradeSide.fromWire(params.get("type")).isEmpty()) {
                    throw invalid(id, "type must be BUY or SELL");
                }
                BigDecimal volume = decimal(params.get("volume"));
                if (volume == null || volume.signum() <= 0) {
                    throw invalid(id, "volume must be greater than zero");
                }
            }
            case CLOSE_POSITION, MODIFY_POSITION -> require(id, params, "ticket");
            case CLOSE_BY_SYMBOL -> require(id, params, "symbol");
            case STOP_STRATEGY, PAUSE_STRATEGY, RESUME_STRATEGY, CLOSE_BY_STRATEGY -> require(id, params, "strategyId");
            case START_STRATEGY, UPDATE_STRATEGY -> {
                if (strategyId(params) == null) {
                    throw invalid(id, "strategyId is required");
                }
            }
            default -> {
                // no required parameters
            }
        }
    }

    /** Strategy id from {@code strategyId} or the embedded {@code strategy.id}. */
    public static String strategyId(Map<String, Object> params) {
        String direct = text(params.get("strategyId"));
        if (direct != null) {
            return direct;
        }
        if (params.get("strategy") instanceof Map<?, ?> strategy) {
            return text(strategy.get("id"));
        }
        return null;
    }

    private static void require(String id, Map<String, Object> params, String key) {
        if (text(params.get(key)) == null) {
            throw invalid(id, key + " is required");
        }
    }

    private static CommandValidationException invalid(String id, String reason) {
        return new CommandValidationException("Command " + id + ": " + reason, Map.of("commandId", id));
    }

    // ========================
    // FIELD PARSING
    // ========================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parameters(Map<String, Object> raw) {
        Object value = raw.get("payload");
        if (value == null) {
            value = raw.get("parameters");
        }
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        if (value instanceof String json && !json.isBlank()) {
            try {
                return JsonHelper.mapper().readValue(json, MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new CommandValidationException("Command parameters are not a JSON object");
            }
        }
        throw new CommandValidationException("Command parameters must be an object");
    }

    private Instant createdAt(Map<String, Object> raw) {
        Object value = raw.get("timestamp");
        if (value == null) {
            value = raw.get("createdAt");
        }
        if (value instanceof Number epochMs) {
            return Instant.ofEpochMilli(epochMs.longValue());
        }
        if (value != null) {
            try {
                return Instant.parse(value.toString().trim());
            } catch (DateTimeParseException e) {
                // unparseable timestamps fall back to receipt time
                return clock.instant();
            }
        }
        return clock.instant();
    }

    private static Duration timeout(Object value) {
        BigDecimal millis = decimal(value);
        return millis != null && millis.signum() > 0 ? Duration.ofMillis(millis.longValue()) : null;
    }

    private int maxRetries(Object value) {
        BigDecimal retries = decimal(value);
        return retries != null && retries.signum() >= 0 ? retries.intValue() : commandConfig.getMaxRetries();
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
