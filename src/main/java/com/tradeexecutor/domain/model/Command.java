package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Builder;
import lombok.Getter;

/**
 * Canonical command produced by the command normalizer from an inbound control-plane message.
 *
 * <p>All fields are immutable except the retry counter, which the dispatcher advances on
 * each failed send attempt. Parameters are an opaque, read-only map; typed accessors
 * below cover the keys the executor interprets.
 */
@Getter
public class Command {

    private final String id;
    private final CommandKind kind;
    private final Map<String, Object> parameters;
    private final CommandPriority priority;
    private final Instant createdAt;
    private final String sourceExecutorId;
    private final Duration timeout;
    private final int maxRetries;
    private final AtomicInteger retryCount = new AtomicInteger(0);

    @Builder
    private Command(
            String id,
            CommandKind kind,
            Map<String, Object> parameters,
            CommandPriority priority,
            Instant createdAt,
            String sourceExecutorId,
            Duration timeout,
            int maxRetries) {
        this.id = id;
        this.kind = kind;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        this.priority = priority != null ? priority : CommandPriority.NORMAL;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.sourceExecutorId = sourceExecutorId;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
    }

    public int getRetryCount() {
        return retryCount.get();
    }

    /** Advances the retry counter and returns the new value. */
    public int incrementRetryCount() {
        return retryCount.incrementAndGet();
    }

    public boolean hasParameter(String key) {
        Object value = parameters.get(key);
        return value != null && !value.toString().isBlank();
    }

    public String stringParameter(String key) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }

    /** Returns the parameter as a BigDecimal, or null when absent or not numeric. */
    public BigDecimal decimalParameter(String key) {
        Object value = parameters.get(key);
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

    @Override
    public String toString() {
        return "Command[" + id + " " + kind + " " + priority + " retries=" + retryCount.get() + "/" + maxRetries + "]";
    }
}
