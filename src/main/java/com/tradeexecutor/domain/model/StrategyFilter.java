package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.FilterType;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StrategyFilter {

    FilterType type;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    Map<String, Object> config = Map.of();

    public String configString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    public Double configNumber(String key) {
        Object value = config.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public List<String> configList(String key) {
        Object value = config.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split("\\s*,\\s*"));
        }
        return List.of();
    }
}
