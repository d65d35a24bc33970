package com.tradeexecutor.transport;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Reply from the terminal. {@code success=false} is a business rejection (unknown ticket,
 * market closed) and is not retried; transport faults surface as exceptions instead.
 */
@Value
@Builder
public class TerminalResponse {

    boolean success;

    @Builder.Default
    Map<String, Object> data = Map.of();

    String error;

    public static TerminalResponse ok(Map<String, Object> data) {
        return TerminalResponse.builder().success(true).data(data).build();
    }

    public static TerminalResponse failure(String error) {
        return TerminalResponse.builder().success(false).error(error).build();
    }

    public Object get(String key) {
        return data.get(key);
    }

    public double getDouble(String key, double defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getList(String key) {
        Object value = data.get(key);
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }
}
