package com.tradeexecutor.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter. The executor's own meters live in
 * {@link com.tradeexecutor.observability.ExecutorMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ExecutorProperties executorProperties;

    public MetricsConfig(MeterRegistry meterRegistry, ExecutorProperties executorProperties) {
        this.meterRegistry = meterRegistry;
        this.executorProperties = executorProperties;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "trade-executor", "executor", executorProperties.getId());
    }
}
