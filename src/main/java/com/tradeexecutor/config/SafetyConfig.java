package com.tradeexecutor.config;

import com.tradeexecutor.safety.SafetyLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link SafetyLimits} bean from application.yml.
 *
 * <p>Limits are read once; there is no runtime mutation path. Changing a limit means
 * restarting the executor.
 *
 * <p>Properties prefix: {@code executor.safety.*}
 */
@Configuration
public class SafetyConfig {

    @Bean
    public SafetyLimits safetyLimits(
            @Value("${executor.safety.max-daily-loss:500}") BigDecimal maxDailyLoss,
            @Value("${executor.safety.max-daily-loss-percent:5}") BigDecimal maxDailyLossPercent,
            @Value("${executor.safety.max-drawdown:1000}") BigDecimal maxDrawdown,
            @Value("${executor.safety.max-drawdown-percent:10}") BigDecimal maxDrawdownPercent,
            @Value("${executor.safety.max-positions:10}") int maxPositions,
            @Value("${executor.safety.max-lot-size:1.0}") BigDecimal maxLotSize,
            @Value("${executor.safety.max-correlation:0.7}") double maxCorrelation,
            @Value("${executor.safety.max-total-exposure:5000}") BigDecimal maxTotalExposure,
            @Value("${executor.safety.contract-size:100000}") BigDecimal contractSize,
            @Value("${executor.safety.leverage:100}") BigDecimal leverage) {
        return SafetyLimits.builder()
                .maxDailyLoss(maxDailyLoss)
                .maxDailyLossPercent(maxDailyLossPercent)
                .maxDrawdown(maxDrawdown)
                .maxDrawdownPercent(maxDrawdownPercent)
                .maxPositions(maxPositions)
                .maxLotSize(maxLotSize)
                .maxCorrelation(maxCorrelation)
                .maxTotalExposure(maxTotalExposure)
                .contractSize(contractSize)
                .leverage(leverage)
                .build();
    }
}
