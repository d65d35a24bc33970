package com.tradeexecutor.config;

import com.tradeexecutor.exception.PlatformApiException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j primitives.
 *
 * <p>The dispatch rate limiter admits {@code rate-limit-per-window} sends per window and
 * makes a caller wait up to one window for a permit. The platform fetch retry backs off
 * exponentially from {@code fetch-initial-delay-ms} and only retries control-plane errors.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public RateLimiter commandRateLimiter(CommandConfig commandConfig) {
        Duration window = Duration.ofMillis(commandConfig.getRateLimitWindowMs());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(commandConfig.getRateLimitPerWindow())
                .limitRefreshPeriod(window)
                .timeoutDuration(window)
                .build();
        return RateLimiter.of("command-dispatch", config);
    }

    @Bean
    public Retry platformFetchRetry(ReconcilerConfig reconcilerConfig) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, reconcilerConfig.getFetchAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1, reconcilerConfig.getFetchInitialDelayMs()), 2.0))
                .retryExceptions(PlatformApiException.class)
                .build();
        return Retry.of("platform-fetch", config);
    }
}
