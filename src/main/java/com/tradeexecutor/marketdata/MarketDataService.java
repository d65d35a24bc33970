package com.tradeexecutor.marketdata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.Quote;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per symbol/timeframe market snapshots for strategy ticks.
 *
 * <p>Snapshots are cached for {@code executor.monitor.market-data-ttl-ms} so strategies on the
 * same symbol and timeframe share one terminal round trip. A failed fetch returns empty;
 * the caller treats that as "no data" and skips its tick.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final MarketDataSource marketDataSource;
    private final MonitorConfig monitorConfig;
    private final Clock clock;

    /** Caffeine cache: key = "symbol|timeframe", value = snapshot. */
    private final Cache<String, MarketSnapshot> snapshotCache;

    public MarketDataService(MarketDataSource marketDataSource, MonitorConfig monitorConfig, Clock clock) {
        this.marketDataSource = marketDataSource;
        this.monitorConfig = monitorConfig;
        this.clock = clock;
        this.snapshotCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(Math.max(1, monitorConfig.getMarketDataTtlMs())))
                .maximumSize(500)
                .recordStats()
                .build();
    }

    public Optional<MarketSnapshot> getSnapshot(String symbol, Timeframe timeframe) {
        String cacheKey = symbol + "|" + timeframe;
        MarketSnapshot cached = snapshotCache.getIfPresent(cacheKey);
        if (cached != null) {
            return Optional.of(cached);
        }

        try {
            List<PriceBar> bars = marketDataSource.fetchBars(symbol, timeframe, monitorConfig.getBarsPerFetch());
            Quote quote = marketDataSource.fetchQuote(symbol);
            if (bars.isEmpty()) {
                log.debug("No bars for {} {}", symbol, timeframe);
                return Optional.empty();
            }
            MarketSnapshot snapshot = MarketSnapshot.builder()
                    .symbol(symbol)
                    .timeframe(timeframe)
                    .bars(List.copyOf(bars))
                    .quote(quote)
                    .fetchedAt(clock.instant())
                    .build();
            snapshotCache.put(cacheKey, snapshot);
            return Optional.of(snapshot);
        } catch (RuntimeException e) {
            log.debug("Market data for {} {} unavailable: {}", symbol, timeframe, e.getMessage());
            return Optional.empty();
        }
    }

    /** Fresh quote, bypassing the snapshot cache. */
    public Optional<Quote> getQuote(String symbol) {
        try {
            return Optional.ofNullable(marketDataSource.fetchQuote(symbol));
        } catch (RuntimeException e) {
            log.debug("Quote for {} unavailable: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    public double cacheHitRate() {
        CacheStats stats = snapshotCache.stats();
        return stats.requestCount() == 0 ? 0.0 : stats.hitRate();
    }

    public void invalidateAll() {
        snapshotCache.invalidateAll();
    }
}
