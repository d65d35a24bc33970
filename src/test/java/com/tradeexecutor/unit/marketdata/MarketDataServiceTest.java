package com.tradeexecutor.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.Quote;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.marketdata.MarketDataService;
import com.tradeexecutor.marketdata.MarketDataSource;
import com.tradeexecutor.marketdata.MarketSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for MarketDataService snapshot caching and failure handling. */
class MarketDataServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private MarketDataSource marketDataSource;
    private MarketDataService service;

    @BeforeEach
    void setUp() {
        marketDataSource = mock(MarketDataSource.class);
        MonitorConfig config = new MonitorConfig();
        config.setMarketDataTtlMs(60_000);
        config.setBarsPerFetch(50);
        service = new MarketDataService(marketDataSource, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenData() {
        when(marketDataSource.fetchBars("EURUSD", Timeframe.H1, 50))
                .thenReturn(List.of(new PriceBar(NOW, 1.08, 1.09, 1.07, 1.085, 10)));
        when(marketDataSource.fetchQuote("EURUSD")).thenReturn(new Quote("EURUSD", 1.0849, 1.0851, 0.00001));
    }

    @Test
    @DisplayName("Second request within the TTL is served from cache")
    void cachedWithinTtl() {
        givenData();

        Optional<MarketSnapshot> first = service.getSnapshot("EURUSD", Timeframe.H1);
        Optional<MarketSnapshot> second = service.getSnapshot("EURUSD", Timeframe.H1);

        assertThat(first).isPresent();
        assertThat(second).containsSame(first.get());
        assertThat(first.get().getFetchedAt()).isEqualTo(NOW);
        assertThat(first.get().lastPrice()).isEqualTo(1.085);
        verify(marketDataSource, times(1)).fetchBars("EURUSD", Timeframe.H1, 50);
        assertThat(service.cacheHitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Invalidation forces a fresh fetch")
    void invalidateRefetches() {
        givenData();
        service.getSnapshot("EURUSD", Timeframe.H1);

        service.invalidateAll();
        service.getSnapshot("EURUSD", Timeframe.H1);

        verify(marketDataSource, times(2)).fetchBars("EURUSD", Timeframe.H1, 50);
    }

    @Test
    @DisplayName("Transport failure and empty bars both mean no data")
    void failuresAreEmpty() {
        when(marketDataSource.fetchBars("EURUSD", Timeframe.H1, 50)).thenThrow(new TransportException("down"));
        when(marketDataSource.fetchBars("GBPUSD", Timeframe.H1, 50)).thenReturn(List.of());
        when(marketDataSource.fetchQuote(anyString())).thenReturn(new Quote("GBPUSD", 1.26, 1.27, 0.00001));

        assertThat(service.getSnapshot("EURUSD", Timeframe.H1)).isEmpty();
        assertThat(service.getSnapshot("GBPUSD", Timeframe.H1)).isEmpty();
        assertThat(service.cacheHitRate()).isZero();
    }

    @Test
    @DisplayName("Quote lookup bypasses the cache and swallows transport errors")
    void quoteLookup() {
        when(marketDataSource.fetchQuote("EURUSD")).thenThrow(new TransportException("down"));

        assertThat(service.getQuote("EURUSD")).isEmpty();
    }
}
