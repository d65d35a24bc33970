package com.tradeexecutor.marketdata.indicator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.marketdata.MarketSnapshot;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.CCIIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorDIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.WilliamsRIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * ta4j-backed {@link IndicatorCalculator}.
 *
 * <p>Supported names: PRICE, RSI, EMA, SMA, MACD, MACD_SIGNAL, MACD_HISTOGRAM, BB_UPPER,
 * BB_MIDDLE, BB_LOWER, ATR, ADX, CCI, STOCH_K, STOCH_D, WILLIAMS_R. The bar series built for a
 * snapshot is cached against that snapshot instance, so evaluating several conditions in one
 * tick builds it once.
 */
@Component
public class Ta4jIndicatorCalculator implements IndicatorCalculator {

    private static final Logger log = LoggerFactory.getLogger(Ta4jIndicatorCalculator.class);

    /** Weak identity keys: a series lives as long as its snapshot is referenced. */
    private final Cache<MarketSnapshot, BarSeries> seriesCache =
            Caffeine.newBuilder().weakKeys().maximumSize(256).build();

    @Override
    public OptionalDouble value(
            MarketSnapshot snapshot, String indicator, Map<String, Double> indicatorParams, int barsAgo) {
        Map<String, Double> params = indicatorParams != null ? indicatorParams : Map.of();
        if (snapshot == null || snapshot.getBars().isEmpty() || indicator == null) {
            return OptionalDouble.empty();
        }
        BarSeries series = seriesCache.get(snapshot, Ta4jIndicatorCalculator::toSeries);
        int index = series.getEndIndex() - barsAgo;
        if (index < series.getBeginIndex()) {
            return OptionalDouble.empty();
        }

        String name = indicator.toUpperCase(Locale.ROOT);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        Indicator<Num> target;
        int warmup;
        switch (name) {
            case "PRICE", "CLOSE" -> {
                target = close;
                warmup = 1;
            }
            case "RSI" -> {
                int period = param(params, "period", 14);
                target = new RSIIndicator(close, period);
                warmup = period + 1;
            }
            case "EMA" -> {
                int period = param(params, "period", 20);
                target = new EMAIndicator(close, period);
                warmup = period;
            }
            case "SMA", "MA" -> {
                int period = param(params, "period", 20);
                target = new SMAIndicator(close, period);
                warmup = period;
            }
            case "MACD", "MACD_SIGNAL", "MACD_HISTOGRAM" -> {
                int fast = param(params, "fastPeriod", 12);
                int slow = param(params, "slowPeriod", 26);
                int signalPeriod = param(params, "signalPeriod", 9);
                MACDIndicator macd = new MACDIndicator(close, fast, slow);
                EMAIndicator signal = new EMAIndicator(macd, signalPeriod);
                warmup = slow;
                if (name.equals("MACD")) {
                    target = macd;
                } else if (name.equals("MACD_SIGNAL")) {
                    target = signal;
                } else {
                    return finite(macd.getValue(index).minus(signal.getValue(index)).doubleValue(), index, warmup);
                }
            }
            case "BB_UPPER", "BB_MIDDLE", "BB_LOWER" -> {
                int period = param(params, "period", 20);
                Num k = series.numOf(params.getOrDefault("stdDev", 2.0));
                BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(close, period));
                StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, period);
                target = switch (name) {
                    case "BB_UPPER" -> new BollingerBandsUpperIndicator(middle, deviation, k);
                    case "BB_LOWER" -> new BollingerBandsLowerIndicator(middle, deviation, k);
                    default -> middle;
                };
                warmup = period;
            }
            case "ATR" -> {
                int period = param(params, "period", 14);
                target = new ATRIndicator(series, period);
                warmup = period;
            }
            case "ADX" -> {
                int period = param(params, "period", 14);
                target = new ADXIndicator(series, period);
                warmup = period * 2;
            }
            case "CCI" -> {
                int period = param(params, "period", 20);
                target = new CCIIndicator(series, period);
                warmup = period;
            }
            case "STOCH_K", "STOCH_D" -> {
                int period = param(params, "kPeriod", param(params, "period", 14));
                StochasticOscillatorKIndicator k = new StochasticOscillatorKIndicator(series, period);
                target = name.equals("STOCH_K") ? k : new StochasticOscillatorDIndicator(k);
                warmup = period + 2;
            }
            case "WILLIAMS_R", "WILLIAMS", "WILLR" -> {
                int period = param(params, "period", 14);
                target = new WilliamsRIndicator(series, period);
                warmup = period;
            }
            default -> {
                log.debug("Unsupported indicator {}", indicator);
                return OptionalDouble.empty();
            }
        }
        return finite(target.getValue(index).doubleValue(), index, warmup);
    }

    private static OptionalDouble finite(double value, int index, int warmup) {
        if (index + 1 < warmup || Double.isNaN(value) || Double.isInfinite(value)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }

    private static int param(Map<String, Double> params, String key, int defaultValue) {
        Double value = params.get(key);
        return value != null && value >= 1 ? value.intValue() : defaultValue;
    }

    private static BarSeries toSeries(MarketSnapshot snapshot) {
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(snapshot.getSymbol() + "_" + snapshot.getTimeframe())
                .build();
        ZonedDateTime previous = null;
        for (PriceBar bar : snapshot.getBars()) {
            ZonedDateTime endTime = bar.time().atZone(ZoneOffset.UTC);
            if (previous != null && !endTime.isAfter(previous)) {
                continue;
            }
            series.addBar(endTime, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
            previous = endTime;
        }
        return series;
    }
}
