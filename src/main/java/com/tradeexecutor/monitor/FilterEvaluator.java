package com.tradeexecutor.monitor;

import com.tradeexecutor.domain.model.Instruments;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.Quote;
import com.tradeexecutor.domain.model.StrategyFilter;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.marketdata.indicator.IndicatorCalculator;
import com.tradeexecutor.safety.CorrelationTable;
import com.tradeexecutor.safety.SafetyLimits;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pre-entry filters. Every enabled filter must pass; disabled filters are skipped and
 * unknown types pass.
 *
 * <ul>
 *   <li><b>TIME</b> {@code startTime}/{@code endTime} (HH:mm, UTC); a start after the end spans midnight</li>
 *   <li><b>SESSION</b> {@code sessions}: ASIAN before 09:00 UTC, LONDON before 17:00, NEWYORK after</li>
 *   <li><b>SPREAD</b> {@code maxSpread} in pips</li>
 *   <li><b>VOLATILITY</b> {@code minVolatility}/{@code maxVolatility} against ATR({@code atrPeriod})</li>
 *   <li><b>DAY_OF_WEEK</b> {@code allowedDays}, as names or 0 (Sunday) to 6</li>
 *   <li><b>NEWS</b> always passes</li>
 *   <li><b>CORRELATION</b> rejects when an open position's symbol correlates above {@code maxCorrelation}</li>
 * </ul>
 */
@Component
public class FilterEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FilterEvaluator.class);

    private final IndicatorCalculator indicatorCalculator;
    private final CorrelationTable correlationTable;
    private final SafetyLimits safetyLimits;
    private final Clock clock;

    public FilterEvaluator(
            IndicatorCalculator indicatorCalculator,
            CorrelationTable correlationTable,
            SafetyLimits safetyLimits,
            Clock clock) {
        this.indicatorCalculator = indicatorCalculator;
        this.correlationTable = correlationTable;
        this.safetyLimits = safetyLimits;
        this.clock = clock;
    }

    public record FilterOutcome(boolean passed, String reason) {

        static FilterOutcome pass(String reason) {
            return new FilterOutcome(true, reason);
        }

        static FilterOutcome reject(String reason) {
            return new FilterOutcome(false, reason);
        }
    }

    /** Returns the first rejection, or a pass when every enabled filter passes. */
    public FilterOutcome evaluate(List<StrategyFilter> filters, MarketSnapshot snapshot, List<OpenPosition> openPositions) {
        if (filters == null || filters.isEmpty()) {
            return FilterOutcome.pass("no filters");
        }
        for (StrategyFilter filter : filters) {
            if (!filter.isEnabled()) {
                continue;
            }
            FilterOutcome outcome;
            try {
                outcome = evaluate(filter, snapshot, openPositions);
            } catch (RuntimeException e) {
                log.warn("{} filter failed on {}: {}", filter.getType(), snapshot.getSymbol(), e.getMessage());
                outcome = FilterOutcome.reject(filter.getType() + " filter error: " + e.getMessage());
            }
            if (!outcome.passed()) {
                log.debug("Filter {} rejected {}: {}", filter.getType(), snapshot.getSymbol(), outcome.reason());
                return outcome;
            }
        }
        return FilterOutcome.pass("all filters passed");
    }

    FilterOutcome evaluate(StrategyFilter filter, MarketSnapshot snapshot, List<OpenPosition> openPositions) {
        if (filter.getType() == null) {
            return FilterOutcome.pass("untyped filter");
        }
        return switch (filter.getType()) {
            case TIME -> timeFilter(filter);
            case SESSION -> sessionFilter(filter);
            case SPREAD -> spreadFilter(filter, snapshot);
            case VOLATILITY -> volatilityFilter(filter, snapshot);
            case DAY_OF_WEEK -> dayOfWeekFilter(filter);
            case NEWS -> FilterOutcome.pass("news calendar not integrated");
            case CORRELATION -> correlationFilter(filter, snapshot.getSymbol(), openPositions);
            case UNKNOWN -> FilterOutcome.pass("unknown filter type");
        };
    }

    // ========================
    // TIME / SESSION / DAY
    // ========================

    private FilterOutcome timeFilter(StrategyFilter filter) {
        LocalTime start = parseTime(firstNonNull(filter.configString("startTime"), filter.configString("start")));
        LocalTime end = parseTime(firstNonNull(filter.configString("endTime"), filter.configString("end")));
        if (start == null || end == null) {
            return FilterOutcome.pass("no trading hours configured");
        }
        LocalTime now = LocalTime.now(clock).withSecond(0).withNano(0);
        boolean inside = isWithin(now, start, end);
        return inside
                ? FilterOutcome.pass("within trading hours " + start + "-" + end)
                : FilterOutcome.reject("outside trading hours " + start + "-" + end + ", now " + now);
    }

    static boolean isWithin(LocalTime time, LocalTime start, LocalTime end) {
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }

    private FilterOutcome sessionFilter(StrategyFilter filter) {
        List<String> sessions = filter.configList("sessions");
        if (sessions.isEmpty()) {
            sessions = filter.configList("allowedSessions");
        }
        if (sessions.isEmpty()) {
            return FilterOutcome.pass("no session restrictions");
        }
        String current = currentSession(clock.instant().atZone(ZoneOffset.UTC).getHour());
        boolean allowed = sessions.stream()
                .map(s -> s.replace("_", "").replace(" ", "").toUpperCase(Locale.ROOT))
                .anyMatch(current::equals);
        return allowed
                ? FilterOutcome.pass("session " + current + " allowed")
                : FilterOutcome.reject("session " + current + " not in " + sessions);
    }

    /** ASIAN 00-09 UTC, LONDON 09-17 UTC (its 08:00 open overlaps Asia and resolves to ASIAN), NEWYORK otherwise. */
    static String currentSession(int utcHour) {
        if (utcHour < 9) {
            return "ASIAN";
        }
        if (utcHour < 17) {
            return "LONDON";
        }
        return "NEWYORK";
    }

    private FilterOutcome dayOfWeekFilter(StrategyFilter filter) {
        List<String> allowedDays = filter.configList("allowedDays");
        if (allowedDays.isEmpty()) {
            allowedDays = filter.configList("days");
        }
        if (allowedDays.isEmpty()) {
            return FilterOutcome.pass("no day restrictions");
        }
        DayOfWeek today = ZonedDateTime.now(clock).getDayOfWeek();
        boolean allowed = allowedDays.stream().anyMatch(day -> matchesDay(day, today));
        return allowed
                ? FilterOutcome.pass(today + " allowed")
                : FilterOutcome.reject(today + " not in allowed days " + allowedDays);
    }

    static boolean matchesDay(String configured, DayOfWeek day) {
        String value = configured.trim();
        if (value.matches("\\d+")) {
            // 0 is Sunday, 6 is Saturday
            return Integer.parseInt(value) % 7 == day.getValue() % 7;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        return upper.length() >= 3 && day.name().startsWith(upper);
    }

    // ========================
    // MARKET FILTERS
    // ========================

    private FilterOutcome spreadFilter(StrategyFilter filter, MarketSnapshot snapshot) {
        Double maxSpread = filter.configNumber("maxSpread");
        if (maxSpread == null || maxSpread <= 0) {
            return FilterOutcome.pass("no spread limit");
        }
        Quote quote = snapshot.getQuote();
        if (quote == null) {
            return FilterOutcome.reject("no quote to check spread");
        }
        double spreadPips = quote.spread() / Instruments.pipSize(snapshot.getSymbol());
        return spreadPips <= maxSpread
                ? FilterOutcome.pass(String.format(Locale.ROOT, "spread %.1f pips within %.1f", spreadPips, maxSpread))
                : FilterOutcome.reject(String.format(Locale.ROOT, "spread %.1f pips > %.1f", spreadPips, maxSpread));
    }

    private FilterOutcome volatilityFilter(StrategyFilter filter, MarketSnapshot snapshot) {
        Double min = filter.configNumber("minVolatility");
        Double max = filter.configNumber("maxVolatility");
        if (min == null && max == null) {
            return FilterOutcome.pass("no volatility restrictions");
        }
        Double period = filter.configNumber("atrPeriod");
        OptionalDouble atr = indicatorCalculator.value(
                snapshot, "ATR", Map.of("period", period != null ? period : 14.0));
        if (atr.isEmpty()) {
            return FilterOutcome.pass("volatility not available");
        }
        double value = atr.getAsDouble();
        if (min != null && value < min) {
            return FilterOutcome.reject(String.format(Locale.ROOT, "volatility %.5f < %.5f", value, min));
        }
        if (max != null && value > max) {
            return FilterOutcome.reject(String.format(Locale.ROOT, "volatility %.5f > %.5f", value, max));
        }
        return FilterOutcome.pass("volatility within range");
    }

    private FilterOutcome correlationFilter(StrategyFilter filter, String symbol, List<OpenPosition> openPositions) {
        Double configured = filter.configNumber("maxCorrelation");
        double limit = configured != null ? configured : safetyLimits.getMaxCorrelation();
        for (OpenPosition position : openPositions) {
            double correlation = correlationTable.correlation(symbol, position.getSymbol());
            if (Math.abs(correlation) > limit) {
                return FilterOutcome.reject("open " + position.getSymbol() + " position correlates " + correlation);
            }
        }
        return FilterOutcome.pass("no correlated exposure");
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim().length() == 4 ? "0" + value.trim() : value.trim());
        } catch (DateTimeParseException e) {
            log.warn("Invalid time '{}' in time filter", value);
            return null;
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
