package com.tradeexecutor.transport.simulator;

import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.Instruments;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.transport.TerminalAction;
import com.tradeexecutor.transport.TerminalRequest;
import com.tradeexecutor.transport.TerminalResponse;
import com.tradeexecutor.transport.TerminalTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process terminal used for paper trading and tests.
 *
 * <p>Prices follow a seeded random walk per symbol. Every request advances the walk one
 * step, refreshes the open bar of each cached series, and closes any position whose
 * stop-loss or take-profit was crossed. Positions and balance live in memory only.
 *
 * <p>Profit is computed on a 100,000-unit contract (100 oz for gold); yen-quoted profit is
 * converted back to the account currency at the close price.
 */
@Component
@ConditionalOnProperty(prefix = "executor", name = "trading-mode", havingValue = "SIMULATED", matchIfMissing = true)
public class SimulatedTerminalTransport implements TerminalTransport {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTerminalTransport.class);

    private static final double FX_CONTRACT_SIZE = 100_000;
    private static final double GOLD_CONTRACT_SIZE = 100;
    private static final double SPREAD_PIPS = 1.5;
    private static final double STEP_VOLATILITY = 0.0002;

    private static final Map<String, Double> START_PRICES = Map.of(
            "EURUSD", 1.0850,
            "GBPUSD", 1.2650,
            "USDJPY", 149.50,
            "AUDUSD", 0.6550,
            "USDCHF", 0.8850,
            "USDCAD", 1.3550,
            "NZDUSD", 0.6050,
            "XAUUSD", 2350.0);

    private final Clock clock;
    private final Random random;
    private final AtomicLong ticketSequence = new AtomicLong(100_000);
    private final AtomicInteger failuresToInject = new AtomicInteger(0);
    private final List<Consumer<String>> lossListeners = new CopyOnWriteArrayList<>();

    private final Map<String, Double> prices = new HashMap<>();
    private final Map<String, List<SimulatedBar>> series = new HashMap<>();
    private final Map<Long, SimulatedPosition> positions = new LinkedHashMap<>();

    private volatile boolean connected;
    private double balance;

    @Autowired
    public SimulatedTerminalTransport(
            Clock clock,
            @Value("${executor.simulator.starting-balance:10000}") double startingBalance,
            @Value("${executor.simulator.seed:42}") long seed) {
        this.clock = clock;
        this.balance = startingBalance;
        this.random = new Random(seed);
    }

    public SimulatedTerminalTransport(Clock clock, double startingBalance) {
        this(clock, startingBalance, 42L);
    }

    // ========================
    // CONNECTION
    // ========================

    @Override
    public void connect() {
        connected = true;
        log.info("Simulated terminal connected (balance={})", balance);
    }

    @Override
    public void disconnect() {
        connected = false;
        log.info("Simulated terminal disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void onConnectionLost(Consumer<String> listener) {
        lossListeners.add(listener);
    }

    /** Drops the link as if the terminal crashed; registered loss listeners are notified. */
    public void simulateConnectionLoss(String reason) {
        connected = false;
        lossListeners.forEach(listener -> listener.accept(reason));
    }

    /** The next {@code count} requests fail with a {@link TransportException}. */
    public void failNextRequests(int count) {
        failuresToInject.set(count);
    }

    /** Pins the price of a symbol; used to drive deterministic scenarios. */
    public synchronized void setPrice(String symbol, double price) {
        prices.put(key(symbol), price);
    }

    public synchronized void setBalance(double balance) {
        this.balance = balance;
    }

    // ========================
    // REQUESTS
    // ========================

    @Override
    public synchronized TerminalResponse request(TerminalRequest request) {
        if (!connected) {
            throw new TransportException("Terminal not connected");
        }
        if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransportException("Injected terminal failure for " + request.getAction());
        }

        Map<String, Object> params = request.getParams();
        TerminalAction action = request.getAction();
        if (action != TerminalAction.PING) {
            advancePrices();
        }

        return switch (action) {
            case PING -> TerminalResponse.ok(Map.of("pong", true));
            case OPEN_TRADE -> openTrade(params);
            case CLOSE_TRADE -> closeTrade(params);
            case MODIFY_TRADE -> modifyTrade(params);
            case GET_POSITIONS -> TerminalResponse.ok(Map.of("positions", positionViews()));
            case GET_ACCOUNT_INFO -> TerminalResponse.ok(accountInfo());
            case GET_SYMBOL_INFO -> symbolInfo(params);
            case GET_QUOTE -> quote(params);
            case GET_BARS -> bars(params);
        };
    }

    private TerminalResponse openTrade(Map<String, Object> params) {
        String symbol = key(text(params.get("symbol")));
        TradeSide side = TradeSide.fromWire(params.get("type")).orElse(null);
        double volume = number(params.get("volume"), 0);
        if (symbol.isEmpty() || side == null || volume <= 0) {
            return TerminalResponse.failure("Invalid trade request");
        }
        double price = side == TradeSide.BUY ? ask(symbol) : bid(symbol);
        long ticket = ticketSequence.incrementAndGet();
        SimulatedPosition position = new SimulatedPosition(
                ticket,
                symbol,
                side,
                price,
                text(params.get("comment")),
                text(params.get("magic")),
                clock.instant());
        position.setVolume(volume);
        position.setStopLoss(number(params.get("stopLoss"), 0));
        position.setTakeProfit(number(params.get("takeProfit"), 0));
        positions.put(ticket, position);
        log.debug("Simulated open: ticket={} {} {} {} @ {}", ticket, side, volume, symbol, price);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ticket", ticket);
        data.put("symbol", symbol);
        data.put("type", side.name());
        data.put("volume", volume);
        data.put("price", price);
        return TerminalResponse.ok(data);
    }

    private TerminalResponse closeTrade(Map<String, Object> params) {
        long ticket = (long) number(params.get("ticket"), -1);
        SimulatedPosition position = positions.get(ticket);
        if (position == null) {
            return TerminalResponse.failure("Ticket " + ticket + " not found");
        }
        double requested = number(params.get("volume"), position.getVolume());
        double closedVolume = Math.min(requested, position.getVolume());
        return TerminalResponse.ok(close(position, closedVolume, "manual"));
    }

    private TerminalResponse modifyTrade(Map<String, Object> params) {
        long ticket = (long) number(params.get("ticket"), -1);
        SimulatedPosition position = positions.get(ticket);
        if (position == null) {
            return TerminalResponse.failure("Ticket " + ticket + " not found");
        }
        if (params.containsKey("stopLoss")) {
            position.setStopLoss(number(params.get("stopLoss"), position.getStopLoss()));
        }
        if (params.containsKey("takeProfit")) {
            position.setTakeProfit(number(params.get("takeProfit"), position.getTakeProfit()));
        }
        return TerminalResponse.ok(Map.of(
                "ticket", ticket, "stopLoss", position.getStopLoss(), "takeProfit", position.getTakeProfit()));
    }

    private TerminalResponse symbolInfo(Map<String, Object> params) {
        String symbol = key(text(params.get("symbol")));
        if (symbol.isEmpty()) {
            return TerminalResponse.failure("symbol is required");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("symbol", symbol);
        data.put("bid", bid(symbol));
        data.put("ask", ask(symbol));
        data.put("point", point(symbol));
        data.put("digits", Instruments.priceScale(symbol));
        data.put("contractSize", contractSize(symbol));
        data.put("minLot", 0.01);
        data.put("maxLot", 100.0);
        data.put("lotStep", 0.01);
        return TerminalResponse.ok(data);
    }

    private TerminalResponse quote(Map<String, Object> params) {
        String symbol = key(text(params.get("symbol")));
        if (symbol.isEmpty()) {
            return TerminalResponse.failure("symbol is required");
        }
        return TerminalResponse.ok(Map.of(
                "symbol", symbol, "bid", bid(symbol), "ask", ask(symbol), "point", point(symbol)));
    }

    private TerminalResponse bars(Map<String, Object> params) {
        String symbol = key(text(params.get("symbol")));
        Timeframe timeframe = Timeframe.parse(text(params.get("timeframe")), Timeframe.H1);
        int count = (int) number(params.get("count"), 100);
        if (symbol.isEmpty()) {
            return TerminalResponse.failure("symbol is required");
        }
        List<SimulatedBar> bars = seriesFor(symbol, timeframe, count);
        int from = Math.max(0, bars.size() - count);
        List<Map<String, Object>> views = new ArrayList<>();
        for (SimulatedBar bar : bars.subList(from, bars.size())) {
            views.add(bar.toView());
        }
        return TerminalResponse.ok(Map.of("symbol", symbol, "timeframe", timeframe.name(), "bars", views));
    }

    // ========================
    // PRICE SIMULATION
    // ========================

    private void advancePrices() {
        for (Map.Entry<String, Double> entry : prices.entrySet()) {
            entry.setValue(step(entry.getValue()));
        }
        for (Map.Entry<String, List<SimulatedBar>> entry : series.entrySet()) {
            String symbol = entry.getKey().substring(0, entry.getKey().indexOf('|'));
            Timeframe timeframe = Timeframe.valueOf(entry.getKey().substring(entry.getKey().indexOf('|') + 1));
            roll(entry.getValue(), timeframe.getBarDuration(), mid(symbol));
        }
        checkStops();
    }

    private double step(double price) {
        return price * (1 + random.nextGaussian() * STEP_VOLATILITY);
    }

    private List<SimulatedBar> seriesFor(String symbol, Timeframe timeframe, int count) {
        List<SimulatedBar> bars = series.get(symbol + "|" + timeframe.name());
        if (bars != null && bars.size() >= count) {
            return bars;
        }
        bars = new ArrayList<>();
        Duration barDuration = timeframe.getBarDuration();
        long barMillis = barDuration.toMillis();
        Instant current = Instant.ofEpochMilli(clock.millis() / barMillis * barMillis);
        double close = mid(symbol);
        List<SimulatedBar> reversed = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double open = step(close);
            double high = Math.max(open, close) * (1 + Math.abs(random.nextGaussian()) * STEP_VOLATILITY);
            double low = Math.min(open, close) * (1 - Math.abs(random.nextGaussian()) * STEP_VOLATILITY);
            reversed.add(new SimulatedBar(current.minus(barDuration.multipliedBy(i)), open, high, low, close));
            close = open;
        }
        for (int i = reversed.size() - 1; i >= 0; i--) {
            bars.add(reversed.get(i));
        }
        series.put(symbol + "|" + timeframe.name(), bars);
        return bars;
    }

    private void roll(List<SimulatedBar> bars, Duration barDuration, double price) {
        if (bars.isEmpty()) {
            return;
        }
        SimulatedBar last = bars.get(bars.size() - 1);
        Instant nextOpen = last.time.plus(barDuration);
        if (!clock.instant().isBefore(nextOpen)) {
            bars.add(new SimulatedBar(nextOpen, last.close, Math.max(last.close, price), Math.min(last.close, price), price));
            if (bars.size() > 1000) {
                bars.remove(0);
            }
        } else {
            last.close = price;
            last.high = Math.max(last.high, price);
            last.low = Math.min(last.low, price);
        }
    }

    private void checkStops() {
        Iterator<SimulatedPosition> iterator = new ArrayList<>(positions.values()).iterator();
        while (iterator.hasNext()) {
            SimulatedPosition position = iterator.next();
            double exitPrice = exitPrice(position);
            boolean stopHit = position.getStopLoss() > 0
                    && (position.getSide() == TradeSide.BUY
                            ? exitPrice <= position.getStopLoss()
                            : exitPrice >= position.getStopLoss());
            boolean targetHit = position.getTakeProfit() > 0
                    && (position.getSide() == TradeSide.BUY
                            ? exitPrice >= position.getTakeProfit()
                            : exitPrice <= position.getTakeProfit());
            if (stopHit || targetHit) {
                close(position, position.getVolume(), stopHit ? "sl" : "tp");
            }
        }
    }

    private Map<String, Object> close(SimulatedPosition position, double volume, String reason) {
        double closePrice = exitPrice(position);
        double profit = profit(position, closePrice, volume);
        balance += profit;
        double remaining = position.getVolume() - volume;
        if (remaining < 0.005) {
            positions.remove(position.getTicket());
        } else {
            position.setVolume(Math.round(remaining * 100) / 100.0);
        }
        log.debug("Simulated close ({}): ticket={} volume={} profit={}", reason, position.getTicket(), volume, profit);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ticket", position.getTicket());
        data.put("closePrice", closePrice);
        data.put("closedVolume", volume);
        data.put("profit", round2(profit));
        data.put("reason", reason);
        return data;
    }

    // ========================
    // VIEWS
    // ========================

    private List<Map<String, Object>> positionViews() {
        List<Map<String, Object>> views = new ArrayList<>();
        for (SimulatedPosition position : positions.values()) {
            double current = exitPrice(position);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("ticket", position.getTicket());
            view.put("symbol", position.getSymbol());
            view.put("type", position.getSide().name());
            view.put("volume", position.getVolume());
            view.put("openPrice", position.getOpenPrice());
            view.put("currentPrice", current);
            view.put("stopLoss", position.getStopLoss());
            view.put("takeProfit", position.getTakeProfit());
            view.put("profit", round2(profit(position, current, position.getVolume())));
            view.put("comment", position.getComment());
            view.put("magic", position.getMagic());
            view.put("openTime", position.getOpenTime().toEpochMilli());
            views.add(view);
        }
        return views;
    }

    private Map<String, Object> accountInfo() {
        double floating = 0;
        for (SimulatedPosition position : positions.values()) {
            floating += profit(position, exitPrice(position), position.getVolume());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("balance", round2(balance));
        data.put("equity", round2(balance + floating));
        data.put("profit", round2(floating));
        data.put("currency", "USD");
        data.put("leverage", 100);
        data.put("openPositions", positions.size());
        return data;
    }

    // ========================
    // PRICE HELPERS
    // ========================

    private double mid(String symbol) {
        return prices.computeIfAbsent(symbol, s -> START_PRICES.getOrDefault(s, 1.0));
    }

    private double bid(String symbol) {
        return mid(symbol) - halfSpread(symbol);
    }

    private double ask(String symbol) {
        return mid(symbol) + halfSpread(symbol);
    }

    private double halfSpread(String symbol) {
        return SPREAD_PIPS * Instruments.pipSize(symbol) / 2;
    }

    private double point(String symbol) {
        return Instruments.pipSize(symbol) / 10;
    }

    private double exitPrice(SimulatedPosition position) {
        return position.getSide() == TradeSide.BUY ? bid(position.getSymbol()) : ask(position.getSymbol());
    }

    private double contractSize(String symbol) {
        return Instruments.isGold(symbol) ? GOLD_CONTRACT_SIZE : FX_CONTRACT_SIZE;
    }

    private double profit(SimulatedPosition position, double closePrice, double volume) {
        double diff = (closePrice - position.getOpenPrice()) * position.getSide().sign();
        double quoted = diff * volume * contractSize(position.getSymbol());
        return Instruments.isJpyPair(position.getSymbol()) ? quoted / closePrice : quoted;
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    private static String key(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static double number(Object value, double defaultValue) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null && !value.toString().isBlank()) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static final class SimulatedBar {

        private final Instant time;
        private final double open;
        private double high;
        private double low;
        private double close;

        private SimulatedBar(Instant time, double open, double high, double low, double close) {
            this.time = time;
            this.open = open;
            this.high = high;
            this.low = low;
            this.close = close;
        }

        private Map<String, Object> toView() {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("time", time.toEpochMilli());
            view.put("open", open);
            view.put("high", high);
            view.put("low", low);
            view.put("close", close);
            view.put("volume", 0);
            return view;
        }
    }
}
