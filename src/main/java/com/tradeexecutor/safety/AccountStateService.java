package com.tradeexecutor.safety;

import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.transport.TerminalAction;
import com.tradeexecutor.transport.TerminalRequest;
import com.tradeexecutor.transport.TerminalResponse;
import com.tradeexecutor.transport.TerminalTransport;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps the {@link AccountSnapshot} the safety gate evaluates against.
 *
 * <p>Balance, equity and open positions come from the terminal. The day's start balance
 * (rolled over at UTC midnight) and the peak equity are tracked here. A ticket present in
 * the previous refresh but missing from the current one counts as a closed trade; its last
 * known profit feeds the consecutive-loss counter.
 */
@Service
public class AccountStateService {

    private static final Logger log = LoggerFactory.getLogger(AccountStateService.class);

    private final TerminalTransport terminalTransport;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicReference<AccountSnapshot> current = new AtomicReference<>(AccountSnapshot.empty());
    private final AtomicInteger consecutiveLosses = new AtomicInteger(0);

    private LocalDate tradingDay;
    private BigDecimal dailyStartBalance = BigDecimal.ZERO;
    private BigDecimal peakEquity = BigDecimal.ZERO;
    private Map<String, OpenPosition> lastPositions = new LinkedHashMap<>();

    public AccountStateService(
            TerminalTransport terminalTransport, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.terminalTransport = terminalTransport;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${executor.monitor.account-refresh-interval-ms:5000}",
            initialDelayString = "${executor.monitor.account-refresh-interval-ms:5000}")
    public void scheduledRefresh() {
        if (!terminalTransport.isConnected()) {
            return;
        }
        try {
            refresh();
        } catch (RuntimeException e) {
            log.warn("Account refresh failed: {}", e.getMessage());
        }
    }

    /** Pulls account and positions from the terminal and publishes an AccountRefreshedEvent. */
    public synchronized AccountSnapshot refresh() {
        TerminalResponse account = terminalTransport.request(TerminalRequest.of(TerminalAction.GET_ACCOUNT_INFO));
        if (!account.isSuccess()) {
            throw new TransportException("Account info unavailable: " + account.getError());
        }
        TerminalResponse positionsResponse = terminalTransport.request(TerminalRequest.of(TerminalAction.GET_POSITIONS));
        if (!positionsResponse.isSuccess()) {
            throw new TransportException("Positions unavailable: " + positionsResponse.getError());
        }

        BigDecimal balance = money(account.getDouble("balance", 0));
        BigDecimal equity = money(account.getDouble("equity", balance.doubleValue()));
        Instant now = clock.instant();

        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        if (!today.equals(tradingDay)) {
            if (tradingDay != null) {
                log.info("Trading day rolled over to {}; start balance {}", today, balance);
            }
            tradingDay = today;
            dailyStartBalance = balance;
        }
        if (equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }

        Map<String, OpenPosition> positions = new LinkedHashMap<>();
        for (Map<String, Object> view : positionsResponse.getList("positions")) {
            OpenPosition position = toOpenPosition(view);
            positions.put(position.getTicket(), position);
        }

        List<OpenPosition> closed = new ArrayList<>();
        for (OpenPosition previous : lastPositions.values()) {
            if (!positions.containsKey(previous.getTicket())) {
                closed.add(previous);
                recordClosedTrade(previous.getProfit());
            }
        }
        lastPositions = positions;

        AccountSnapshot snapshot = AccountSnapshot.builder()
                .balance(balance)
                .equity(equity)
                .dailyStartBalance(dailyStartBalance)
                .dailyPnl(equity.subtract(dailyStartBalance))
                .peakEquity(peakEquity)
                .openPositions(List.copyOf(positions.values()))
                .capturedAt(now)
                .build();
        current.set(snapshot);
        if (!closed.isEmpty()) {
            log.info("{} position(s) closed since last refresh: {}", closed.size(),
                    closed.stream().map(OpenPosition::getTicket).toList());
        }
        log.debug("Account refreshed: balance={}, equity={}, dailyPnl={}, positions={}",
                balance, equity, snapshot.getDailyPnl(), positions.size());
        eventPublisherHelper.publishAccountRefreshed(this, snapshot, closed);
        return snapshot;
    }

    public AccountSnapshot current() {
        return current.get();
    }

    /** Counts consecutive losing closes; a winning close resets the streak, breakeven leaves it. */
    public void recordClosedTrade(BigDecimal profit) {
        if (profit == null || profit.signum() == 0) {
            return;
        }
        if (profit.signum() < 0) {
            int losses = consecutiveLosses.incrementAndGet();
            log.info("Losing trade closed ({}); consecutive losses={}", profit, losses);
        } else {
            consecutiveLosses.set(0);
        }
    }

    public int getConsecutiveLosses() {
        return consecutiveLosses.get();
    }

    /** Maps a terminal position view ({@code ticket, symbol, type, volume, ...}) to an OpenPosition. */
    public static OpenPosition toOpenPosition(Map<String, Object> view) {
        Object openTime = view.get("openTime");
        return OpenPosition.builder()
                .ticket(String.valueOf(view.get("ticket")))
                .symbol(view.get("symbol") != null ? view.get("symbol").toString() : null)
                .side(TradeSide.fromWire(view.get("type")).orElse(null))
                .volume(decimal(view.get("volume")))
                .openPrice(decimal(view.get("openPrice")))
                .currentPrice(decimal(view.get("currentPrice")))
                .stopLoss(decimal(view.get("stopLoss")))
                .takeProfit(decimal(view.get("takeProfit")))
                .profit(decimal(view.get("profit")))
                .strategyId(blankToNull(view.get("comment")))
                .openedAt(openTime instanceof Number millis ? Instant.ofEpochMilli(millis.longValue()) : null)
                .build();
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(Object value) {
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
