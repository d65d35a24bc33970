package com.tradeexecutor.unit.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.transport.TerminalAction;
import com.tradeexecutor.transport.TerminalRequest;
import com.tradeexecutor.transport.TerminalResponse;
import com.tradeexecutor.transport.TerminalTransport;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for AccountStateService: snapshot building, day rollover, peak equity and closed-trade detection. */
class AccountStateServiceTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-03-02T10:00:00Z"));
    private final AtomicReference<Map<String, Object>> accountInfo = new AtomicReference<>();
    private final AtomicReference<List<Map<String, Object>>> positions = new AtomicReference<>(List.of());

    private TerminalTransport terminalTransport;
    private EventPublisherHelper eventPublisherHelper;
    private AccountStateService service;

    @BeforeEach
    void setUp() {
        terminalTransport = mock(TerminalTransport.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        when(terminalTransport.request(any())).thenAnswer(invocation -> {
            TerminalRequest request = invocation.getArgument(0);
            if (request.getAction() == TerminalAction.GET_ACCOUNT_INFO) {
                return TerminalResponse.ok(accountInfo.get());
            }
            return TerminalResponse.ok(Map.of("positions", positions.get()));
        });
        service = new AccountStateService(terminalTransport, eventPublisherHelper, clock);
    }

    private void givenAccount(double balance, double equity) {
        accountInfo.set(Map.of("balance", balance, "equity", equity));
    }

    private static Map<String, Object> position(long ticket, double profit) {
        return Map.of(
                "ticket", ticket,
                "symbol", "EURUSD",
                "type", "BUY",
                "volume", 0.1,
                "openPrice", 1.085,
                "profit", profit,
                "comment", "s1");
    }

    // ========================
    // SNAPSHOT
    // ========================

    @Nested
    @DisplayName("Snapshot")
    class Snapshot {

        @Test
        @DisplayName("First refresh anchors the day's start balance and peak equity")
        void firstRefresh() {
            givenAccount(10000, 9950);
            positions.set(List.of(position(101, -50)));

            AccountSnapshot snapshot = service.refresh();

            assertThat(snapshot.getBalance()).isEqualByComparingTo("10000");
            assertThat(snapshot.getDailyStartBalance()).isEqualByComparingTo("10000");
            assertThat(snapshot.getPeakEquity()).isEqualByComparingTo("9950");
            assertThat(snapshot.getDailyPnl()).isEqualByComparingTo("-50");
            assertThat(snapshot.getOpenPositions()).hasSize(1);
            OpenPosition open = snapshot.getOpenPositions().get(0);
            assertThat(open.getTicket()).isEqualTo("101");
            assertThat(open.getSide()).isEqualTo(TradeSide.BUY);
            assertThat(open.getStrategyId()).isEqualTo("s1");
            assertThat(service.current()).isSameAs(snapshot);
            verify(eventPublisherHelper).publishAccountRefreshed(any(), eq(snapshot), eq(List.of()));
        }

        @Test
        @DisplayName("Peak equity only rises")
        void peakEquityRatchets() {
            givenAccount(10000, 10400);
            service.refresh();
            givenAccount(10000, 10100);

            AccountSnapshot snapshot = service.refresh();

            assertThat(snapshot.getPeakEquity()).isEqualByComparingTo("10400");
            assertThat(snapshot.drawdown()).isEqualByComparingTo("300");
        }

        @Test
        @DisplayName("Start balance rolls over at UTC midnight")
        void dayRollover() {
            givenAccount(10000, 10000);
            service.refresh();
            givenAccount(9700, 9700);
            service.refresh();

            now.set(now.get().plus(Duration.ofDays(1)));
            AccountSnapshot nextDay = service.refresh();

            assertThat(nextDay.getDailyStartBalance()).isEqualByComparingTo("9700");
            assertThat(nextDay.getDailyPnl()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("A failed account request throws TransportException")
        void accountFailureThrows() {
            doReturn(TerminalResponse.failure("timeout")).when(terminalTransport).request(any());

            assertThatThrownBy(() -> service.refresh())
                    .isInstanceOf(TransportException.class)
                    .hasMessage("Account info unavailable: timeout");
        }
    }

    // ========================
    // CLOSED TRADES
    // ========================

    @Nested
    @DisplayName("Closed trades")
    class ClosedTrades {

        @Test
        @DisplayName("A ticket that disappears is reported closed and its loss counted")
        void disappearedTicketCounted() {
            givenAccount(10000, 10000);
            positions.set(List.of(position(101, -20), position(102, 5)));
            service.refresh();

            positions.set(List.of(position(102, 7)));
            service.refresh();

            assertThat(service.getConsecutiveLosses()).isEqualTo(1);
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<OpenPosition>> closed = ArgumentCaptor.forClass(List.class);
            verify(eventPublisherHelper, times(2))
                    .publishAccountRefreshed(any(), any(), closed.capture());
            assertThat(closed.getAllValues().get(1)).extracting(OpenPosition::getTicket).containsExactly("101");
        }

        @Test
        @DisplayName("A win resets the loss streak and breakeven leaves it")
        void lossStreak() {
            service.recordClosedTrade(new BigDecimal("-1"));
            service.recordClosedTrade(new BigDecimal("-2"));
            service.recordClosedTrade(BigDecimal.ZERO);
            assertThat(service.getConsecutiveLosses()).isEqualTo(2);

            service.recordClosedTrade(new BigDecimal("3"));
            assertThat(service.getConsecutiveLosses()).isZero();
        }
    }

    @Test
    @DisplayName("Position view mapping tolerates missing and blank fields")
    void positionViewMapping() {
        OpenPosition position = AccountStateService.toOpenPosition(
                Map.of("ticket", 7, "type", "SELL", "volume", "0.25", "comment", " ", "openTime", 1_700_000_000_000L));

        assertThat(position.getTicket()).isEqualTo("7");
        assertThat(position.getSide()).isEqualTo(TradeSide.SELL);
        assertThat(position.getVolume()).isEqualByComparingTo("0.25");
        assertThat(position.getStrategyId()).isNull();
        assertThat(position.getSymbol()).isNull();
        assertThat(position.getOpenedAt()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    }
}
