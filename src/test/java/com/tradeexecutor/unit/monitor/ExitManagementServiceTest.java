package com.tradeexecutor.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.doubleThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.PartialExitRule;
import com.tradeexecutor.domain.model.TrailingStopRule;
import com.tradeexecutor.monitor.ExitManagementService;
import com.tradeexecutor.monitor.ExitRuleCalculator;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.safety.AccountStateService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for ExitManagementService command emission; the price math lives in ExitRuleCalculatorTest. */
class ExitManagementServiceTest {

    private AccountStateService accountStateService;
    private StrategyRegistry strategyRegistry;
    private ExitRuleCalculator exitRuleCalculator;
    private CommandPipeline commandPipeline;
    private ExitManagementService service;

    private final TrailingStopRule trailing =
            TrailingStopRule.builder().enabled(true).activationPips(20).distancePips(10).build();
    private final PartialExitRule partial =
            PartialExitRule.builder().enabled(true).atRiskMultiple(1.0).closeFraction(0.5).build();

    @BeforeEach
    void setUp() {
        accountStateService = mock(AccountStateService.class);
        strategyRegistry = new StrategyRegistry();
        exitRuleCalculator = mock(ExitRuleCalculator.class);
        commandPipeline = mock(CommandPipeline.class);
        when(exitRuleCalculator.trailingStop(any(), any())).thenReturn(Optional.empty());
        when(exitRuleCalculator.partialExitVolume(any(), any(), anyDouble())).thenReturn(Optional.empty());
        service = new ExitManagementService(
                accountStateService,
                strategyRegistry,
                exitRuleCalculator,
                commandPipeline,
                new CommandConfig(),
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));

        strategyRegistry.register(ActiveStrategy.builder()
                .id("s1")
                .name("s1")
                .symbols(List.of("EURUSD"))
                .exitRules(ExitRules.builder().trailingStop(trailing).partialExit(partial).build())
                .build());
        strategyRegistry.register(ActiveStrategy.builder().id("plain").name("plain").symbols(List.of("EURUSD")).build());
    }

    private void givenPositions(OpenPosition... positions) {
        when(accountStateService.current()).thenReturn(AccountSnapshot.builder().openPositions(List.of(positions)).build());
    }

    private static OpenPosition position(String ticket, String strategyId) {
        return OpenPosition.builder()
                .ticket(ticket)
                .symbol("EURUSD")
                .side(TradeSide.BUY)
                .volume(new BigDecimal("0.20"))
                .openPrice(new BigDecimal("1.08500"))
                .stopLoss(new BigDecimal("1.08000"))
                .strategyId(strategyId)
                .build();
    }

    @Test
    @DisplayName("A moved trailing stop is sent once as a HIGH priority MODIFY_POSITION")
    void trailingStopSentOnce() {
        givenPositions(position("101", "s1"));
        when(exitRuleCalculator.trailingStop(any(), eq(trailing))).thenReturn(Optional.of(new BigDecimal("1.08800")));

        assertThat(service.manage()).isEqualTo(1);
        assertThat(service.manage()).isZero();

        ArgumentCaptor<Command> captor = ArgumentCaptor.forClass(Command.class);
        verify(commandPipeline).submitCommand(captor.capture());
        Command command = captor.getValue();
        assertThat(command.getKind()).isEqualTo(CommandKind.MODIFY_POSITION);
        assertThat(command.getPriority()).isEqualTo(CommandPriority.HIGH);
        assertThat(command.getParameters()).containsEntry("ticket", "101").containsEntry("stopLoss", new BigDecimal("1.08800"));
    }

    @Test
    @DisplayName("A partial exit closes part of the ticket once, using the initial open-to-stop risk")
    void partialExitOnce() {
        givenPositions(position("101", "s1"));
        when(exitRuleCalculator.partialExitVolume(any(), eq(partial), anyDouble()))
                .thenReturn(Optional.of(new BigDecimal("0.10")));

        service.manage();
        service.manage();

        verify(exitRuleCalculator).partialExitVolume(any(), eq(partial), doubleThat(risk -> Math.abs(risk - 0.005) < 1e-9));
        ArgumentCaptor<Command> captor = ArgumentCaptor.forClass(Command.class);
        verify(commandPipeline, times(1)).submitCommand(captor.capture());
        assertThat(captor.getValue().getKind()).isEqualTo(CommandKind.CLOSE_POSITION);
        assertThat(captor.getValue().getParameters()).containsEntry("volume", new BigDecimal("0.10"));
    }

    @Test
    @DisplayName("Positions without a managed strategy are ignored")
    void unmanagedIgnored() {
        givenPositions(position("1", null), position("2", "plain"), position("3", "unknown"));

        assertThat(service.manage()).isZero();
        verify(exitRuleCalculator, never()).trailingStop(any(), any());
        verify(commandPipeline, never()).submitCommand(any());
    }

    @Test
    @DisplayName("A ticket that closes and reappears is managed afresh")
    void closedTicketForgotten() {
        when(exitRuleCalculator.trailingStop(any(), eq(trailing))).thenReturn(Optional.of(new BigDecimal("1.08800")));
        givenPositions(position("101", "s1"));
        service.manage();

        givenPositions();
        service.manage();
        givenPositions(position("101", "s1"));
        service.manage();

        verify(commandPipeline, times(2)).submitCommand(any());
    }
}
