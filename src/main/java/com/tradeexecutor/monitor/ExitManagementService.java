package com.tradeexecutor.monitor;

import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.safety.AccountStateService;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Applies runtime exit rules (trailing stops, partial closes) to open positions owned by
 * registered strategies.
 *
 * <p>Changes go out as MODIFY_POSITION and CLOSE_POSITION commands through the
 * {@link CommandPipeline}, so they share the dispatcher's rate limit, retries and reporting.
 * A partial close is sent at most once per ticket. The initial risk for partial exits is the
 * open-to-stop distance the first time a ticket is seen.
 */
@Service
public class ExitManagementService {

    private static final Logger log = LoggerFactory.getLogger(ExitManagementService.class);

    private final AccountStateService accountStateService;
    private final StrategyRegistry strategyRegistry;
    private final ExitRuleCalculator exitRuleCalculator;
    private final CommandPipeline commandPipeline;
    private final CommandConfig commandConfig;
    private final Clock clock;

    private final Map<String, BigDecimal> requestedStops = new ConcurrentHashMap<>();
    private final Map<String, Double> initialRisk = new ConcurrentHashMap<>();
    private final Set<String> partiallyClosed = ConcurrentHashMap.newKeySet();

    public ExitManagementService(
            AccountStateService accountStateService,
            StrategyRegistry strategyRegistry,
            ExitRuleCalculator exitRuleCalculator,
            CommandPipeline commandPipeline,
            CommandConfig commandConfig,
            Clock clock) {
        this.accountStateService = accountStateService;
        this.strategyRegistry = strategyRegistry;
        this.exitRuleCalculator = exitRuleCalculator;
        this.commandPipeline = commandPipeline;
        this.commandConfig = commandConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${executor.monitor.exit-management-interval-ms:10000}",
            initialDelayString = "${executor.monitor.exit-management-interval-ms:10000}")
    public void scheduledRun() {
        try {
            manage();
        } catch (RuntimeException e) {
            log.warn("Exit management pass failed: {}", e.getMessage());
        }
    }

    /** One pass over the current open positions; returns the number of commands submitted. */
    public int manage() {
        List<OpenPosition> positions = accountStateService.current().getOpenPositions();
        forgetClosed(positions);

        int submitted = 0;
        for (OpenPosition position : positions) {
            if (position.getStrategyId() == null || position.getTicket() == null) {
                continue;
            }
            Optional<ActiveStrategy> strategy = strategyRegistry.get(position.getStrategyId());
            if (strategy.isEmpty() || !strategy.get().getExitRules().hasRuntimeManagement()) {
                continue;
            }
            submitted += manage(position, strategy.get().getExitRules());
        }
        return submitted;
    }

    private int manage(OpenPosition position, ExitRules rules) {
        String ticket = position.getTicket();
        initialRisk.computeIfAbsent(ticket, t -> riskOf(position));
        int submitted = 0;

        Optional<BigDecimal> newStop = exitRuleCalculator.trailingStop(position, rules.getTrailingStop());
        if (newStop.isPresent() && !newStop.get().equals(requestedStops.get(ticket))) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("ticket", ticket);
            params.put("symbol", position.getSymbol());
            params.put("stopLoss", newStop.get());
            log.info("Trailing stop for ticket {} ({}) moved to {}", ticket, position.getSymbol(), newStop.get());
            requestedStops.put(ticket, newStop.get());
            submit(CommandKind.MODIFY_POSITION, ticket, params);
            submitted++;
        }

        if (!partiallyClosed.contains(ticket)) {
            Optional<BigDecimal> closeVolume = exitRuleCalculator.partialExitVolume(
                    position, rules.getPartialExit(), initialRisk.getOrDefault(ticket, 0.0));
            if (closeVolume.isPresent()) {
                partiallyClosed.add(ticket);
                log.info("Partial exit for ticket {} ({}): closing {} lots", ticket, position.getSymbol(), closeVolume.get());
                submit(CommandKind.CLOSE_POSITION, ticket, Map.of("ticket", ticket, "volume", closeVolume.get()));
                submitted++;
            }
        }
        return submitted;
    }

    private void submit(CommandKind kind, String ticket, Map<String, Object> params) {
        commandPipeline.submitCommand(Command.builder()
                .id("exit_" + ticket + "_" + kind.name().toLowerCase(Locale.ROOT) + "_" + clock.millis())
                .kind(kind)
                .parameters(params)
                .priority(CommandPriority.HIGH)
                .createdAt(clock.instant())
                .maxRetries(commandConfig.getMaxRetries())
                .build());
    }

    private static double riskOf(OpenPosition position) {
        if (position.getOpenPrice() == null || position.getStopLoss() == null || position.getStopLoss().signum() <= 0) {
            return 0.0;
        }
        return position.getOpenPrice().subtract(position.getStopLoss()).abs().doubleValue();
    }

    private void forgetClosed(List<OpenPosition> positions) {
        Set<String> open = positions.stream()
                .map(OpenPosition::getTicket)
                .filter(t -> t != null)
                .collect(Collectors.toSet());
        requestedStops.keySet().retainAll(open);
        initialRisk.keySet().retainAll(open);
        partiallyClosed.retainAll(open);
    }
}
