package com.tradeexecutor.command;

import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.safety.AccountStateService;
import com.tradeexecutor.transport.TerminalAction;
import com.tradeexecutor.transport.TerminalRequest;
import com.tradeexecutor.transport.TerminalResponse;
import com.tradeexecutor.transport.TerminalTransport;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translates trade and query commands into terminal requests.
 *
 * <p>A {@link TransportException} escapes to the dispatcher, which retries it. A terminal
 * reply with {@code success=false} becomes a failed {@link ExecutionOutcome} and is final.
 *
 * <p>Bulk closes (CLOSE_ALL_POSITIONS, CLOSE_PROFITABLE, CLOSE_LOSING, CLOSE_BY_SYMBOL,
 * CLOSE_BY_STRATEGY) are expanded here from a fresh account snapshot into one CLOSE_TRADE per
 * ticket. Individual ticket failures are collected in the result rather than failing the batch.
 */
@Component
public class TerminalCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(TerminalCommandExecutor.class);

    /** Outcome of one terminal round trip (or batch of them). */
    public record ExecutionOutcome(boolean success, String message, Map<String, Object> data) {

        static ExecutionOutcome ok(String message, Map<String, Object> data) {
            return new ExecutionOutcome(true, message, withoutNulls(data));
        }

        static ExecutionOutcome rejected(String message) {
            return new ExecutionOutcome(false, message, Map.of());
        }
    }

    private final TerminalTransport terminalTransport;
    private final AccountStateService accountStateService;

    public TerminalCommandExecutor(TerminalTransport terminalTransport, AccountStateService accountStateService) {
        this.terminalTransport = terminalTransport;
        this.accountStateService = accountStateService;
    }

    public ExecutionOutcome execute(Command command) {
        CommandKind kind = command.getKind();
        return switch (kind) {
            case OPEN_POSITION -> openPosition(command);
            case CLOSE_POSITION -> closePosition(command);
            case MODIFY_POSITION -> modifyPosition(command);
            case CLOSE_ALL_POSITIONS -> closeMatching("all", p -> true);
            case CLOSE_PROFITABLE -> closeMatching("profitable", profitable(command.decimalParameter("minProfit")));
            case CLOSE_LOSING -> closeMatching("losing", losing(command.decimalParameter("maxLoss")));
            case CLOSE_BY_SYMBOL -> {
                String symbol = command.stringParameter("symbol");
                yield closeMatching(symbol, p -> symbol.equalsIgnoreCase(p.getSymbol()));
            }
            case CLOSE_BY_STRATEGY -> {
                String strategyId = command.stringParameter("strategyId");
                yield closeMatching("strategy " + strategyId, p -> strategyId.equals(p.getStrategyId()));
            }
            case GET_POSITIONS -> query(TerminalAction.GET_POSITIONS, Map.of());
            case GET_ACCOUNT_INFO -> query(TerminalAction.GET_ACCOUNT_INFO, Map.of());
            case GET_SYMBOL_INFO -> query(TerminalAction.GET_SYMBOL_INFO, params(command, "symbol"));
            default -> throw new IllegalArgumentException(kind + " is not a terminal command");
        };
    }

    // ========================
    // SINGLE-TICKET TRADES
    // ========================

    private ExecutionOutcome openPosition(Command command) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", command.stringParameter("symbol"));
        params.put("type", command.stringParameter("type"));
        params.put("volume", command.decimalParameter("volume"));
        putIfPresent(params, "price", command.decimalParameter("price"));
        putIfPresent(params, "stopLoss", command.decimalParameter("stopLoss"));
        putIfPresent(params, "takeProfit", command.decimalParameter("takeProfit"));
        String comment = command.hasParameter("comment")
                ? command.stringParameter("comment")
                : command.stringParameter("strategyId");
        putIfPresent(params, "comment", comment);
        putIfPresent(params, "magic", command.stringParameter("magic"));
        putIfPresent(params, "slippage", command.decimalParameter("slippage"));

        TerminalResponse response = send(TerminalRequest.of(TerminalAction.OPEN_TRADE, params));
        if (!response.isSuccess()) {
            return ExecutionOutcome.rejected("Open rejected by terminal: " + response.getError());
        }
        return ExecutionOutcome.ok("Opened ticket " + response.get("ticket"), response.getData());
    }

    private ExecutionOutcome closePosition(Command command) {
        Map<String, Object> params = params(command, "ticket");
        putIfPresent(params, "volume", command.decimalParameter("volume"));
        TerminalResponse response = send(TerminalRequest.of(TerminalAction.CLOSE_TRADE, params));
        if (!response.isSuccess()) {
            return ExecutionOutcome.rejected("Close rejected by terminal: " + response.getError());
        }
        return ExecutionOutcome.ok("Closed ticket " + command.stringParameter("ticket"), response.getData());
    }

    private ExecutionOutcome modifyPosition(Command command) {
        Map<String, Object> params = params(command, "ticket");
        putIfPresent(params, "stopLoss", command.decimalParameter("stopLoss"));
        putIfPresent(params, "takeProfit", command.decimalParameter("takeProfit"));
        TerminalResponse response = send(TerminalRequest.of(TerminalAction.MODIFY_TRADE, params));
        if (!response.isSuccess()) {
            return ExecutionOutcome.rejected("Modify rejected by terminal: " + response.getError());
        }
        return ExecutionOutcome.ok("Modified ticket " + command.stringParameter("ticket"), response.getData());
    }

    // ========================
    // BULK CLOSES
    // ========================

    private ExecutionOutcome closeMatching(String description, Predicate<OpenPosition> filter) {
        List<OpenPosition> targets = accountStateService.refresh().getOpenPositions().stream()
                .filter(filter)
                .toList();
        log.info("Closing {} {} position(s)", targets.size(), description);

        List<Map<String, Object>> results = new ArrayList<>();
        int closed = 0;
        for (OpenPosition position : targets) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("ticket", position.getTicket());
            entry.put("symbol", position.getSymbol());
            try {
                TerminalResponse response = send(
                        TerminalRequest.of(TerminalAction.CLOSE_TRADE, Map.of("ticket", position.getTicket())));
                entry.put("success", response.isSuccess());
                if (response.isSuccess()) {
                    closed++;
                } else {
                    entry.put("error", String.valueOf(response.getError()));
                }
            } catch (TransportException e) {
                log.error("Failed to close ticket {}: {}", position.getTicket(), e.getMessage());
                entry.put("success", false);
                entry.put("error", String.valueOf(e.getMessage()));
            }
            results.add(entry);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("results", results);
        data.put("totalClosed", closed);
        data.put("totalTargeted", targets.size());
        return ExecutionOutcome.ok("Closed " + closed + "/" + targets.size() + " " + description + " positions", data);
    }

    private static Predicate<OpenPosition> profitable(BigDecimal minProfit) {
        BigDecimal floor = minProfit != null ? minProfit : BigDecimal.ZERO;
        return p -> p.getProfit() != null && p.getProfit().compareTo(floor) > 0;
    }

    /** Losing positions; with {@code maxLoss} only those whose loss has reached it. */
    private static Predicate<OpenPosition> losing(BigDecimal maxLoss) {
        BigDecimal threshold = maxLoss != null ? maxLoss.abs() : BigDecimal.ZERO;
        return p -> p.isLosing() && p.getProfit().abs().compareTo(threshold) >= 0;
    }

    // ========================
    // QUERIES
    // ========================

    private ExecutionOutcome query(TerminalAction action, Map<String, Object> params) {
        TerminalResponse response = send(TerminalRequest.of(action, params));
        if (!response.isSuccess()) {
            return ExecutionOutcome.rejected(action + " failed: " + response.getError());
        }
        return ExecutionOutcome.ok(action + " ok", response.getData());
    }

    private TerminalResponse send(TerminalRequest request) {
        if (!terminalTransport.isConnected()) {
            throw new TransportException("Terminal not connected");
        }
        return terminalTransport.request(request);
    }

    private static Map<String, Object> params(Command command, String key) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(key, command.stringParameter(key));
        return params;
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        return copy;
    }
}
