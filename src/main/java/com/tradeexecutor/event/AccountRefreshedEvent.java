package com.tradeexecutor.event;

import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.OpenPosition;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after each account refresh. {@code closedPositions} holds positions present in
 * the previous refresh but gone from this one, with their last known profit.
 */
public class AccountRefreshedEvent extends ApplicationEvent {

    private final AccountSnapshot snapshot;
    private final List<OpenPosition> closedPositions;

    public AccountRefreshedEvent(Object source, AccountSnapshot snapshot, List<OpenPosition> closedPositions) {
        super(source);
        this.snapshot = snapshot;
        this.closedPositions = closedPositions != null ? List.copyOf(closedPositions) : List.of();
    }

    public AccountSnapshot getSnapshot() {
        return snapshot;
    }

    public List<OpenPosition> getClosedPositions() {
        return closedPositions;
    }
}
