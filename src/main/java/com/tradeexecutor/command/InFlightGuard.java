package com.tradeexecutor.command;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keyed guard that lets at most one dispatch of a given command id run at a time, across
 * the queue consumer and the out-of-band executor.
 */
@Component
public class InFlightGuard {

    private static final Logger log = LoggerFactory.getLogger(InFlightGuard.class);

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /** Claims the id; false when another dispatch already holds it. */
    public boolean tryAcquire(String commandId) {
        boolean acquired = inFlight.add(commandId);
        if (!acquired) {
            log.warn("Command {} is already in flight, skipping duplicate dispatch", commandId);
        }
        return acquired;
    }

    public void release(String commandId) {
        inFlight.remove(commandId);
    }

    public boolean isInFlight(String commandId) {
        return inFlight.contains(commandId);
    }

    public int size() {
        return inFlight.size();
    }
}
