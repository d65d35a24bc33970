package com.tradeexecutor.monitor;

import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.event.SignalEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Bounded, newest-first view of emitted signals for the status surface. */
@Component
public class RecentSignalBuffer {

    private final int capacity;
    private final Deque<Signal> signals = new ArrayDeque<>();

    public RecentSignalBuffer(MonitorConfig monitorConfig) {
        this.capacity = Math.max(1, monitorConfig.getRecentSignalBuffer());
    }

    @EventListener
    public void onSignal(SignalEvent event) {
        add(event.getSignal());
    }

    public synchronized void add(Signal signal) {
        signals.addFirst(signal);
        while (signals.size() > capacity) {
            signals.pollLast();
        }
    }

    public synchronized List<Signal> recent(int limit) {
        List<Signal> result = new ArrayList<>(Math.min(limit, signals.size()));
        Iterator<Signal> iterator = signals.iterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        return result;
    }

    public synchronized int size() {
        return signals.size();
    }
}
