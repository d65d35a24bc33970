package com.tradeexecutor.event;

import com.tradeexecutor.domain.model.Signal;
import org.springframework.context.ApplicationEvent;

/** Published when a strategy tick emits a trade signal that passed the safety gate. */
public class SignalEvent extends ApplicationEvent {

    private final Signal signal;

    public SignalEvent(Object source, Signal signal) {
        super(source);
        this.signal = signal;
    }

    public Signal getSignal() {
        return signal;
    }
}
