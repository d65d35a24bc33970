package com.tradeexecutor.transport;

import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Cloud channel used when Pusher is disabled. Commands then arrive through
 * {@code POST /api/commands}; results are only reported over REST.
 */
@Component
@ConditionalOnProperty(prefix = "executor.pusher", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoopCommandChannel implements CloudCommandChannel {

    private static final Logger log = LoggerFactory.getLogger(NoopCommandChannel.class);

    @Override
    public void connect() {
        log.info("Cloud channel disabled; accepting commands over REST only");
    }

    @Override
    public void disconnect() {}

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void send(String event, Map<String, Object> payload) {
        log.debug("Cloud channel disabled, dropping outbound {}", event);
    }

    @Override
    public void onMessage(CloudMessageListener listener) {}

    @Override
    public void onConnectionLost(Consumer<String> listener) {}
}
