package com.tradeexecutor.transport.pusher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.PusherConfig;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.mapper.JsonHelper;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.transport.CloudCommandChannel;
import com.tradeexecutor.transport.CloudMessageListener;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Cloud command channel over the Pusher websocket protocol (v7).
 *
 * <p>On connect the client waits for {@code pusher:connection_established}, signs the
 * private channel {@code private-executor-<id>} through the platform auth endpoint and
 * subscribes. Server-sent {@code data} fields are JSON strings and are handed to listeners
 * as-is. Reconnects are owned by the connection supervisor; this class only reports an
 * unexpected close to its loss listeners.
 */
@Component
@ConditionalOnProperty(prefix = "executor.pusher", name = "enabled", havingValue = "true")
public class PusherCommandChannel implements CloudCommandChannel {

    private static final Logger log = LoggerFactory.getLogger(PusherCommandChannel.class);

    private static final String EVENT_CONNECTION_ESTABLISHED = "pusher:connection_established";
    private static final String EVENT_PING = "pusher:ping";
    private static final String EVENT_PONG = "pusher:pong";
    private static final String EVENT_SUBSCRIBE = "pusher:subscribe";
    private static final String EVENT_ERROR = "pusher:error";
    private static final String EVENT_SUBSCRIBED = "pusher_internal:subscription_succeeded";

    private final PusherConfig pusherConfig;
    private final PlatformApiClient platformApiClient;
    private final String channelName;

    private final List<CloudMessageListener> messageListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> lossListeners = new CopyOnWriteArrayList<>();

    private volatile PusherSocketClient client;
    private volatile CountDownLatch established = new CountDownLatch(1);
    private volatile String socketId;
    private volatile boolean subscribed;
    private volatile boolean deliberateClose;

    public PusherCommandChannel(
            PusherConfig pusherConfig, PlatformApiClient platformApiClient, ExecutorProperties executorProperties) {
        this.pusherConfig = pusherConfig;
        this.platformApiClient = platformApiClient;
        this.channelName = "private-executor-" + executorProperties.getId();
    }

    // ========================
    // CONNECTION
    // ========================

    @Override
    public void connect() {
        deliberateClose = true;
        closeQuietly();
        deliberateClose = false;
        subscribed = false;
        socketId = null;
        established = new CountDownLatch(1);
        long timeoutMs = pusherConfig.getConnectTimeoutMs();
        try {
            client = new PusherSocketClient(new URI(pusherConfig.resolveSocketUrl()));
            if (!client.connectBlocking(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TransportException("Pusher socket did not open within " + timeoutMs + " ms");
            }
            if (!established.await(timeoutMs, TimeUnit.MILLISECONDS) || socketId == null) {
                throw new TransportException("Pusher connection not established within " + timeoutMs + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to Pusher", e);
        } catch (URISyntaxException e) {
            throw new TransportException("Invalid Pusher socket URL", e);
        }
        subscribe();
        log.info("Cloud channel connected: socket={}, channel={}", socketId, channelName);
    }

    @Override
    public void disconnect() {
        deliberateClose = true;
        closeQuietly();
        subscribed = false;
    }

    @Override
    public boolean isConnected() {
        PusherSocketClient current = client;
        return current != null && current.isOpen() && subscribed;
    }

    @Override
    public void onMessage(CloudMessageListener listener) {
        messageListeners.add(listener);
    }

    @Override
    public void onConnectionLost(Consumer<String> listener) {
        lossListeners.add(listener);
    }

    /** Publishes a client event on the private channel; dropped with a warning when offline. */
    @Override
    public void send(String event, Map<String, Object> payload) {
        PusherSocketClient current = client;
        if (current == null || !current.isOpen()) {
            log.warn("Cloud channel offline, dropping outbound {}", event);
            return;
        }
        ObjectNode message = JsonHelper.mapper().createObjectNode();
        message.put("event", event);
        message.put("channel", channelName);
        message.set("data", JsonHelper.mapper().valueToTree(payload));
        current.send(message.toString());
    }

    // ========================
    // PROTOCOL
    // ========================

    private void subscribe() {
        String auth = platformApiClient.authorizeChannel(socketId, channelName);
        ObjectNode message = JsonHelper.mapper().createObjectNode();
        message.put("event", EVENT_SUBSCRIBE);
        ObjectNode data = message.putObject("data");
        data.put("channel", channelName);
        data.put("auth", auth);
        client.send(message.toString());
        subscribed = true;
    }

    /** Visible for testing: routes one raw socket frame. */
    public void handleMessage(String raw) {
        JsonNode root;
        try {
            root = JsonHelper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable Pusher frame: {}", e.getOriginalMessage());
            return;
        }
        String event = root.path("event").asText("");
        JsonNode dataNode = root.path("data");
        String data = dataNode.isTextual() ? dataNode.asText() : dataNode.toString();

        switch (event) {
            case EVENT_CONNECTION_ESTABLISHED -> onEstablished(data);
            case EVENT_PING -> sendPong();
            case EVENT_SUBSCRIBED -> log.info("Subscribed to {}", root.path("channel").asText(channelName));
            case EVENT_ERROR -> log.warn("Pusher error: {}", data);
            default -> dispatch(event, data);
        }
    }

    private void onEstablished(String data) {
        try {
            socketId = JsonHelper.readTree(data).path("socket_id").asText(null);
        } catch (JsonProcessingException e) {
            log.warn("Malformed connection_established payload: {}", e.getOriginalMessage());
        }
        established.countDown();
    }

    private void sendPong() {
        PusherSocketClient current = client;
        if (current != null && current.isOpen()) {
            current.send("{\"event\":\"" + EVENT_PONG + "\",\"data\":{}}");
        }
    }

    private void dispatch(String event, String data) {
        if (event.startsWith("pusher")) {
            log.debug("Ignoring protocol event {}", event);
            return;
        }
        for (CloudMessageListener listener : messageListeners) {
            try {
                listener.onMessage(event, data);
            } catch (RuntimeException e) {
                log.error("Cloud message listener failed for {}: {}", event, e.getMessage(), e);
            }
        }
    }

    private void notifyLost(String reason) {
        subscribed = false;
        for (Consumer<String> listener : lossListeners) {
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                log.warn("Connection loss listener failed: {}", e.getMessage());
            }
        }
    }

    private void closeQuietly() {
        PusherSocketClient current = client;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.debug("Error closing Pusher socket: {}", e.getMessage());
            }
        }
    }

    private class PusherSocketClient extends WebSocketClient {

        PusherSocketClient(URI serverUri) {
            super(serverUri);
            this.setConnectionLostTimeout(120);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            log.debug("Pusher socket open (HTTP {})", handshake.getHttpStatus());
        }

        @Override
        public void onMessage(String message) {
            handleMessage(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            log.info("Pusher socket closed: {} (code {}, remote={})", reason, code, remote);
            established.countDown();
            if (!deliberateClose && client == this) {
                notifyLost("Pusher socket closed: " + reason + " (" + code + ")");
            }
        }

        @Override
        public void onError(Exception ex) {
            log.error("Pusher socket error: {}", ex.getMessage());
        }
    }
}
