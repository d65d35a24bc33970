package com.tradeexecutor.platform;

import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.connection.ConnectionDriver;
import com.tradeexecutor.connection.ConnectionNames;
import com.tradeexecutor.connection.ConnectionSupervisor;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.monitor.StrategyRegistry;
import com.tradeexecutor.safety.KillSwitchService;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic heartbeat to the control plane. Its outcome is what the {@code platform-api}
 * connection state reflects: a success reports CONNECTED, and {@code maxMissedHeartbeats}
 * failures in a row report ERROR.
 */
@Service
public class HeartbeatService {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final PlatformApiClient platformApiClient;
    private final PlatformConfig platformConfig;
    private final ConnectionSupervisor connectionSupervisor;
    private final StrategyRegistry strategyRegistry;
    private final KillSwitchService killSwitchService;
    private final ExecutorProperties executorProperties;
    private final Clock clock;

    private final AtomicInteger missedHeartbeats = new AtomicInteger();

    public HeartbeatService(
            PlatformApiClient platformApiClient,
            PlatformConfig platformConfig,
            ConnectionSupervisor connectionSupervisor,
            StrategyRegistry strategyRegistry,
            KillSwitchService killSwitchService,
            ExecutorProperties executorProperties,
            Clock clock) {
        this.platformApiClient = platformApiClient;
        this.platformConfig = platformConfig;
        this.connectionSupervisor = connectionSupervisor;
        this.strategyRegistry = strategyRegistry;
        this.killSwitchService = killSwitchService;
        this.executorProperties = executorProperties;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${executor.platform.heartbeat-interval-ms:60000}",
            initialDelayString = "${executor.platform.heartbeat-interval-ms:60000}")
    public void scheduledHeartbeat() {
        if (!platformConfig.isConfigured()) {
            return;
        }
        beat();
    }

    /** Sends one heartbeat and updates the platform-api connection; returns whether it succeeded. */
    public boolean beat() {
        try {
            platformApiClient.sendHeartbeat(payload());
            if (missedHeartbeats.getAndSet(0) > 0) {
                log.info("Heartbeat recovered");
            }
            connectionSupervisor.reportConnected(ConnectionNames.PLATFORM_API);
            return true;
        } catch (PlatformApiException e) {
            int missed = missedHeartbeats.incrementAndGet();
            log.warn("Heartbeat failed ({} in a row): {}", missed, e.getMessage());
            if (missed >= platformConfig.getMaxMissedHeartbeats()) {
                connectionSupervisor.reportError(ConnectionNames.PLATFORM_API, "Missed " + missed + " heartbeats: " + e.getMessage());
            }
            return false;
        }
    }

    /** Driver for the supervisor: opening the platform-api connection is a successful heartbeat. */
    public ConnectionDriver driver() {
        return new ConnectionDriver() {
            @Override
            public void open() {
                platformApiClient.sendHeartbeat(payload());
                missedHeartbeats.set(0);
            }

            @Override
            public void close() {
                // stateless HTTP; nothing to release
            }
        };
    }

    public int getMissedHeartbeats() {
        return missedHeartbeats.get();
    }

    Map<String, Object> payload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executorId", executorProperties.getId());
        payload.put("status", killSwitchService.isTripped() ? "HALTED" : "ONLINE");
        payload.put("timestamp", clock.instant().toString());
        payload.put("activeStrategies", strategyRegistry.size());
        payload.put("killSwitchTripped", killSwitchService.isTripped());
        return payload;
    }
}
