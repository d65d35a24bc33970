package com.tradeexecutor.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.config.PusherConfig;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.exception.CommandValidationException;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * REST client for the cloud control plane.
 *
 * <p>{@link #fetchActiveStrategies()}, {@link #sendHeartbeat(Map)} and
 * {@link #authorizeChannel(String, String)} throw {@link PlatformApiException} on failure so
 * callers can retry or report. Result and trade reports are best-effort: failures are logged
 * and swallowed at this boundary, never propagated into the command path.
 */
@Service
public class PlatformApiClient {

    private static final Logger log = LoggerFactory.getLogger(PlatformApiClient.class);

    private final RestTemplate restTemplate;
    private final PlatformConfig platformConfig;
    private final PusherConfig pusherConfig;
    private final ExecutorProperties executorProperties;
    private final StrategyDefinitionParser strategyDefinitionParser;

    public PlatformApiClient(
            @Qualifier("platformRestTemplate") RestTemplate restTemplate,
            PlatformConfig platformConfig,
            PusherConfig pusherConfig,
            ExecutorProperties executorProperties,
            StrategyDefinitionParser strategyDefinitionParser) {
        this.restTemplate = restTemplate;
        this.platformConfig = platformConfig;
        this.pusherConfig = pusherConfig;
        this.executorProperties = executorProperties;
        this.strategyDefinitionParser = strategyDefinitionParser;
    }

    public boolean isConfigured() {
        return platformConfig.isConfigured();
    }

    // ========================
    // STRATEGIES
    // ========================

    /**
     * Fetches the strategies the control plane considers active for this executor.
     *
     * <p>Accepts a bare array or an object carrying the array under {@code strategies} or
     * {@code data}. Entries that fail to parse are skipped with a warning.
     */
    public List<ActiveStrategy> fetchActiveStrategies() {
        requireConfigured();
        String url = executorUrl("/active-strategies");
        String body;
        try {
            ResponseEntity<String> response =
                    restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            body = response.getBody();
        } catch (RestClientException e) {
            throw new PlatformApiException("Failed to fetch active strategies: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = JsonHelper.readTree(body != null ? body : "[]");
        } catch (JsonProcessingException e) {
            throw new PlatformApiException("Malformed active strategies response", e);
        }

        JsonNode array = strategyArray(root);
        List<ActiveStrategy> strategies = new ArrayList<>();
        for (JsonNode entry : array) {
            try {
                strategies.add(strategyDefinitionParser.parse(entry));
            } catch (CommandValidationException e) {
                log.warn("Skipping invalid strategy from control plane: {}", e.getMessage());
            }
        }
        log.info("Fetched {} active strategies from control plane", strategies.size());
        return strategies;
    }

    private static JsonNode strategyArray(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        JsonNode strategies = root.path("strategies");
        if (strategies.isArray()) {
            return strategies;
        }
        JsonNode data = root.path("data");
        if (data.isArray()) {
            return data;
        }
        if (data.path("strategies").isArray()) {
            return data.path("strategies");
        }
        throw new PlatformApiException("Active strategies response has no strategy array");
    }

    // ========================
    // REPORTS (best-effort)
    // ========================

    public void reportCommandResult(CommandResult result) {
        if (!isConfigured()) {
            log.debug("Platform not configured, skipping result report for {}", result.getCommandId());
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("commandId", result.getCommandId());
        body.put("type", result.getKind());
        body.put("status", result.getStatus().name());
        body.put("message", result.getMessage());
        body.put("result", result.getData());
        body.put("attempts", result.getAttempts());
        body.put("completedAt", result.getCompletedAt() != null ? result.getCompletedAt().toString() : null);
        try {
            restTemplate.exchange(
                    executorUrl("/command"), HttpMethod.PATCH, new HttpEntity<>(body, headers()), String.class);
            log.debug("Reported result of {} ({})", result.getCommandId(), result.getStatus());
        } catch (RestClientException e) {
            log.warn("Failed to report result of {}: {}", result.getCommandId(), e.getMessage());
        }
    }

    public void reportTrade(Map<String, Object> trade) {
        if (!isConfigured()) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>(trade);
        body.put("executorId", executorProperties.getId());
        try {
            restTemplate.postForEntity(baseUrl() + "/api/trades", new HttpEntity<>(body, headers()), String.class);
            log.debug("Reported trade {}", trade.get("ticket"));
        } catch (RestClientException e) {
            log.warn("Failed to report trade {}: {}", trade.get("ticket"), e.getMessage());
        }
    }

    // ========================
    // HEARTBEAT / CHANNEL AUTH
    // ========================

    public void sendHeartbeat(Map<String, Object> status) {
        requireConfigured();
        try {
            restTemplate.postForEntity(executorUrl("/heartbeat"), new HttpEntity<>(status, headers()), String.class);
        } catch (RestClientException e) {
            throw new PlatformApiException("Heartbeat failed: " + e.getMessage(), e);
        }
    }

    /** Signs a private-channel subscription; returns the {@code auth} token to send to Pusher. */
    public String authorizeChannel(String socketId, String channelName) {
        requireConfigured();
        Map<String, Object> body = Map.of("socket_id", socketId, "channel_name", channelName);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl() + pusherConfig.getAuthPath(), new HttpEntity<>(body, headers()), String.class);
            JsonNode node = JsonHelper.readTree(response.getBody() != null ? response.getBody() : "{}");
            String auth = node.path("auth").asText(null);
            if (auth == null || auth.isBlank()) {
                throw new PlatformApiException("Channel auth response has no auth token");
            }
            return auth;
        } catch (RestClientException e) {
            throw new PlatformApiException("Channel authorization failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlatformApiException("Malformed channel auth response", e);
        }
    }

    // ========================
    // HELPERS
    // ========================

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(platformConfig.getApiKey());
        headers.set("X-Executor-Id", executorProperties.getId());
        headers.set("X-API-Key", platformConfig.getApiKey());
        return headers;
    }

    private String baseUrl() {
        String url = platformConfig.getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private String executorUrl(String suffix) {
        return baseUrl() + "/api/executor/" + executorProperties.getId() + suffix;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new PlatformApiException("Platform URL is not configured");
        }
    }
}
