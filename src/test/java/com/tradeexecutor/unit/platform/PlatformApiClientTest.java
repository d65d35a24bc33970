package com.tradeexecutor.unit.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tradeexecutor.config.ExecutorProperties;
import com.tradeexecutor.config.PlatformConfig;
import com.tradeexecutor.config.PusherConfig;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.exception.PlatformApiException;
import com.tradeexecutor.platform.PlatformApiClient;
import com.tradeexecutor.platform.StrategyDefinitionParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/** Unit tests for PlatformApiClient against a mocked REST server. */
class PlatformApiClientTest {

    private static final String BASE = "https://platform.test";

    private MockRestServiceServer server;
    private PlatformConfig platformConfig;
    private PlatformApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        platformConfig = new PlatformConfig();
        platformConfig.setUrl(BASE + "/");
        platformConfig.setApiKey("key-123");
        ExecutorProperties executorProperties = new ExecutorProperties();
        executorProperties.setId("exec-1");
        client = new PlatformApiClient(
                restTemplate, platformConfig, new PusherConfig(), executorProperties, new StrategyDefinitionParser());
    }

    // ========================
    // ACTIVE STRATEGIES
    // ========================

    @Nested
    @DisplayName("fetchActiveStrategies")
    class FetchActiveStrategies {

        @Test
        @DisplayName("Reads a wrapped array and skips invalid entries")
        void wrappedArray() {
            server.expect(requestTo(BASE + "/api/executor/exec-1/active-strategies"))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(header("X-Executor-Id", "exec-1"))
                    .andExpect(header("Authorization", "Bearer key-123"))
                    .andRespond(withSuccess(
                            "{\"data\":{\"strategies\":[{\"id\":\"s1\",\"symbol\":\"EURUSD\"},{\"id\":\"s2\"}]}}",
                            MediaType.APPLICATION_JSON));

            List<ActiveStrategy> strategies = client.fetchActiveStrategies();

            assertThat(strategies).extracting(ActiveStrategy::getId).containsExactly("s1");
            server.verify();
        }

        @Test
        @DisplayName("A bare array is accepted")
        void bareArray() {
            server.expect(requestTo(BASE + "/api/executor/exec-1/active-strategies"))
                    .andRespond(withSuccess("[{\"id\":\"s1\",\"symbols\":[\"GBPUSD\"]}]", MediaType.APPLICATION_JSON));

            assertThat(client.fetchActiveStrategies()).hasSize(1);
        }

        @Test
        @DisplayName("Server errors and malformed bodies raise PlatformApiException")
        void failures() {
            server.expect(requestTo(BASE + "/api/executor/exec-1/active-strategies")).andRespond(withServerError());
            assertThatThrownBy(() -> client.fetchActiveStrategies()).isInstanceOf(PlatformApiException.class);

            server.reset();
            server.expect(requestTo(BASE + "/api/executor/exec-1/active-strategies"))
                    .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));
            assertThatThrownBy(() -> client.fetchActiveStrategies())
                    .isInstanceOf(PlatformApiException.class)
                    .hasMessage("Active strategies response has no strategy array");
        }

        @Test
        @DisplayName("An unconfigured platform fails fast without a request")
        void unconfigured() {
            platformConfig.setUrl("");

            assertThatThrownBy(() -> client.fetchActiveStrategies())
                    .isInstanceOf(PlatformApiException.class)
                    .hasMessage("Platform URL is not configured");
            server.verify();
        }
    }

    // ========================
    // REPORTS / HEARTBEAT / AUTH
    // ========================

    @Nested
    @DisplayName("Reports, heartbeat and channel auth")
    class Reports {

        @Test
        @DisplayName("Command results are PATCHed to the executor command endpoint")
        void reportResult() {
            server.expect(requestTo(BASE + "/api/executor/exec-1/command"))
                    .andExpect(method(HttpMethod.PATCH))
                    .andExpect(jsonPath("$.commandId").value("cmd-1"))
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andRespond(withSuccess());

            Command command = Command.builder().id("cmd-1").kind(CommandKind.GET_POSITIONS).parameters(Map.of()).build();
            client.reportCommandResult(CommandResult.completed(command, "ok", Map.of()));
            server.verify();
        }

        @Test
        @DisplayName("A failed trade report is logged, not thrown")
        void reportFailureSwallowed() {
            server.expect(requestTo(BASE + "/api/trades")).andRespond(withServerError());

            client.reportTrade(Map.of("ticket", 42));
            server.verify();
        }

        @Test
        @DisplayName("Heartbeat failures raise PlatformApiException")
        void heartbeatFailure() {
            server.expect(requestTo(BASE + "/api/executor/exec-1/heartbeat")).andRespond(withServerError());

            assertThatThrownBy(() -> client.sendHeartbeat(Map.of("status", "ONLINE")))
                    .isInstanceOf(PlatformApiException.class);
        }

        @Test
        @DisplayName("Channel auth returns the signed token")
        void channelAuth() {
            server.expect(requestTo(BASE + "/api/pusher/auth"))
                    .andExpect(jsonPath("$.channel_name").value("private-executor-exec-1"))
                    .andRespond(withSuccess("{\"auth\":\"app:sig\"}", MediaType.APPLICATION_JSON));

            assertThat(client.authorizeChannel("1.2", "private-executor-exec-1")).isEqualTo("app:sig");
        }
    }
}
