package com.tradeexecutor.unit.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradeexecutor.api.controller.StrategyController;
import com.tradeexecutor.command.CommandPipeline;
import com.tradeexecutor.command.CommandReceipt;
import com.tradeexecutor.config.ApiResponseAdvice;
import com.tradeexecutor.domain.enums.CommandKind;
import com.tradeexecutor.domain.enums.CommandPriority;
import com.tradeexecutor.domain.enums.CommandStatus;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.exception.GlobalExceptionHandler;
import com.tradeexecutor.monitor.StrategyRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Unit tests for StrategyController: listing and lifecycle requests routed through the pipeline. */
@ExtendWith(MockitoExtension.class)
class StrategyControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private CommandPipeline commandPipeline;

    private StrategyRegistry strategyRegistry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        strategyRegistry = new StrategyRegistry();
        StrategyController controller =
                new StrategyController(strategyRegistry, commandPipeline, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private void register(String id) {
        strategyRegistry.register(ActiveStrategy.builder()
                .id(id)
                .name("RSI reversal")
                .symbols(List.of("EURUSD"))
                .timeframe(Timeframe.H1)
                .build());
    }

    // ========================
    // QUERIES
    // ========================

    @Nested
    @DisplayName("GET /api/strategies")
    class Queries {

        @Test
        @DisplayName("Lists registered strategies")
        void list() throws Exception {
            register("s1");

            mockMvc.perform(get("/api/strategies"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].id").value("s1"))
                    .andExpect(jsonPath("$.data[0].timeframe").value("H1"));
        }

        @Test
        @DisplayName("Unknown strategy answers 404")
        void unknownNotFound() throws Exception {
            mockMvc.perform(get("/api/strategies/s9"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.message").value("Strategy not found: s9"));
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Nested
    @DisplayName("Lifecycle requests")
    class Lifecycle {

        @Test
        @DisplayName("Stop submits a HIGH priority STOP_STRATEGY even for an unknown strategy")
        void stopUnknownSubmits() throws Exception {
            String commandId = "api_stop_strategy_s9_" + NOW.toEpochMilli();
            when(commandPipeline.submitCommand(any()))
                    .thenReturn(new CommandReceipt(commandId, CommandStatus.QUEUED, "Queued"));

            mockMvc.perform(post("/api/strategies/s9/stop"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.commandId").value(commandId));

            ArgumentCaptor<Command> captor = ArgumentCaptor.forClass(Command.class);
            verify(commandPipeline).submitCommand(captor.capture());
            Command command = captor.getValue();
            assertThat(command.getId()).isEqualTo(commandId);
            assertThat(command.getKind()).isEqualTo(CommandKind.STOP_STRATEGY);
            assertThat(command.getPriority()).isEqualTo(CommandPriority.HIGH);
            assertThat(command.getParameters()).containsEntry("strategyId", "s9");
        }

        @Test
        @DisplayName("Pause of a registered strategy is submitted")
        void pauseRegistered() throws Exception {
            register("s1");
            when(commandPipeline.submitCommand(any()))
                    .thenReturn(new CommandReceipt("id", CommandStatus.QUEUED, "Queued"));

            mockMvc.perform(post("/api/strategies/s1/pause"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("QUEUED"));
        }

        @Test
        @DisplayName("Pause and resume of an unknown strategy answer 404 without submitting")
        void pauseResumeUnknown() throws Exception {
            mockMvc.perform(post("/api/strategies/s9/pause")).andExpect(status().isNotFound());
            mockMvc.perform(post("/api/strategies/s9/resume"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
            verifyNoInteractions(commandPipeline);
        }
    }
}
