package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "executor.orchestrator")
@Getter
@Setter
public class OrchestratorConfig {

    /** Fatal errors (monitor halts, dispatcher crashes) tolerated inside the window before shutdown. */
    private int maxFatalErrors = 5;

    private long fatalErrorWindowMs = 300_000;

    /** Run startup (crash recovery, connections, reconciliation) on ApplicationReadyEvent. */
    private boolean autoStart = true;
}
