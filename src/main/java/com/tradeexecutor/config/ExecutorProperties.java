package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Identity of this executor instance.
 *
 * <p>Properties prefix: {@code executor.*}
 */
@Configuration
@ConfigurationProperties(prefix = "executor")
@Getter
@Setter
public class ExecutorProperties {

    /** Executor id registered with the control plane. Used in channel names and API paths. */
    private String id = "local-executor";

    /** Terminal driver. SIMULATED is the only bundled driver. */
    private String tradingMode = "SIMULATED";
}
