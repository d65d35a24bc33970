package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "executor.pusher")
@Getter
@Setter
public class PusherConfig {

    /** When false the cloud channel is a no-op and commands arrive via POST /api/commands. */
    private boolean enabled = false;

    private String appKey = "";

    private String cluster = "mt1";

    /** Path on the platform that signs private-channel subscriptions. */
    private String authPath = "/api/pusher/auth";

    /** Overrides the derived socket URL; used to point at a local test server. */
    private String socketUrl = "";

    private long connectTimeoutMs = 10_000;

    public String resolveSocketUrl() {
        if (socketUrl != null && !socketUrl.isBlank()) {
            return socketUrl;
        }
        return "wss://ws-" + cluster + ".pusher.com/app/" + appKey + "?protocol=7&client=java&version=1.0";
    }
}
