package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "executor.persistence")
@Getter
@Setter
public class PersistenceConfig {

    /** {@code file} (default) or {@code redis}. */
    private String store = "file";

    /** Root directory of the file store. */
    private String directory = "./data";

    /** Key prefix of the Redis store. */
    private String redisKeyPrefix = "executor";
}
