package com.tradeexecutor.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for the control-plane API. Backed by the JDK HTTP client so PATCH (used for
 * command result reports) is supported.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate platformRestTemplate(RestTemplateBuilder builder, PlatformConfig platformConfig) {
        Duration timeout = Duration.ofMillis(platformConfig.getRequestTimeoutMs());
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        return builder.requestFactory(() -> requestFactory).build();
    }
}
