package com.gbu.assessment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    /**
     * Client for the AI service. Both timeouts are hard bounds: a slow generation
     * call must fall back instead of holding the start request open.
     */
    @Bean
    public RestTemplate aiRestTemplate(RestTemplateBuilder builder,
            @Value("${ai-service.base-url}") String baseUrl,
            @Value("${ai-service.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${ai-service.read-timeout-ms:8000}") long readTimeoutMs) {
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
