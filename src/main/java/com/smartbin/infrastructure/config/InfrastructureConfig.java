package com.smartbin.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Beans de infraestructura compartidos: reloj UTC y cliente HTTP.
 */
@Configuration
public class InfrastructureConfig {

    @Value("${http.client.connection-timeout-ms:5000}")
    private long connectionTimeoutMs;

    @Value("${http.client.read-timeout-ms:10000}")
    private long readTimeoutMs;

    /**
     * Reloj del sistema en UTC. Todas las marcas de tiempo se guardan en UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectionTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
