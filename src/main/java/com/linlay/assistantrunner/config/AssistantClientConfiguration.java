package com.linlay.assistantrunner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class AssistantClientConfiguration {

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider assistantConnectionProvider() {
        return ConnectionProvider.builder("assistant-pool")
                .maxConnections(500)
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }
}
