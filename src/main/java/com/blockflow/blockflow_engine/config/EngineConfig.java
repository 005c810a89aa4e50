package com.blockflow.blockflow_engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    public static final String TOOL_EXECUTOR = "toolTaskExecutor";
    public static final String RUN_EXECUTOR  = "runTaskExecutor";

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .build();
    }

    // Tool HTTP calls block a thread each; the pool bounds how many run at once
    @Bean(name = TOOL_EXECUTOR)
    public ThreadPoolTaskExecutor toolTaskExecutor(EngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getToolPoolSize());
        executor.setMaxPoolSize(properties.getToolPoolSize());
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("bf-tool-");
        executor.initialize();
        return executor;
    }

    // Coordinators of runs triggered with async=true
    @Bean(name = RUN_EXECUTOR)
    public ThreadPoolTaskExecutor runTaskExecutor(EngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRunPoolSize());
        executor.setMaxPoolSize(properties.getRunPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("bf-run-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
