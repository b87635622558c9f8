package com.filelink.api.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Every "now" in the service comes from here
    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, FileLinkProperties properties) {
        return builder
                .setConnectTimeout(properties.getFetch().getConnectTimeout())
                .setReadTimeout(properties.getFetch().getReadTimeout())
                .build();
    }

    // Broadcast deliveries run here so a slow recipient never holds the admin request
    @Bean
    public ThreadPoolTaskExecutor broadcastExecutor(FileLinkProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBroadcast().getPoolSize());
        executor.setMaxPoolSize(properties.getBroadcast().getPoolSize());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("broadcast-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor fetchExecutor(FileLinkProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetch().getWorkers());
        executor.setMaxPoolSize(properties.getFetch().getWorkers());
        executor.setQueueCapacity(properties.getFetch().getQueueCapacity());
        executor.setThreadNamePrefix("fetch-");
        executor.initialize();
        return executor;
    }
}
