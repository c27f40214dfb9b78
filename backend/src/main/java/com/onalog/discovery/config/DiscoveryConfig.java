package com.onalog.discovery.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DiscoveryConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DiscoveryProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size, named("http"));
    }

    @Bean(name = "providerExecutor", destroyMethod = "shutdown")
    public ExecutorService providerExecutor() {
        return Executors.newFixedThreadPool(8, named("search-provider"));
    }

    @Bean(name = "extractionExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(DiscoveryProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getWorkerCount(), named("extraction"));
    }

    @Bean(name = "backfillExecutor", destroyMethod = "shutdown")
    public ExecutorService backfillExecutor() {
        return Executors.newCachedThreadPool(named("backfill"));
    }

    @Bean(name = "schedulerExecutor", destroyMethod = "shutdown")
    public ExecutorService schedulerExecutor() {
        return Executors.newSingleThreadExecutor(named("search-scheduler"));
    }

    @Bean(name = "schedulerTimer", destroyMethod = "shutdown")
    public ScheduledExecutorService schedulerTimer() {
        return Executors.newSingleThreadScheduledExecutor(named("search-timer"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
