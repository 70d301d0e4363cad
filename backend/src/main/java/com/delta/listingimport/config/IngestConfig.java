package com.delta.listingimport.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class IngestConfig {

    @Bean(name = "backgroundExecutor", destroyMethod = "shutdownNow")
    public ExecutorService backgroundExecutor(IngestProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getBackgroundConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdownNow")
    public ExecutorService httpExecutor(IngestProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
