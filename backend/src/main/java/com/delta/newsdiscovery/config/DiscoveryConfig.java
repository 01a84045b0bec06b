package com.delta.newsdiscovery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DiscoveryConfig {

    @Bean(name = "discoveryExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(DiscoveryProperties properties) {
        int size = Math.max(2, Math.min(properties.getGlobalConcurrency(), Math.max(1, properties.getSources().size())));
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DiscoveryProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
