package com.example.cloudinvestigator.config;

import com.example.cloudinvestigator.memory.AgentMemory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Shared learning memory. Every agent built by this context reads and
     * writes the same bounded history.
     */
    @Bean
    public AgentMemory agentMemory(InvestigatorProperties properties) {
        InvestigatorProperties.MemoryConfig cfg = properties.getMemory();
        return new AgentMemory(cfg.getMaxSuccesses(), cfg.getMaxFailures(), cfg.getMaxPatterns());
    }
}
