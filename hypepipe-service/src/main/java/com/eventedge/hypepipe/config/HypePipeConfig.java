package com.eventedge.hypepipe.config;

import com.eventedge.hypepipe.cache.InMemoryResultCache;
import com.eventedge.hypepipe.cache.ResultCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class HypePipeConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Single-process result cache shared by every dispatch. */
    @Bean
    public ResultCache resultCache() {
        return new InMemoryResultCache();
    }
}
