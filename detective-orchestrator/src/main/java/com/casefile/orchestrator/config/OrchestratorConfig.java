package com.casefile.orchestrator.config;

import com.casefile.orchestrator.ai.GenerateOptions;
import com.casefile.orchestrator.pipeline.PipelineSettings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${detective.bridge.base-url:http://localhost:8790}")
    private String bridgeUrl;

    @Value("${detective.pipeline.timeout-seconds:45}")
    private long timeoutSeconds;

    @Value("${detective.pipeline.photo-limit-days:30}")
    private int photoLimitDays;

    @Value("${detective.pipeline.calendar-since-days:30}")
    private int calendarSinceDays;

    @Value("${detective.pipeline.calendar-until-days:0}")
    private int calendarUntilDays;

    @Value("${detective.cache.ttl-minutes:5}")
    private long cacheTtlMinutes;

    @Value("${detective.narrator.max-tokens:768}")
    private int maxTokens;

    @Value("${detective.narrator.temperature:0.7}")
    private double temperature;

    @Value("${detective.narrator.top-p:0.9}")
    private double topP;

    @Bean
    public WebClient deviceBridgeClient(WebClient.Builder builder) {
        return builder.baseUrl(bridgeUrl).build();
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return new PipelineSettings(
            Duration.ofSeconds(timeoutSeconds),
            photoLimitDays,
            calendarSinceDays,
            calendarUntilDays,
            Duration.ofMinutes(cacheTtlMinutes));
    }

    @Bean
    public GenerateOptions generateOptions() {
        return new GenerateOptions(maxTokens, temperature, topP);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
