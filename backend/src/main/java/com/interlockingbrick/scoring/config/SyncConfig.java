package com.interlockingbrick.scoring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interlockingbrick.scoring.sync.HttpClientWrapper;
import com.interlockingbrick.scoring.sync.ReflectorClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SyncConfig {

    @Bean
    public HttpClientWrapper reflectorHttpClient(@Value("${scoring.sync.timeout-seconds:10}") long timeoutSeconds) {
        return new HttpClientWrapper.Default(Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public ReflectorClient reflectorClient(HttpClientWrapper reflectorHttpClient,
                                           ObjectMapper objectMapper,
                                           @Value("${scoring.sync.timeout-seconds:10}") long timeoutSeconds) {
        return new ReflectorClient(reflectorHttpClient, objectMapper, Duration.ofSeconds(timeoutSeconds));
    }
}
