package com.example.support.config;

import com.example.support.persistence.StorageRetryExecutor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.util.TimeZone;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;

@Configuration
@EnableConfigurationProperties(SupportProperties.class)
public class SupportModuleConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer supportJacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .timeZone(TimeZone.getTimeZone("UTC"))
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageRetryExecutor storageRetryExecutor(SupportProperties supportProperties) {
        SupportProperties.Storage storage = supportProperties.getStorage();
        return new StorageRetryExecutor(storage.getMaxAttempts(), storage.getRetryBaseDelay(), new ThreadWaitSleeper());
    }
}
