package com.example.support.config;

import java.time.Duration;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client for discussion threads, participant sets and the optional conversation state
 * store. Connection settings come from {@code spring.data.redis}; command retries follow the
 * storage retry budget.
 */
@Configuration
public class RedissonConfig {

    private static final String CLIENT_NAME = "support-ticket-router";

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redis, SupportProperties supportProperties) {
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer();
        server.setAddress(address(redis));
        server.setDatabase(redis.getDatabase());
        server.setClientName(CLIENT_NAME);
        if (StringUtils.hasText(redis.getUsername())) {
            server.setUsername(redis.getUsername());
        }
        if (StringUtils.hasText(redis.getPassword())) {
            server.setPassword(redis.getPassword());
        }
        server.setTimeout(millis(redis.getTimeout(), Duration.ofSeconds(3)));
        server.setConnectTimeout(millis(redis.getConnectTimeout(), Duration.ofSeconds(10)));

        SupportProperties.Storage storage = supportProperties.getStorage();
        server.setRetryAttempts(Math.max(0, storage.getMaxAttempts() - 1));
        server.setRetryInterval(millis(storage.getRetryBaseDelay(), Duration.ofMillis(500)));
        return Redisson.create(config);
    }

    private static String address(RedisProperties redis) {
        boolean ssl = redis.getSsl() != null && redis.getSsl().isEnabled();
        return "%s://%s:%d".formatted(ssl ? "rediss" : "redis", redis.getHost(), redis.getPort());
    }

    private static int millis(Duration value, Duration fallback) {
        return (int) (value != null ? value : fallback).toMillis();
    }
}
