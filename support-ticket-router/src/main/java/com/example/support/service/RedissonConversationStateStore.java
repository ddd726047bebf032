package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.domain.ConversationState;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RMapCache;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Default intake state store. Entries live in a Redis map cache with a per-entry TTL, so abandoned
 * conversations expire without being read again and a restart does not drop them mid-intake.
 */
@Component
@Profile("!in-memory-conversation-state")
@RequiredArgsConstructor
public class RedissonConversationStateStore implements ConversationStateStore {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final SupportProperties supportProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private RMapCache<String, ConversationState> states;

    @PostConstruct
    void init() {
        TypedJsonJacksonCodec codec = new TypedJsonJacksonCodec(String.class, ConversationState.class, objectMapper);
        states = redissonClient.getMapCache(keyFactory.conversationStateMapKey(), codec);
    }

    @Override
    public Optional<ConversationState> find(String conversationId) {
        return Optional.ofNullable(states.get(conversationId));
    }

    @Override
    public void save(ConversationState state) {
        state.setUpdatedAt(clock.instant());
        Duration ttl = supportProperties.getIntake().getStateTtl();
        if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
            states.fastPut(state.getConversationId(), state, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            states.fastPut(state.getConversationId(), state);
        }
    }

    @Override
    public void clear(String conversationId) {
        states.fastRemove(conversationId);
    }
}
