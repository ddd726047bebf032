package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.domain.ConversationState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Single-node store for local runs without Redis. Expired entries are swept on every save, so
 * conversations that are never looked up again do not accumulate.
 */
@Component
@Profile("in-memory-conversation-state")
public class InMemoryConversationStateStore implements ConversationStateStore {

    private final ConcurrentMap<String, ConversationState> states = new ConcurrentHashMap<>();
    private final SupportProperties supportProperties;
    private final Clock clock;

    public InMemoryConversationStateStore(SupportProperties supportProperties, Clock clock) {
        this.supportProperties = supportProperties;
        this.clock = clock;
    }

    @Override
    public Optional<ConversationState> find(String conversationId) {
        ConversationState state = states.get(conversationId);
        if (state == null) {
            return Optional.empty();
        }
        if (isExpired(state)) {
            states.remove(conversationId, state);
            return Optional.empty();
        }
        return Optional.of(state);
    }

    @Override
    public void save(ConversationState state) {
        state.setUpdatedAt(clock.instant());
        states.put(state.getConversationId(), state);
        evictExpired();
    }

    @Override
    public void clear(String conversationId) {
        states.remove(conversationId);
    }

    int size() {
        return states.size();
    }

    private void evictExpired() {
        states.values().removeIf(this::isExpired);
    }

    private boolean isExpired(ConversationState state) {
        Duration ttl = supportProperties.getIntake().getStateTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative() || state.getUpdatedAt() == null) {
            return false;
        }
        Instant expiresAt = state.getUpdatedAt().plus(ttl);
        return !clock.instant().isBefore(expiresAt);
    }
}
