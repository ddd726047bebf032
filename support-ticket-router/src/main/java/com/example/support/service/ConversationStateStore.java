package com.example.support.service;

import com.example.support.domain.ConversationState;
import java.util.Optional;

/**
 * Intake scratch state keyed by conversation identity. Entries expire after the configured TTL.
 */
public interface ConversationStateStore {

    Optional<ConversationState> find(String conversationId);

    void save(ConversationState state);

    void clear(String conversationId);
}
