package com.example.support.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scratch data of one conversation while it goes through intake. Never persisted with the ticket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState implements Serializable {

    private String conversationId;
    private ConversationStep step;
    private String category;
    private String orderNumber;
    @Builder.Default
    private Map<String, String> orderLabels = new LinkedHashMap<>();
    private Instant updatedAt;

    public static ConversationState start(String conversationId, ConversationStep step) {
        return ConversationState.builder()
                .conversationId(conversationId)
                .step(step)
                .build();
    }
}
