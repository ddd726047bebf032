package com.example.support.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticket implements Serializable {

    private Long id;
    private String externalIdentity;
    private Long accountId;
    private Long threadId;
    private String subject;
    private String storeId;
    private String category;
    private String orderNumber;
    private String description;
    private String branch;
    private TicketStatus status;
    private Integer rating;
    private boolean closed;
    private boolean resolutionConfirmed;
    private Instant createdAt;
    private Instant closedAt;

    public boolean hasThread() {
        return threadId != null;
    }

    /**
     * A ticket counts as closed when either the flag or the status says so; the two can
     * disagree briefly when a closure races with the next user message.
     */
    public boolean isClosedState() {
        return closed || status == TicketStatus.CLOSED;
    }

    public boolean isAwaitingConfirmation() {
        return isClosedState() && !resolutionConfirmed;
    }
}
