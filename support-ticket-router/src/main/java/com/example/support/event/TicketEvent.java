package com.example.support.event;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketEvent implements Serializable {

    private String eventId;
    private TicketEventType type;
    private Long ticketId;
    private Long threadId;
    private String externalIdentity;
    private TicketStatus status;
    private Integer rating;
    private Instant occurredAt;

    public static TicketEvent of(TicketEventType type, Ticket ticket, Instant occurredAt) {
        return TicketEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .ticketId(ticket.getId())
                .threadId(ticket.getThreadId())
                .externalIdentity(ticket.getExternalIdentity())
                .status(ticket.getStatus())
                .rating(ticket.getRating())
                .occurredAt(occurredAt)
                .build();
    }
}
