package com.example.support.dto;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TicketResponse {
    Long id;
    String externalIdentity;
    Long accountId;
    Long threadId;
    String subject;
    String category;
    String orderNumber;
    String storeId;
    String description;
    String branch;
    TicketStatus status;
    Integer rating;
    boolean closed;
    boolean resolutionConfirmed;
    Instant createdAt;
    Instant closedAt;

    public static TicketResponse from(Ticket ticket) {
        return TicketResponse.builder()
                .id(ticket.getId())
                .externalIdentity(ticket.getExternalIdentity())
                .accountId(ticket.getAccountId())
                .threadId(ticket.getThreadId())
                .subject(ticket.getSubject())
                .category(ticket.getCategory())
                .orderNumber(ticket.getOrderNumber())
                .storeId(ticket.getStoreId())
                .description(ticket.getDescription())
                .branch(ticket.getBranch())
                .status(ticket.getStatus())
                .rating(ticket.getRating())
                .closed(ticket.isClosed())
                .resolutionConfirmed(ticket.isResolutionConfirmed())
                .createdAt(ticket.getCreatedAt())
                .closedAt(ticket.getClosedAt())
                .build();
    }
}
