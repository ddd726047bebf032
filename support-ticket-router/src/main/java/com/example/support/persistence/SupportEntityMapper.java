package com.example.support.persistence;

import com.example.support.domain.Account;
import com.example.support.domain.OrderSummary;
import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import org.springframework.stereotype.Component;

@Component
public class SupportEntityMapper {

    public TicketEntity toEntity(Ticket ticket) {
        TicketEntity entity = new TicketEntity();
        entity.setId(ticket.getId());
        entity.setExternalIdentity(ticket.getExternalIdentity());
        entity.setAccountId(ticket.getAccountId());
        entity.setThreadId(ticket.getThreadId());
        entity.setSubject(ticket.getSubject());
        entity.setStoreId(ticket.getStoreId());
        entity.setCategory(ticket.getCategory());
        entity.setOrderNumber(ticket.getOrderNumber());
        entity.setDescription(ticket.getDescription());
        entity.setBranch(ticket.getBranch());
        entity.setStatus(defaultStatus(ticket.getStatus()));
        entity.setRating(ticket.getRating());
        entity.setClosed(ticket.isClosed());
        entity.setResolutionConfirmed(ticket.isResolutionConfirmed());
        entity.setCreatedAt(ticket.getCreatedAt());
        entity.setClosedAt(ticket.getClosedAt());
        return entity;
    }

    public Ticket toTicket(TicketEntity entity) {
        if (entity == null) {
            return null;
        }
        return Ticket.builder()
                .id(entity.getId())
                .externalIdentity(entity.getExternalIdentity())
                .accountId(entity.getAccountId())
                .threadId(entity.getThreadId())
                .subject(entity.getSubject())
                .storeId(entity.getStoreId())
                .category(entity.getCategory())
                .orderNumber(entity.getOrderNumber())
                .description(entity.getDescription())
                .branch(entity.getBranch())
                .status(defaultStatus(entity.getStatus()))
                .rating(entity.getRating())
                .closed(entity.isClosed())
                .resolutionConfirmed(entity.isResolutionConfirmed())
                .createdAt(entity.getCreatedAt())
                .closedAt(entity.getClosedAt())
                .build();
    }

    public Account toAccount(AccountEntity entity) {
        if (entity == null) {
            return null;
        }
        return Account.builder()
                .id(entity.getId())
                .name(entity.getName())
                .phone(entity.getPhone())
                .externalIdentity(entity.getExternalIdentity())
                .build();
    }

    public OrderSummary toOrder(OrderEntity entity) {
        if (entity == null) {
            return null;
        }
        return OrderSummary.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .orderNumber(entity.getOrderNumber())
                .storeId(entity.getStoreId())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private TicketStatus defaultStatus(TicketStatus status) {
        return status != null ? status : TicketStatus.OPEN;
    }
}
