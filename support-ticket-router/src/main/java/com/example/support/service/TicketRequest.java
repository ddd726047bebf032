package com.example.support.service;

import com.example.support.domain.Account;
import com.example.support.transport.InboundMessage;
import lombok.Builder;
import lombok.Value;

/**
 * Everything intake collected for a new ticket.
 */
@Value
@Builder
public class TicketRequest {

    /**
     * The description message itself; forwarded instead when an open ticket already exists.
     */
    InboundMessage message;

    Account account;
    String category;
    String orderNumber;
    String description;

    public String getExternalIdentity() {
        return message.getChatId();
    }

    public boolean hasOrderNumber() {
        return orderNumber != null && !orderNumber.isBlank() && !SupportTexts.ORDER_NOT_SPECIFIED.equals(orderNumber);
    }
}
