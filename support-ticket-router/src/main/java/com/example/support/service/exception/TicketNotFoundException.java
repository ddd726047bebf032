package com.example.support.service.exception;

import org.springframework.http.HttpStatus;

public class TicketNotFoundException extends ServiceException {

    public TicketNotFoundException(String reference) {
        super(HttpStatus.NOT_FOUND, "Ticket not found: %s".formatted(reference), "ticket_not_found");
    }
}
