package com.example.support.domain;

public enum TicketStatus {
    OPEN,
    REOPENED,
    CLOSED;

    /**
     * Open and reopened tickets are routed identically; the distinction is informational for staff.
     */
    public boolean isActive() {
        return this != CLOSED;
    }
}
