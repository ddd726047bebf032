package com.example.support.event;

public enum TicketEventType {
    CREATED,
    REOPENED,
    CLOSED,
    RESOLVED,
    RATED
}
