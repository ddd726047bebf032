package com.example.support.event;

public interface TicketEventListener {

    void onTicketEvent(TicketEvent event);
}
