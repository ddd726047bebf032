package com.example.support.transport;

/**
 * Anything the transport hands to the dispatcher.
 */
public interface SupportEvent {

    EventOrigin getOrigin();

    /**
     * Conversation identity for user events, staff group id for staff events.
     */
    String getChatId();

    /**
     * Discussion thread the event happened in, {@code null} outside of threads.
     */
    Long getThreadId();
}
