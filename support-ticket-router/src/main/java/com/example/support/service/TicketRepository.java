package com.example.support.service;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import java.util.Optional;

public interface TicketRepository {

    /**
     * Persists a new open ticket without a thread and returns it with the assigned id.
     */
    Ticket create(Ticket draft);

    Optional<Ticket> findById(long ticketId);

    Optional<Ticket> findByThreadId(long threadId);

    /**
     * Most recent ticket of the identity in {@code OPEN} or {@code REOPENED} status.
     */
    Optional<Ticket> findLastOpen(String externalIdentity);

    /**
     * Most recent closed ticket whose resolution the user has not confirmed yet.
     */
    Optional<Ticket> findLastAwaitingConfirmation(String externalIdentity);

    /**
     * Binds the discussion thread and subject. Returns {@code false} when a thread was already set.
     */
    boolean assignThread(long ticketId, long threadId, String subject);

    void updateStatus(long ticketId, TicketStatus status);

    /**
     * Stores the rating only when none is set yet and re-confirms the closed state.
     */
    boolean updateRating(long ticketId, int rating);

    /**
     * Marks a closed ticket as resolved by its owner. Returns {@code false} if it already was.
     */
    boolean confirmResolution(long ticketId);
}
