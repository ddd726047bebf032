package com.example.support.persistence;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import com.example.support.service.TicketRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Primary
@Component
@RequiredArgsConstructor
public class RetryingTicketRepository implements TicketRepository {

    private final JpaTicketRepository delegate;
    private final StorageRetryExecutor retryExecutor;

    @Override
    public Ticket create(Ticket draft) {
        return retryExecutor.execute("ticket.create", () -> delegate.create(draft));
    }

    @Override
    public Optional<Ticket> findById(long ticketId) {
        return retryExecutor.execute("ticket.findById", () -> delegate.findById(ticketId));
    }

    @Override
    public Optional<Ticket> findByThreadId(long threadId) {
        return retryExecutor.execute("ticket.findByThreadId", () -> delegate.findByThreadId(threadId));
    }

    @Override
    public Optional<Ticket> findLastOpen(String externalIdentity) {
        return retryExecutor.execute("ticket.findLastOpen", () -> delegate.findLastOpen(externalIdentity));
    }

    @Override
    public Optional<Ticket> findLastAwaitingConfirmation(String externalIdentity) {
        return retryExecutor.execute("ticket.findLastAwaitingConfirmation",
                () -> delegate.findLastAwaitingConfirmation(externalIdentity));
    }

    @Override
    public boolean assignThread(long ticketId, long threadId, String subject) {
        return retryExecutor.execute("ticket.assignThread", () -> delegate.assignThread(ticketId, threadId, subject));
    }

    @Override
    public void updateStatus(long ticketId, TicketStatus status) {
        retryExecutor.run("ticket.updateStatus", () -> delegate.updateStatus(ticketId, status));
    }

    @Override
    public boolean updateRating(long ticketId, int rating) {
        return retryExecutor.execute("ticket.updateRating", () -> delegate.updateRating(ticketId, rating));
    }

    @Override
    public boolean confirmResolution(long ticketId) {
        return retryExecutor.execute("ticket.confirmResolution", () -> delegate.confirmResolution(ticketId));
    }
}
