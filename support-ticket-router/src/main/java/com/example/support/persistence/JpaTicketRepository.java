package com.example.support.persistence;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import com.example.support.service.TicketRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaTicketRepository implements TicketRepository {

    private static final EnumSet<TicketStatus> ACTIVE_STATUSES = EnumSet.of(TicketStatus.OPEN, TicketStatus.REOPENED);

    private final TicketJpaRepository ticketJpaRepository;
    private final SupportEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public Ticket create(Ticket draft) {
        TicketEntity entity = mapper.toEntity(draft);
        entity.setId(null);
        entity.setThreadId(null);
        entity.setStatus(TicketStatus.OPEN);
        entity.setClosed(false);
        entity.setResolutionConfirmed(false);
        entity.setClosedAt(null);
        entity.setRating(null);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(clock.instant());
        }
        return mapper.toTicket(ticketJpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ticket> findById(long ticketId) {
        return ticketJpaRepository.findById(ticketId).map(mapper::toTicket);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ticket> findByThreadId(long threadId) {
        return ticketJpaRepository.findFirstByThreadIdOrderByIdDesc(threadId).map(mapper::toTicket);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ticket> findLastOpen(String externalIdentity) {
        if (!StringUtils.hasText(externalIdentity)) {
            return Optional.empty();
        }
        return ticketJpaRepository
                .findFirstByExternalIdentityAndStatusInOrderByCreatedAtDescIdDesc(externalIdentity, ACTIVE_STATUSES)
                .map(mapper::toTicket);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ticket> findLastAwaitingConfirmation(String externalIdentity) {
        if (!StringUtils.hasText(externalIdentity)) {
            return Optional.empty();
        }
        return ticketJpaRepository.findAwaitingConfirmation(externalIdentity, PageRequest.of(0, 1)).stream()
                .findFirst()
                .map(mapper::toTicket);
    }

    @Override
    @Transactional
    public boolean assignThread(long ticketId, long threadId, String subject) {
        return ticketJpaRepository.assignThread(ticketId, threadId, subject) > 0;
    }

    @Override
    @Transactional
    public void updateStatus(long ticketId, TicketStatus status) {
        if (status == TicketStatus.CLOSED) {
            ticketJpaRepository.markClosed(ticketId, status, now());
        } else {
            ticketJpaRepository.markActive(ticketId, status);
        }
    }

    @Override
    @Transactional
    public boolean updateRating(long ticketId, int rating) {
        return ticketJpaRepository.applyRating(ticketId, rating, TicketStatus.CLOSED, now()) > 0;
    }

    @Override
    @Transactional
    public boolean confirmResolution(long ticketId) {
        return ticketJpaRepository.confirmResolution(ticketId) > 0;
    }

    private Instant now() {
        return clock.instant();
    }
}
