package com.example.support.persistence;

import com.example.support.domain.TicketStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TicketJpaRepository extends JpaRepository<TicketEntity, Long> {

    Optional<TicketEntity> findFirstByThreadIdOrderByIdDesc(Long threadId);

    Optional<TicketEntity> findFirstByExternalIdentityAndStatusInOrderByCreatedAtDescIdDesc(
            String externalIdentity, Collection<TicketStatus> statuses);

    /**
     * Closed tickets with a thread whose resolution is unconfirmed, newest first. Orphans closed
     * without ever getting a thread are skipped.
     */
    @Query(
            "select t from TicketEntity t where t.externalIdentity = :identity and t.closed = true "
                    + "and t.resolutionConfirmed = false and t.threadId is not null "
                    + "order by t.createdAt desc, t.id desc")
    List<TicketEntity> findAwaitingConfirmation(@Param("identity") String externalIdentity, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update TicketEntity t set t.threadId = :threadId, t.subject = :subject "
                    + "where t.id = :id and t.threadId is null")
    int assignThread(@Param("id") Long id, @Param("threadId") Long threadId, @Param("subject") String subject);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update TicketEntity t set t.status = :status, t.closed = true, t.closedAt = :now, "
                    + "t.resolutionConfirmed = false where t.id = :id")
    int markClosed(@Param("id") Long id, @Param("status") TicketStatus status, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update TicketEntity t set t.status = :status, t.closed = false, t.closedAt = null "
                    + "where t.id = :id")
    int markActive(@Param("id") Long id, @Param("status") TicketStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update TicketEntity t set t.rating = :rating, t.status = :status, t.closed = true, "
                    + "t.closedAt = coalesce(t.closedAt, :now) where t.id = :id and t.rating is null")
    int applyRating(
            @Param("id") Long id,
            @Param("rating") Integer rating,
            @Param("status") TicketStatus status,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update TicketEntity t set t.resolutionConfirmed = true "
                    + "where t.id = :id and t.closed = true and t.resolutionConfirmed = false")
    int confirmResolution(@Param("id") Long id);
}
