package com.example.support.persistence;

import com.example.support.domain.TicketStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "tickets",
        indexes = {
            @Index(name = "idx_tickets_identity", columnList = "external_identity"),
            @Index(name = "idx_tickets_thread", columnList = "thread_id")
        })
public class TicketEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "external_identity", nullable = false, length = 128)
    private String externalIdentity;

    @Column(name = "account_id")
    private Long accountId;

    @Column(name = "thread_id")
    private Long threadId;

    @Column(name = "subject", length = 255)
    private String subject;

    @Column(name = "store_id", length = 255)
    private String storeId;

    @Column(name = "category", nullable = false, length = 255)
    private String category;

    @Column(name = "order_number", length = 50)
    private String orderNumber;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Column(name = "branch", nullable = false, length = 100)
    private String branch;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TicketStatus status;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "resolution_confirmed", nullable = false)
    private boolean resolutionConfirmed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
