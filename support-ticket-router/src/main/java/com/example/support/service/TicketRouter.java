package com.example.support.service;

import com.example.support.domain.Account;
import com.example.support.domain.OrderSummary;
import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import com.example.support.event.TicketEventPublisher;
import com.example.support.event.TicketEventType;
import com.example.support.service.exception.TicketNotFoundException;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import com.example.support.transport.ThreadHandle;
import com.example.support.transport.TransportBadRequestException;
import com.example.support.transport.TransportException;
import com.example.support.transport.TransportForbiddenException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the binding between a user conversation and the staff discussion thread of its ticket.
 *
 * <p>Only the user's own messages and staff replies travel through here once intake is done. The
 * ticket status is changed by closure, by a user writing into a closed ticket and by the closure
 * survey; transport failures never change it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketRouter {

    public enum CloseOutcome {
        CLOSED,
        ALREADY_CLOSED
    }

    private final TicketRepository ticketRepository;
    private final OrderRepository orderRepository;
    private final SupportTransport transport;
    private final SupportNotifier notifier;
    private final TicketSummaryFormatter formatter;
    private final ClosureSurveyService surveyService;
    private final StaffHours staffHours;
    private final TicketEventPublisher eventPublisher;

    /**
     * Creates a ticket and its discussion thread, or forwards the message when the user already has
     * an open ticket.
     */
    public Optional<Ticket> createTicket(TicketRequest request) {
        String identity = request.getExternalIdentity();
        Optional<Ticket> existing = ticketRepository.findLastOpen(identity);
        if (existing.isPresent()) {
            Ticket open = existing.get();
            if (open.hasThread()) {
                log.info("Conversation {} already has open ticket {}, forwarding instead", identity, open.getId());
                forwardFromUser(request.getMessage());
                return Optional.empty();
            }
            log.warn("Closing orphan ticket {} of {} left without a thread", open.getId(), identity);
            ticketRepository.updateStatus(open.getId(), TicketStatus.CLOSED);
            open.setStatus(TicketStatus.CLOSED);
            open.setClosed(true);
            eventPublisher.publish(TicketEventType.CLOSED, open);
        }

        Account account = request.getAccount();
        String orderNumber = request.hasOrderNumber() ? request.getOrderNumber() : null;
        String storeId = null;
        String storeTitle = null;
        if (account != null && orderNumber != null) {
            try {
                storeId = orderRepository.findByOrderNumber(orderNumber).map(OrderSummary::getStoreId).orElse(null);
                storeTitle = storeId != null ? orderRepository.findStoreTitle(storeId).orElse(null) : null;
            } catch (RuntimeException ex) {
                log.warn("Store lookup for order {} failed, creating ticket without it: {}", orderNumber,
                        ex.getMessage());
            }
        }

        Ticket ticket = ticketRepository.create(Ticket.builder()
                .externalIdentity(identity)
                .accountId(account != null ? account.getId() : null)
                .category(request.getCategory())
                .orderNumber(orderNumber)
                .storeId(storeId)
                .description(request.getDescription())
                .branch(UserDirectoryService.branchOf(account))
                .build());
        eventPublisher.publish(TicketEventType.CREATED, ticket);
        log.info("Created ticket {} for conversation {}", ticket.getId(), identity);

        String displayName = UserDirectoryService.displayName(account, request.getMessage().getSenderName());
        String subject = formatter.subject(account != null, storeTitle, orderNumber, displayName,
                request.getCategory());

        ThreadHandle thread;
        try {
            thread = transport.createDiscussionThread(notifier.staffGroupId(), subject);
        } catch (TransportException ex) {
            log.error("Failed to create discussion thread for ticket {}", ticket.getId(), ex);
            notifier.notifyUser(identity, SupportTexts.THREAD_CREATION_FAILED);
            return Optional.of(ticket);
        }
        if (!ticketRepository.assignThread(ticket.getId(), thread.threadId(), subject)) {
            log.warn("Ticket {} already had a thread, keeping it over {}", ticket.getId(), thread.threadId());
            return ticketRepository.findById(ticket.getId());
        }
        ticket.setThreadId(thread.threadId());
        ticket.setSubject(subject);

        try {
            transport.sendText(notifier.staffGroupId(), formatter.summary(ticket, displayName, storeTitle),
                    MessageOptions.builder().threadId(thread.threadId()).html(true).build());
        } catch (TransportException ex) {
            log.error("Failed to post summary of ticket {} into thread {}", ticket.getId(), thread.threadId(), ex);
        }

        notifier.notifyUser(identity, SupportTexts.acknowledgement(ticket.getId(), staffHours.isStaffedNow()),
                MessageOptions.removingKeyboard());
        return Optional.of(ticket);
    }

    /**
     * Delivers a user message into the thread of the user's current ticket, reopening it first when
     * it was closed.
     */
    public void forwardFromUser(InboundMessage message) {
        String identity = message.getChatId();
        Optional<Ticket> found = ticketRepository.findLastOpen(identity)
                .or(() -> ticketRepository.findLastAwaitingConfirmation(identity));
        if (found.isEmpty()) {
            notifier.notifyUser(identity, SupportTexts.START_NEW_TICKET);
            return;
        }
        Ticket ticket = found.get();

        if (ticket.isClosedState()) {
            ticketRepository.updateStatus(ticket.getId(), TicketStatus.REOPENED);
            ticket.setStatus(TicketStatus.REOPENED);
            ticket.setClosed(false);
            ticket.setClosedAt(null);
            eventPublisher.publish(TicketEventType.REOPENED, ticket);
            log.info("Reopened ticket {} on a new message from {}", ticket.getId(), identity);
            if (ticket.hasThread()) {
                notifier.notifyStaff(ticket.getThreadId(), SupportTexts.reopenedByUserMessage(ticket.getId()));
            }
        }

        if (!ticket.hasThread()) {
            log.warn("Ticket {} of {} has no discussion thread, message not routed", ticket.getId(), identity);
            notifier.notifyUser(identity, SupportTexts.TICKET_WITHOUT_THREAD);
            return;
        }

        try {
            transport.forwardMessage(message, notifier.staffGroupId(), ticket.getThreadId());
        } catch (TransportBadRequestException ex) {
            log.error("Thread {} rejected message from {}: {}", ticket.getThreadId(), identity, ex.getMessage());
            notifier.notifyUser(identity, SupportTexts.FORWARD_BAD_REQUEST);
        } catch (TransportForbiddenException ex) {
            log.error("Forwarding from {} forbidden: {}", identity, ex.getMessage());
            notifier.notifyUser(identity, SupportTexts.FORWARD_FORBIDDEN);
        } catch (TransportException ex) {
            log.error("Unexpected forwarding failure for ticket {}", ticket.getId(), ex);
            notifier.notifyUser(identity, SupportTexts.FORWARD_FAILED);
        }
    }

    /**
     * Copies a staff message written inside a ticket thread to the ticket's user.
     */
    public void forwardFromStaff(InboundMessage message) {
        Long threadId = message.getThreadId();
        if (threadId == null) {
            log.debug("Ignoring staff message {} outside of a thread", message.getMessageId());
            return;
        }
        Optional<Ticket> found = ticketRepository.findByThreadId(threadId);
        if (found.isEmpty()) {
            log.warn("Staff replied in thread {} which has no ticket", threadId);
            notifier.notifyStaff(threadId, SupportTexts.THREAD_WITHOUT_TICKET);
            return;
        }
        String target = found.get().getExternalIdentity();
        try {
            transport.copyMessage(message, target);
            log.debug("Copied staff reply from thread {} to {}", threadId, target);
        } catch (TransportForbiddenException ex) {
            log.warn("Staff reply to {} forbidden: {}", target, ex.getMessage());
            notifier.notifyStaff(threadId, ex.isTargetBot()
                    ? SupportTexts.staffDeliveryToBot(target)
                    : SupportTexts.staffDeliveryBlocked(target));
        } catch (TransportException ex) {
            log.error("Failed to deliver staff reply from thread {} to {}", threadId, target, ex);
            notifier.notifyStaff(threadId, SupportTexts.staffDeliveryFailed(target));
        }
    }

    /**
     * Handles {@code /close} typed by staff.
     */
    public void closeFromThread(InboundMessage command) {
        Long threadId = command.getThreadId();
        if (threadId == null) {
            notifier.notifyStaff(null, SupportTexts.CLOSE_OUTSIDE_THREAD);
            return;
        }
        Optional<Ticket> found = ticketRepository.findByThreadId(threadId);
        if (found.isEmpty()) {
            log.warn("/close in thread {} which has no ticket", threadId);
            notifier.notifyStaff(threadId, SupportTexts.THREAD_WITHOUT_TICKET);
            return;
        }
        close(found.get());
    }

    public Ticket closeTicket(long ticketId) {
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(String.valueOf(ticketId)));
        close(ticket);
        return ticketRepository.findById(ticketId).orElse(ticket);
    }

    CloseOutcome close(Ticket ticket) {
        if (ticket.isClosedState()) {
            notifier.notifyStaff(ticket.getThreadId(), SupportTexts.alreadyClosed(ticket.getId()));
            return CloseOutcome.ALREADY_CLOSED;
        }
        ticketRepository.updateStatus(ticket.getId(), TicketStatus.CLOSED);
        ticket.setStatus(TicketStatus.CLOSED);
        ticket.setClosed(true);
        ticket.setResolutionConfirmed(false);
        eventPublisher.publish(TicketEventType.CLOSED, ticket);
        log.info("Closed ticket {}", ticket.getId());

        try {
            surveyService.sendSurvey(ticket);
            notifier.notifyStaff(ticket.getThreadId(), SupportTexts.closedWithSurvey(ticket.getId()));
        } catch (TransportException ex) {
            log.warn("Survey for ticket {} not delivered to {}: {}", ticket.getId(), ticket.getExternalIdentity(),
                    ex.getMessage());
            notifier.notifyStaff(ticket.getThreadId(), SupportTexts.surveyDeliveryFailed(ticket.getExternalIdentity()));
        }
        return CloseOutcome.CLOSED;
    }
}
