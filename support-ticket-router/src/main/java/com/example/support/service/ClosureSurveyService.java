package com.example.support.service;

import com.example.support.domain.Ticket;
import com.example.support.domain.TicketStatus;
import com.example.support.event.TicketEventPublisher;
import com.example.support.event.TicketEventType;
import com.example.support.transport.ChoiceButton;
import com.example.support.transport.ChoiceEvent;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import com.example.support.transport.TransportBadRequestException;
import com.example.support.transport.TransportException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Post-closure survey: the user confirms the resolution or reopens the ticket, then rates it.
 *
 * <p>Payloads are {@code survey:<ticketId>:resolved}, {@code survey:<ticketId>:unresolved} and
 * {@code rate:<ticketId>:<1..5>}. Every press is validated against the current ticket state, so
 * repeated presses of a stale button only produce a notice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClosureSurveyService {

    public static final String SURVEY_PREFIX = "survey:";
    public static final String RATE_PREFIX = "rate:";

    private static final String RESOLVED = "resolved";
    private static final String UNRESOLVED = "unresolved";
    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final TicketRepository ticketRepository;
    private final SupportTransport transport;
    private final SupportNotifier notifier;
    private final StaffHours staffHours;
    private final TicketEventPublisher eventPublisher;

    public static boolean accepts(String payload) {
        return payload != null && (payload.startsWith(SURVEY_PREFIX) || payload.startsWith(RATE_PREFIX));
    }

    /**
     * Sends the resolved / not resolved question. Transport failures propagate to the caller.
     */
    public void sendSurvey(Ticket ticket) {
        MessageOptions options = MessageOptions.builder()
                .choiceRow(List.of(
                        ChoiceButton.action(SupportTexts.SURVEY_RESOLVED, SURVEY_PREFIX + ticket.getId() + ":" + RESOLVED),
                        ChoiceButton.action(SupportTexts.SURVEY_UNRESOLVED,
                                SURVEY_PREFIX + ticket.getId() + ":" + UNRESOLVED)))
                .build();
        transport.sendText(ticket.getExternalIdentity(), SupportTexts.SURVEY_QUESTION, options);
    }

    public void handleChoice(ChoiceEvent event) {
        String[] parts = event.getPayload().split(":");
        if (parts.length != 3) {
            log.warn("Malformed survey payload {} from {}", event.getPayload(), event.getChatId());
            return;
        }
        long ticketId;
        try {
            ticketId = Long.parseLong(parts[1]);
        } catch (NumberFormatException ex) {
            log.warn("Malformed ticket id in payload {} from {}", event.getPayload(), event.getChatId());
            return;
        }
        Optional<Ticket> ticket = ticketRepository.findById(ticketId)
                .filter(found -> event.getChatId().equals(found.getExternalIdentity()));
        if (ticket.isEmpty()) {
            log.warn("Survey press for unknown or foreign ticket {} by {}", ticketId, event.getChatId());
            notifier.notifyUser(event.getChatId(), SupportTexts.TICKET_UNKNOWN);
            return;
        }

        if (event.getPayload().startsWith(RATE_PREFIX)) {
            rate(event, ticket.get(), parts[2]);
        } else if (RESOLVED.equals(parts[2])) {
            confirmResolved(event, ticket.get());
        } else if (UNRESOLVED.equals(parts[2])) {
            reopenUnresolved(event, ticket.get());
        } else {
            log.warn("Unknown survey answer {} for ticket {}", parts[2], ticketId);
        }
    }

    private void confirmResolved(ChoiceEvent event, Ticket ticket) {
        if (!ticket.isAwaitingConfirmation() || !ticketRepository.confirmResolution(ticket.getId())) {
            notifier.notifyUser(event.getChatId(), SupportTexts.ALREADY_HANDLED);
            return;
        }
        ticket.setResolutionConfirmed(true);
        eventPublisher.publish(TicketEventType.RESOLVED, ticket);
        log.info("Ticket {} confirmed as resolved by {}", ticket.getId(), event.getChatId());

        if (ticket.hasThread()) {
            try {
                transport.closeDiscussionThread(notifier.staffGroupId(), ticket.getThreadId());
            } catch (TransportException ex) {
                log.warn("Failed to close thread {} of ticket {}: {}", ticket.getThreadId(), ticket.getId(),
                        ex.getMessage());
            }
        }
        replaceSurvey(event, SupportTexts.resolvedForUser(ticket.getId()), ratingOptions(ticket.getId()));
        if (ticket.hasThread()) {
            notifier.notifyStaff(ticket.getThreadId(), SupportTexts.resolvedForStaff(ticket.getId()));
        }
    }

    private void reopenUnresolved(ChoiceEvent event, Ticket ticket) {
        if (!ticket.isAwaitingConfirmation()) {
            notifier.notifyUser(event.getChatId(), SupportTexts.ALREADY_HANDLED);
            return;
        }
        Optional<Ticket> active = ticketRepository.findLastOpen(ticket.getExternalIdentity())
                .filter(open -> !open.getId().equals(ticket.getId()));
        if (active.isPresent()) {
            log.info("Not reopening ticket {} for {}: ticket {} is already active", ticket.getId(),
                    event.getChatId(), active.get().getId());
            notifier.notifyUser(event.getChatId(), SupportTexts.anotherTicketActive(active.get().getId()));
            return;
        }
        ticketRepository.updateStatus(ticket.getId(), TicketStatus.REOPENED);
        ticket.setStatus(TicketStatus.REOPENED);
        ticket.setClosed(false);
        ticket.setClosedAt(null);
        eventPublisher.publish(TicketEventType.REOPENED, ticket);
        log.info("Ticket {} reopened by {} from the survey", ticket.getId(), event.getChatId());

        if (ticket.hasThread()) {
            try {
                transport.reopenDiscussionThread(notifier.staffGroupId(), ticket.getThreadId());
            } catch (TransportException ex) {
                log.warn("Failed to reopen thread {} of ticket {}: {}", ticket.getThreadId(), ticket.getId(),
                        ex.getMessage());
            }
        }
        replaceSurvey(event, SupportTexts.unresolvedForUser(ticket.getId(), staffHours.isStaffedNow()),
                MessageOptions.NONE);
        if (ticket.hasThread()) {
            notifier.notifyStaff(ticket.getThreadId(), SupportTexts.unresolvedForStaff(ticket.getId()));
        }
    }

    private void rate(ChoiceEvent event, Ticket ticket, String value) {
        int rating;
        try {
            rating = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            log.warn("Malformed rating {} for ticket {}", value, ticket.getId());
            return;
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            log.warn("Rating {} out of range for ticket {}", rating, ticket.getId());
            return;
        }
        if (!ticket.isClosedState() || ticket.getRating() != null) {
            notifier.notifyUser(event.getChatId(), SupportTexts.ALREADY_RATED);
            return;
        }
        // rating opens only after the user confirmed the resolution
        if (!ticket.isResolutionConfirmed()) {
            log.warn("Rating for ticket {} before its resolution was confirmed by {}", ticket.getId(),
                    event.getChatId());
            notifier.notifyUser(event.getChatId(), SupportTexts.CONFIRM_BEFORE_RATING);
            return;
        }
        if (!ticketRepository.updateRating(ticket.getId(), rating)) {
            notifier.notifyUser(event.getChatId(), SupportTexts.ALREADY_RATED);
            return;
        }
        ticket.setRating(rating);
        eventPublisher.publish(TicketEventType.RATED, ticket);
        log.info("Ticket {} rated {} by {}", ticket.getId(), rating, event.getChatId());

        replaceSurvey(event, SupportTexts.ratedForUser(rating), MessageOptions.NONE);
        notifier.notifyStaff(ticket.getThreadId(), SupportTexts.ratedForStaff(ticket.getId(), rating));
    }

    static MessageOptions ratingOptions(long ticketId) {
        MessageOptions.MessageOptionsBuilder builder = MessageOptions.builder();
        for (int stars = MAX_RATING; stars >= MIN_RATING; stars--) {
            builder.choiceRow(List.of(ChoiceButton.action("⭐".repeat(stars), RATE_PREFIX + ticketId + ":" + stars)));
        }
        return builder.build();
    }

    private void replaceSurvey(ChoiceEvent event, String text, MessageOptions options) {
        try {
            transport.editText(event.getChatId(), event.getMessageId(), text, options);
        } catch (TransportBadRequestException ex) {
            log.debug("Survey message {} not editable, sending a new one", event.getMessageId());
            notifier.notifyUser(event.getChatId(), text, options);
        } catch (TransportException ex) {
            log.warn("Failed to update survey message for {}: {}", event.getChatId(), ex.getMessage());
        }
    }
}
