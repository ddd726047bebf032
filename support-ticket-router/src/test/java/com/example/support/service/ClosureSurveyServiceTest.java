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
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClosureSurveyService Unit Tests")
class ClosureSurveyServiceTest {

    private static final String USER = "u1";

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private SupportTransport transport;

    @Mock
    private SupportNotifier notifier;

    @Mock
    private StaffHours staffHours;

    @Mock
    private TicketEventPublisher eventPublisher;

    @InjectMocks
    private ClosureSurveyService surveyService;

    private static ChoiceEvent press(String payload) {
        return ChoiceEvent.builder()
                .chatId(USER)
                .messageId(300L)
                .payload(payload)
                .build();
    }

    private static Ticket closedTicket() {
        return Ticket.builder()
                .id(42L)
                .externalIdentity(USER)
                .threadId(7L)
                .status(TicketStatus.CLOSED)
                .closed(true)
                .build();
    }

    private static Ticket resolvedTicket() {
        Ticket ticket = closedTicket();
        ticket.setResolutionConfirmed(true);
        return ticket;
    }

    @Test
    @DisplayName("Should recognise survey and rating payloads only")
    void shouldAcceptOwnPayloads() {
        assertThat(ClosureSurveyService.accepts("survey:42:resolved")).isTrue();
        assertThat(ClosureSurveyService.accepts("rate:42:5")).isTrue();
        assertThat(ClosureSurveyService.accepts("menu:returns")).isFalse();
        assertThat(ClosureSurveyService.accepts(null)).isFalse();
    }

    @Test
    @DisplayName("Should offer five rating rows from best to worst")
    void shouldBuildRatingOptions() {
        List<List<ChoiceButton>> rows = ClosureSurveyService.ratingOptions(42L).getChoiceRows();

        assertThat(rows).hasSize(5);
        assertThat(rows.get(0).get(0).payload()).isEqualTo("rate:42:5");
        assertThat(rows.get(4).get(0).payload()).isEqualTo("rate:42:1");
        assertThat(rows.get(4).get(0).label()).isEqualTo("⭐");
    }

    @Test
    @DisplayName("Should ignore presses on tickets of another conversation")
    void shouldRejectForeignTicket() {
        Ticket foreign = closedTicket();
        foreign.setExternalIdentity("u2");
        when(ticketRepository.findById(42L)).thenReturn(Optional.of(foreign));

        surveyService.handleChoice(press("survey:42:resolved"));

        verify(notifier).notifyUser(USER, SupportTexts.TICKET_UNKNOWN);
        verify(ticketRepository, never()).confirmResolution(anyLong());
    }

    @Nested
    @DisplayName("resolved")
    class Resolved {

        @Test
        @DisplayName("Should confirm, close the thread and ask for a rating")
        void shouldConfirmResolution() {
            Ticket ticket = closedTicket();
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(ticket));
            when(ticketRepository.confirmResolution(42L)).thenReturn(true);
            when(notifier.staffGroupId()).thenReturn("staff");

            surveyService.handleChoice(press("survey:42:resolved"));

            verify(eventPublisher).publish(TicketEventType.RESOLVED, ticket);
            verify(transport).closeDiscussionThread("staff", 7L);
            verify(transport).editText(USER, 300L, SupportTexts.resolvedForUser(42L),
                    ClosureSurveyService.ratingOptions(42L));
            verify(notifier).notifyStaff(7L, SupportTexts.resolvedForStaff(42L));
        }

        @Test
        @DisplayName("Should only notify on a repeated press")
        void shouldIgnoreDuplicatePress() {
            Ticket ticket = closedTicket();
            ticket.setResolutionConfirmed(true);
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(ticket));

            surveyService.handleChoice(press("survey:42:resolved"));

            verify(notifier).notifyUser(USER, SupportTexts.ALREADY_HANDLED);
            verify(ticketRepository, never()).confirmResolution(anyLong());
            verifyNoInteractions(eventPublisher, transport);
        }

        @Test
        @DisplayName("Should send a new message when the survey can no longer be edited")
        void shouldFallBackToNewMessage() {
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(closedTicket()));
            when(ticketRepository.confirmResolution(42L)).thenReturn(true);
            when(notifier.staffGroupId()).thenReturn("staff");
            MessageOptions rating = ClosureSurveyService.ratingOptions(42L);
            doThrow(new TransportBadRequestException("message is too old"))
                    .when(transport).editText(USER, 300L, SupportTexts.resolvedForUser(42L), rating);

            surveyService.handleChoice(press("survey:42:resolved"));

            verify(notifier).notifyUser(USER, SupportTexts.resolvedForUser(42L), rating);
        }
    }

    @Nested
    @DisplayName("unresolved")
    class Unresolved {

        @Test
        @DisplayName("Should reopen the ticket and its thread")
        void shouldReopenTicket() {
            Ticket ticket = closedTicket();
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(ticket));
            when(notifier.staffGroupId()).thenReturn("staff");
            when(staffHours.isStaffedNow()).thenReturn(false);

            surveyService.handleChoice(press("survey:42:unresolved"));

            verify(ticketRepository).updateStatus(42L, TicketStatus.REOPENED);
            verify(eventPublisher).publish(TicketEventType.REOPENED, ticket);
            verify(transport).reopenDiscussionThread("staff", 7L);
            verify(transport).editText(USER, 300L, SupportTexts.unresolvedForUser(42L, false), MessageOptions.NONE);
            verify(notifier).notifyStaff(7L, SupportTexts.unresolvedForStaff(42L));
            assertThat(ticket.getStatus()).isEqualTo(TicketStatus.REOPENED);
        }

        @Test
        @DisplayName("Should keep an older ticket closed while a newer one is active")
        void shouldNotReopenWhenAnotherTicketIsActive() {
            Ticket older = closedTicket();
            older.setId(41L);
            Ticket active = Ticket.builder()
                    .id(42L)
                    .externalIdentity(USER)
                    .threadId(8L)
                    .status(TicketStatus.OPEN)
                    .build();
            when(ticketRepository.findById(41L)).thenReturn(Optional.of(older));
            when(ticketRepository.findLastOpen(USER)).thenReturn(Optional.of(active));

            surveyService.handleChoice(press("survey:41:unresolved"));

            verify(notifier).notifyUser(USER, SupportTexts.anotherTicketActive(42L));
            verify(ticketRepository, never()).updateStatus(anyLong(), any());
            verifyNoInteractions(eventPublisher, transport);
            assertThat(older.getStatus()).isEqualTo(TicketStatus.CLOSED);
        }
    }

    @Nested
    @DisplayName("rate")
    class Rate {

        @Test
        @DisplayName("Should store the first rating and thank the user")
        void shouldStoreRating() {
            Ticket ticket = resolvedTicket();
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(ticket));
            when(ticketRepository.updateRating(42L, 5)).thenReturn(true);

            surveyService.handleChoice(press("rate:42:5"));

            verify(eventPublisher).publish(TicketEventType.RATED, ticket);
            verify(transport).editText(USER, 300L, SupportTexts.ratedForUser(5), MessageOptions.NONE);
            verify(notifier).notifyStaff(7L, SupportTexts.ratedForStaff(42L, 5));
            assertThat(ticket.getRating()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should reject a second rating")
        void shouldRejectSecondRating() {
            Ticket ticket = resolvedTicket();
            ticket.setRating(5);
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(ticket));

            surveyService.handleChoice(press("rate:42:3"));

            verify(notifier).notifyUser(USER, SupportTexts.ALREADY_RATED);
            verify(ticketRepository, never()).updateRating(anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should reject a rating that lost the race to another press")
        void shouldRejectConcurrentRating() {
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(resolvedTicket()));
            when(ticketRepository.updateRating(42L, 3)).thenReturn(false);

            surveyService.handleChoice(press("rate:42:3"));

            verify(notifier).notifyUser(USER, SupportTexts.ALREADY_RATED);
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should ask for the survey answer before accepting a rating")
        void shouldRejectRatingBeforeConfirmation() {
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(closedTicket()));

            surveyService.handleChoice(press("rate:42:5"));

            verify(notifier).notifyUser(USER, SupportTexts.CONFIRM_BEFORE_RATING);
            verify(ticketRepository, never()).updateRating(anyLong(), anyInt());
            verifyNoInteractions(eventPublisher, transport);
        }

        @Test
        @DisplayName("Should ignore ratings outside of one to five")
        void shouldIgnoreOutOfRangeRating() {
            when(ticketRepository.findById(42L)).thenReturn(Optional.of(resolvedTicket()));

            surveyService.handleChoice(press("rate:42:6"));

            verify(ticketRepository, never()).updateRating(anyLong(), anyInt());
            verify(notifier, never()).notifyUser(eq(USER), any());
        }
    }
}
