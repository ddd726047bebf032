package com.example.support.service;

import com.example.support.domain.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TicketSummaryFormatter")
class TicketSummaryFormatterTest {

    private final TicketSummaryFormatter formatter = new TicketSummaryFormatter();

    @Test
    @DisplayName("Should join store, order and name for registered users")
    void shouldBuildRegisteredSubject() {
        assertThat(formatter.subject(true, "ТЦ Столица", "A-1", "Анна", "проблемы с заказом"))
                .isEqualTo("ТЦ Столица: A-1: Анна");
        assertThat(formatter.subject(true, null, null, "Анна", "Другое")).isEqualTo("Анна");
    }

    @Test
    @DisplayName("Should mark unregistered users and name the category")
    void shouldBuildUnregisteredSubject() {
        assertThat(formatter.subject(false, null, null, "Гость", "Другое"))
                .isEqualTo("Незарегистрированный: Гость (Другое)");
    }

    @Test
    @DisplayName("Should cut long subjects")
    void shouldTruncateSubject() {
        String subject = formatter.subject(true, "М".repeat(200), "A-1", "Анна", "Другое");

        assertThat(subject).hasSize(TicketSummaryFormatter.MAX_SUBJECT_LENGTH);
    }

    @Test
    @DisplayName("Should escape user supplied text in the thread card")
    void shouldEscapeSummary() {
        Ticket ticket = Ticket.builder()
                .id(42L)
                .category("Другое")
                .description("<b>срочно</b> & важно")
                .build();

        String summary = formatter.summary(ticket, "Анна", null);

        assertThat(summary)
                .contains("№42")
                .contains("&lt;b&gt;срочно&lt;/b&gt; &amp; важно")
                .contains("<b>Номер заказа:</b> " + SupportTexts.NOT_SPECIFIED)
                .contains("<b>Филиал/Магазин:</b> " + SupportTexts.NOT_SPECIFIED);
    }
}
