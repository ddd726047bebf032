package com.example.support.service;

import com.example.support.domain.Ticket;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Builds the discussion thread title and the HTML card posted as its first message.
 */
@Component
public class TicketSummaryFormatter {

    static final int MAX_SUBJECT_LENGTH = 128;

    public String subject(boolean registered, String storeTitle, String orderNumber, String displayName,
            String category) {
        String subject;
        if (registered) {
            List<String> parts = new ArrayList<>(3);
            if (StringUtils.hasText(storeTitle)) {
                parts.add(storeTitle);
            }
            if (StringUtils.hasText(orderNumber)) {
                parts.add(orderNumber);
            }
            parts.add(displayName);
            subject = String.join(": ", parts);
        } else {
            subject = "Незарегистрированный: %s (%s)".formatted(displayName, category);
        }
        return subject.length() > MAX_SUBJECT_LENGTH ? subject.substring(0, MAX_SUBJECT_LENGTH) : subject;
    }

    public String summary(Ticket ticket, String displayName, String storeTitle) {
        String order = StringUtils.hasText(ticket.getOrderNumber()) ? ticket.getOrderNumber() : SupportTexts.NOT_SPECIFIED;
        String store = StringUtils.hasText(storeTitle) ? storeTitle : SupportTexts.NOT_SPECIFIED;
        return "<b>Имя:</b> " + escape(displayName) + "\n"
                + "<b>Номер обращения:</b> №" + ticket.getId() + "\n"
                + "<b>Категория:</b> " + escape(ticket.getCategory()) + "\n"
                + "<b>Номер заказа:</b> " + escape(order) + "\n"
                + "<b>Филиал/Магазин:</b> " + escape(store) + "\n"
                + "<b>Описание:</b> " + escape(ticket.getDescription()) + "\n\n"
                + "<i>Ответы на любые сообщения бота в этой теме будут отправлены пользователю.</i>";
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
