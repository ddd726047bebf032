package com.example.support.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ticket categories offered during intake. The label is what the user taps, the title is what
 * ends up on the ticket.
 */
public enum IntakeCategory {
    ORDER_PROBLEM("Проблема с заказом", "проблемы с заказом", true),
    DELIVERY_PROBLEM("Проблема с доставкой", "задержки доставки", true),
    OTHER("Другое", "Другое", false);

    private final String label;
    private final String title;
    private final boolean orderContextRequired;

    IntakeCategory(String label, String title, boolean orderContextRequired) {
        this.label = label;
        this.title = title;
        this.orderContextRequired = orderContextRequired;
    }

    public String getLabel() {
        return label;
    }

    public String getTitle() {
        return title;
    }

    public boolean isOrderContextRequired() {
        return orderContextRequired;
    }

    public static Optional<IntakeCategory> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(category -> category.label.equals(label))
                .findFirst();
    }
}
