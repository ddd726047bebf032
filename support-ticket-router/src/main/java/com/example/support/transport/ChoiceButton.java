package com.example.support.transport;

/**
 * Inline button. Either carries a payload returned in a {@link ChoiceEvent} or opens a url.
 */
public record ChoiceButton(String label, String payload, String url) {

    public static ChoiceButton action(String label, String payload) {
        return new ChoiceButton(label, payload, null);
    }

    public static ChoiceButton link(String label, String url) {
        return new ChoiceButton(label, null, url);
    }
}
