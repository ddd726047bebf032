package com.example.support.transport;

import java.io.Serializable;
import lombok.Builder;
import lombok.Value;

/**
 * A press on an inline {@link ChoiceButton}.
 */
@Value
@Builder
public class ChoiceEvent implements SupportEvent, Serializable {

    String chatId;
    String senderName;
    long messageId;
    String payload;

    @Override
    public EventOrigin getOrigin() {
        return EventOrigin.USER;
    }

    @Override
    public Long getThreadId() {
        return null;
    }
}
