package com.example.support.dto;

import com.example.support.transport.ChoiceButton;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Body of {@code support:message}, sent to users and into staff threads.
 */
@Value
@Builder
public class OutboundMessagePayload {
    long messageId;
    String chatId;
    Long threadId;
    String text;
    boolean html;
    boolean forwarded;
    String senderName;
    String mediaType;
    String attachment;
    List<List<String>> keyboardRows;
    boolean requestContact;
    boolean removeKeyboard;
    List<List<ChoiceButton>> choiceRows;
}
