package com.example.support.transport;

import java.io.Serializable;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class InboundMessage implements SupportEvent, Serializable {

    long messageId;
    EventOrigin origin;
    String chatId;
    String senderId;
    String senderName;
    String text;
    String caption;
    String mediaType;
    ContactInfo contact;
    Long threadId;
    Long replyToMessageId;

    public boolean isCommand(String command) {
        return text != null && (text.equals(command) || text.startsWith(command + " "));
    }

    public boolean isAnyCommand() {
        return text != null && text.startsWith("/");
    }

    public boolean hasContact() {
        return contact != null;
    }

    public boolean isReply() {
        return replyToMessageId != null;
    }

    /**
     * Text of the message, falling back to the media caption.
     */
    public String textOrCaption() {
        if (text != null && !text.isBlank()) {
            return text;
        }
        if (caption != null && !caption.isBlank()) {
            return caption;
        }
        return null;
    }
}
