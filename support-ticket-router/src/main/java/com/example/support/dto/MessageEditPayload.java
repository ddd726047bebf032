package com.example.support.dto;

import com.example.support.transport.ChoiceButton;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MessageEditPayload {
    long messageId;
    String chatId;
    String text;
    boolean html;
    List<List<ChoiceButton>> choiceRows;
}
