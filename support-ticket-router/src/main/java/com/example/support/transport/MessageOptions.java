package com.example.support.transport;

import java.io.Serializable;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class MessageOptions implements Serializable {

    public static final MessageOptions NONE = MessageOptions.builder().build();

    /**
     * Discussion thread inside the target group, if any.
     */
    Long threadId;

    boolean html;

    /**
     * Service notice from the bot itself. Notices reach closed threads, participant messages do not.
     */
    boolean notice;

    /**
     * Reply keyboard rows shown under the input field.
     */
    @Singular
    List<List<String>> keyboardRows;

    /**
     * Adds a single "share contact" button instead of {@link #keyboardRows}.
     */
    boolean requestContact;

    boolean removeKeyboard;

    @Singular
    List<List<ChoiceButton>> choiceRows;

    /**
     * File name sent along with the text as a document.
     */
    String attachment;

    public static MessageOptions noticeInThread(long threadId) {
        return MessageOptions.builder().threadId(threadId).notice(true).build();
    }

    public static MessageOptions removingKeyboard() {
        return MessageOptions.builder().removeKeyboard(true).build();
    }
}
