package com.example.support.websocket;

import com.corundumstudio.socketio.SocketIOServer;
import com.example.support.config.SupportProperties;
import com.example.support.dto.MessageEditPayload;
import com.example.support.dto.OutboundMessagePayload;
import com.example.support.dto.ThreadEventPayload;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.MessageHandle;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import com.example.support.transport.ThreadHandle;
import com.example.support.transport.TransportBadRequestException;
import com.example.support.transport.TransportException;
import com.example.support.transport.TransportForbiddenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@link SupportTransport} over Socket.IO. Users receive events in their own room, staff in the
 * room of their group; discussion threads live in {@link DiscussionThreadRegistry}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoSupportTransport implements SupportTransport {

    static final String MESSAGE_EVENT = "support:message";
    static final String EDIT_EVENT = "support:edit";
    static final String THREAD_EVENT = "support:thread";

    private final SocketIOServer socketIOServer;
    private final DiscussionThreadRegistry threadRegistry;
    private final ParticipantRegistry participantRegistry;
    private final SupportProperties supportProperties;

    public static String userRoom(String identity) {
        return "user:" + identity;
    }

    public static String staffRoom(String groupId) {
        return "staff:" + groupId;
    }

    @Override
    public MessageHandle sendText(String targetId, String text, MessageOptions options) {
        if (!StringUtils.hasText(text) && !StringUtils.hasText(options.getAttachment())) {
            throw new TransportBadRequestException("Message text is empty");
        }
        OutboundMessagePayload.OutboundMessagePayloadBuilder payload = OutboundMessagePayload.builder()
                .chatId(targetId)
                .text(text)
                .html(options.isHtml())
                .attachment(options.getAttachment())
                .keyboardRows(options.getKeyboardRows())
                .requestContact(options.isRequestContact())
                .removeKeyboard(options.isRemoveKeyboard())
                .choiceRows(options.getChoiceRows());
        if (isStaffGroup(targetId)) {
            if (options.getThreadId() != null && options.isNotice()) {
                threadRegistry.require(targetId, options.getThreadId());
            } else if (options.getThreadId() != null) {
                threadRegistry.requireOpen(targetId, options.getThreadId());
            }
            return emit(staffRoom(targetId), payload.threadId(options.getThreadId()), targetId);
        }
        ensureDeliverable(targetId);
        return emit(userRoom(targetId), payload, targetId);
    }

    @Override
    public MessageHandle forwardMessage(InboundMessage message, String groupId, long threadId) {
        threadRegistry.requireOpen(groupId, threadId);
        return emit(staffRoom(groupId), copyOf(message).threadId(threadId).forwarded(true), groupId);
    }

    @Override
    public MessageHandle copyMessage(InboundMessage message, String targetId) {
        ensureDeliverable(targetId);
        if (message.textOrCaption() == null && message.getMediaType() == null) {
            throw new TransportBadRequestException("Nothing to copy in message %d".formatted(message.getMessageId()));
        }
        return emit(userRoom(targetId), copyOf(message).chatId(targetId).senderName(null), targetId);
    }

    @Override
    public void editText(String targetId, long messageId, String text, MessageOptions options) {
        if (messageId <= 0) {
            throw new TransportBadRequestException("Message %d cannot be edited".formatted(messageId));
        }
        String room = isStaffGroup(targetId) ? staffRoom(targetId) : userRoom(targetId);
        if (!isStaffGroup(targetId)) {
            ensureDeliverable(targetId);
        }
        send(room, EDIT_EVENT, MessageEditPayload.builder()
                .messageId(messageId)
                .chatId(targetId)
                .text(text)
                .html(options.isHtml())
                .choiceRows(options.getChoiceRows())
                .build());
    }

    @Override
    public ThreadHandle createDiscussionThread(String groupId, String title) {
        if (!isStaffGroup(groupId)) {
            throw new TransportBadRequestException("Unknown staff group %s".formatted(groupId));
        }
        DiscussionThread thread = threadRegistry.create(groupId, title);
        announce(ThreadEventPayload.Action.CREATED, thread);
        log.debug("Created thread {} '{}' in group {}", thread.getThreadId(), title, groupId);
        return new ThreadHandle(thread.getThreadId(), thread.getTitle());
    }

    @Override
    public void closeDiscussionThread(String groupId, long threadId) {
        announce(ThreadEventPayload.Action.CLOSED, threadRegistry.setClosed(groupId, threadId, true));
    }

    @Override
    public void reopenDiscussionThread(String groupId, long threadId) {
        announce(ThreadEventPayload.Action.REOPENED, threadRegistry.setClosed(groupId, threadId, false));
    }

    private boolean isStaffGroup(String targetId) {
        return supportProperties.getStaff().getGroupId().equals(targetId);
    }

    private void ensureDeliverable(String identity) {
        if (participantRegistry.isBot(identity)) {
            throw new TransportForbiddenException("bots can't send messages to bots", true);
        }
        if (participantRegistry.isBlocked(identity)) {
            throw new TransportForbiddenException("user %s blocked the bot".formatted(identity), false);
        }
    }

    private OutboundMessagePayload.OutboundMessagePayloadBuilder copyOf(InboundMessage message) {
        return OutboundMessagePayload.builder()
                .chatId(message.getChatId())
                .text(message.getText() != null ? message.getText() : message.getCaption())
                .senderName(message.getSenderName())
                .mediaType(message.getMediaType());
    }

    private MessageHandle emit(String room, OutboundMessagePayload.OutboundMessagePayloadBuilder payload, String chatId) {
        long messageId = participantRegistry.nextMessageId();
        send(room, MESSAGE_EVENT, payload.messageId(messageId).build());
        return new MessageHandle(messageId, chatId);
    }

    private void announce(ThreadEventPayload.Action action, DiscussionThread thread) {
        send(staffRoom(thread.getGroupId()), THREAD_EVENT, ThreadEventPayload.builder()
                .action(action)
                .groupId(thread.getGroupId())
                .threadId(thread.getThreadId())
                .title(thread.getTitle())
                .build());
    }

    private void send(String room, String event, Object payload) {
        try {
            socketIOServer.getRoomOperations(room).sendEvent(event, payload);
        } catch (RuntimeException ex) {
            throw new TransportException("Failed to emit %s to %s".formatted(event, room), ex);
        }
    }
}
