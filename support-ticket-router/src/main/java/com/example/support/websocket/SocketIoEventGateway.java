package com.example.support.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.support.config.SupportProperties;
import com.example.support.dispatch.SupportEventDispatcher;
import com.example.support.dto.BlockPayload;
import com.example.support.dto.ChoicePayload;
import com.example.support.dto.StaffMessagePayload;
import com.example.support.dto.UserMessagePayload;
import com.example.support.event.TicketEvent;
import com.example.support.event.TicketEventListener;
import com.example.support.service.RedisKeyFactory;
import com.example.support.transport.ChoiceEvent;
import com.example.support.transport.ContactInfo;
import com.example.support.transport.EventOrigin;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.SupportEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Socket.IO entry point. Clients connect with {@code role} ({@code user}, {@code bot} or
 * {@code staff}), {@code identity}, {@code displayName} and, for staff, {@code groupId}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoEventGateway implements TicketEventListener {

    static final String USER_MESSAGE_EVENT = "user:message";
    static final String USER_CHOICE_EVENT = "user:choice";
    static final String USER_BLOCK_EVENT = "user:block";
    static final String STAFF_MESSAGE_EVENT = "staff:message";
    static final String TICKET_EVENT = "support:ticket";
    static final String ERROR_EVENT = "support:error";

    private static final String PARAM_ROLE = "role";
    private static final String PARAM_IDENTITY = "identity";
    private static final String PARAM_DISPLAY_NAME = "displayName";
    private static final String PARAM_GROUP_ID = "groupId";
    private static final String BINDING_KEY = "binding";

    private final SocketIOServer socketIOServer;
    private final ApplicationContext applicationContext;
    private final ParticipantRegistry participantRegistry;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final SupportProperties supportProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private RMap<String, SessionBinding> sessionRegistry;

    @PostConstruct
    public void registerListeners() {
        sessionRegistry = redissonClient.getMap(keyFactory.socketSessionMapKey(),
                new TypedJsonJacksonCodec(String.class, SessionBinding.class, objectMapper));
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(USER_MESSAGE_EVENT, UserMessagePayload.class, this::handleUserMessage);
        socketIOServer.addEventListener(USER_CHOICE_EVENT, ChoicePayload.class, this::handleChoice);
        socketIOServer.addEventListener(USER_BLOCK_EVENT, BlockPayload.class, this::handleBlock);
        socketIOServer.addEventListener(STAFF_MESSAGE_EVENT, StaffMessagePayload.class, this::handleStaffMessage);
    }

    private void handleConnect(SocketIOClient client) {
        try {
            SessionBinding binding = bind(client);
            client.set(BINDING_KEY, binding);
            sessionRegistry.fastPut(binding.getSessionId(), binding);
            if (binding.getRole() == SessionBinding.Role.BOT) {
                participantRegistry.registerBot(binding.getIdentity());
            }
            client.joinRoom(binding.room());
            log.info("Client {} connected as {} {}", client.getSessionId(), binding.getRole(), binding.getIdentity());
        } catch (RuntimeException e) {
            log.warn("Rejected Socket.IO connection {}: {}", client.getSessionId(), e.getMessage());
            client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(e.getMessage())));
            client.disconnect();
        }
    }

    private SessionBinding bind(SocketIOClient client) {
        String role = client.getHandshakeData().getSingleUrlParam(PARAM_ROLE);
        String identity = client.getHandshakeData().getSingleUrlParam(PARAM_IDENTITY);
        String displayName = client.getHandshakeData().getSingleUrlParam(PARAM_DISPLAY_NAME);
        if (!StringUtils.hasText(identity)) {
            throw new IllegalArgumentException("identity is required");
        }
        SessionBinding.Role resolvedRole = StringUtils.hasText(role)
                ? SessionBinding.Role.valueOf(role.toUpperCase(Locale.ROOT))
                : SessionBinding.Role.USER;
        String sessionId = client.getSessionId().toString();
        if (resolvedRole == SessionBinding.Role.STAFF) {
            String groupId = client.getHandshakeData().getSingleUrlParam(PARAM_GROUP_ID);
            if (!supportProperties.getStaff().getGroupId().equals(groupId)) {
                throw new IllegalArgumentException("Unknown staff group " + groupId);
            }
            return SessionBinding.staff(sessionId, identity, displayName, groupId, clock.instant());
        }
        return SessionBinding.participant(sessionId, resolvedRole, identity, displayName, clock.instant());
    }

    private void handleDisconnect(SocketIOClient client) {
        UUID sessionId = client.getSessionId();
        SessionBinding binding = sessionRegistry.remove(sessionId.toString());
        if (binding != null) {
            log.info("Client {} ({} {}) disconnected", sessionId, binding.getRole(), binding.getIdentity());
        }
    }

    private void handleUserMessage(SocketIOClient client, UserMessagePayload payload, AckRequest ackSender) {
        SessionBinding binding = requireRole(client, SessionBinding.Role.USER, ackSender);
        if (binding == null) {
            return;
        }
        ContactInfo contact = StringUtils.hasText(payload.getContactPhone())
                ? new ContactInfo(payload.getContactPhone(), payload.getContactOwnerId())
                : null;
        InboundMessage message = InboundMessage.builder()
                .messageId(participantRegistry.nextMessageId())
                .origin(EventOrigin.USER)
                .chatId(binding.getIdentity())
                .senderId(binding.getIdentity())
                .senderName(binding.getDisplayName())
                .text(payload.getText())
                .caption(payload.getCaption())
                .mediaType(payload.getMediaType())
                .contact(contact)
                .replyToMessageId(payload.getReplyToMessageId())
                .build();
        dispatch(message, ackSender);
    }

    private void handleChoice(SocketIOClient client, ChoicePayload payload, AckRequest ackSender) {
        SessionBinding binding = requireRole(client, SessionBinding.Role.USER, ackSender);
        if (binding == null) {
            return;
        }
        dispatch(ChoiceEvent.builder()
                .chatId(binding.getIdentity())
                .senderName(binding.getDisplayName())
                .messageId(payload.getMessageId())
                .payload(payload.getPayload())
                .build(), ackSender);
    }

    private void handleBlock(SocketIOClient client, BlockPayload payload, AckRequest ackSender) {
        SessionBinding binding = requireRole(client, SessionBinding.Role.USER, ackSender);
        if (binding == null) {
            return;
        }
        participantRegistry.setBlocked(binding.getIdentity(), payload.isBlocked());
        log.info("User {} {} the bot", binding.getIdentity(), payload.isBlocked() ? "blocked" : "unblocked");
        if (ackSender != null && ackSender.isAckRequested()) {
            ackSender.sendAckData(Map.of("blocked", payload.isBlocked()));
        }
    }

    private void handleStaffMessage(SocketIOClient client, StaffMessagePayload payload, AckRequest ackSender) {
        SessionBinding binding = requireRole(client, SessionBinding.Role.STAFF, ackSender);
        if (binding == null) {
            return;
        }
        dispatch(InboundMessage.builder()
                .messageId(participantRegistry.nextMessageId())
                .origin(EventOrigin.STAFF)
                .chatId(binding.getGroupId())
                .senderId(binding.getIdentity())
                .senderName(binding.getDisplayName())
                .text(payload.getText())
                .caption(payload.getCaption())
                .mediaType(payload.getMediaType())
                .threadId(payload.getThreadId())
                .replyToMessageId(payload.getReplyToMessageId())
                .build(), ackSender);
    }

    private SessionBinding requireRole(SocketIOClient client, SessionBinding.Role role, AckRequest ackSender) {
        SessionBinding binding = client.get(BINDING_KEY);
        if (binding == null) {
            binding = sessionRegistry.get(client.getSessionId().toString());
        }
        if (binding == null || binding.getRole() != role) {
            log.warn("Client {} sent an event not allowed for its role", client.getSessionId());
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(Map.of("error", "forbidden"));
            }
            return null;
        }
        return binding;
    }

    private void dispatch(SupportEvent event, AckRequest ackSender) {
        applicationContext.getBean(SupportEventDispatcher.class).dispatch(event);
        if (ackSender != null && ackSender.isAckRequested()) {
            ackSender.sendAckData(Map.of("accepted", true));
        }
    }

    @Override
    public void onTicketEvent(TicketEvent event) {
        socketIOServer
                .getRoomOperations(SocketIoSupportTransport.staffRoom(supportProperties.getStaff().getGroupId()))
                .sendEvent(TICKET_EVENT, event);
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(USER_MESSAGE_EVENT);
        socketIOServer.removeAllListeners(USER_CHOICE_EVENT);
        socketIOServer.removeAllListeners(USER_BLOCK_EVENT);
        socketIOServer.removeAllListeners(STAFF_MESSAGE_EVENT);
    }
}
