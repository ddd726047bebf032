package com.example.support.websocket;

import com.corundumstudio.socketio.BroadcastOperations;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.support.config.SupportProperties;
import com.example.support.dto.OutboundMessagePayload;
import com.example.support.dto.ThreadEventPayload;
import com.example.support.service.SupportNotifier;
import com.example.support.transport.EventOrigin;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.MessageHandle;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.ThreadHandle;
import com.example.support.transport.TransportBadRequestException;
import com.example.support.transport.TransportForbiddenException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SocketIoSupportTransport Unit Tests")
class SocketIoSupportTransportTest {

    private static final String GROUP = "support-staff";

    @Mock
    private SocketIOServer socketIOServer;

    @Mock
    private DiscussionThreadRegistry threadRegistry;

    @Mock
    private ParticipantRegistry participantRegistry;

    private final List<Object[]> userEvents = new ArrayList<>();
    private final List<Object[]> staffEvents = new ArrayList<>();

    private SocketIoSupportTransport transport;

    @BeforeEach
    void setUp() {
        when(socketIOServer.getRoomOperations("user:u1")).thenReturn(recording(userEvents));
        when(socketIOServer.getRoomOperations("staff:" + GROUP)).thenReturn(recording(staffEvents));
        when(participantRegistry.nextMessageId()).thenReturn(11L);
        transport = new SocketIoSupportTransport(socketIOServer, threadRegistry, participantRegistry,
                new SupportProperties());
    }

    private static BroadcastOperations recording(List<Object[]> sink) {
        return Mockito.mock(BroadcastOperations.class, invocation -> {
            if ("sendEvent".equals(invocation.getMethod().getName())) {
                sink.add(invocation.getArguments());
            }
            return null;
        });
    }

    private static DiscussionThread thread(long id, boolean closed) {
        return DiscussionThread.builder()
                .threadId(id)
                .groupId(GROUP)
                .title("Иван")
                .closed(closed)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    private static InboundMessage message(String text) {
        return InboundMessage.builder()
                .messageId(5L)
                .origin(EventOrigin.USER)
                .chatId("u1")
                .senderName("Иван")
                .text(text)
                .build();
    }

    @Nested
    @DisplayName("user delivery")
    class UserDelivery {

        @Test
        @DisplayName("Should emit the message into the user's room")
        void shouldSendToUserRoom() {
            MessageHandle handle = transport.sendText("u1", "Привет", MessageOptions.removingKeyboard());

            assertThat(handle).isEqualTo(new MessageHandle(11L, "u1"));
            assertThat(userEvents).singleElement().satisfies(args -> {
                assertThat(args[0]).isEqualTo(SocketIoSupportTransport.MESSAGE_EVENT);
                OutboundMessagePayload payload = (OutboundMessagePayload) args[1];
                assertThat(payload.getText()).isEqualTo("Привет");
                assertThat(payload.isRemoveKeyboard()).isTrue();
            });
        }

        @Test
        @DisplayName("Should refuse delivery to bots")
        void shouldRejectBots() {
            when(participantRegistry.isBot("u1")).thenReturn(true);

            assertThatThrownBy(() -> transport.copyMessage(message("ответ"), "u1"))
                    .isInstanceOfSatisfying(TransportForbiddenException.class,
                            ex -> assertThat(ex.isTargetBot()).isTrue());
            assertThat(userEvents).isEmpty();
        }

        @Test
        @DisplayName("Should refuse delivery to users who blocked the bot")
        void shouldRejectBlockedUsers() {
            when(participantRegistry.isBlocked("u1")).thenReturn(true);

            assertThatThrownBy(() -> transport.sendText("u1", "Привет", MessageOptions.NONE))
                    .isInstanceOfSatisfying(TransportForbiddenException.class,
                            ex -> assertThat(ex.isTargetBot()).isFalse());
        }

        @Test
        @DisplayName("Should reject empty messages")
        void shouldRejectEmptyText() {
            assertThatThrownBy(() -> transport.sendText("u1", " ", MessageOptions.NONE))
                    .isInstanceOf(TransportBadRequestException.class);
        }

        @Test
        @DisplayName("Should reject edits of unknown messages")
        void shouldRejectInvalidEdit() {
            assertThatThrownBy(() -> transport.editText("u1", 0L, "text", MessageOptions.NONE))
                    .isInstanceOf(TransportBadRequestException.class);
        }
    }

    @Nested
    @DisplayName("threads")
    class Threads {

        @Test
        @DisplayName("Should forward user messages into an open thread")
        void shouldForwardIntoThread() {
            when(threadRegistry.requireOpen(GROUP, 7L)).thenReturn(thread(7L, false));

            transport.forwardMessage(message("still broken"), GROUP, 7L);

            assertThat(staffEvents).singleElement().satisfies(args -> {
                OutboundMessagePayload payload = (OutboundMessagePayload) args[1];
                assertThat(payload.getThreadId()).isEqualTo(7L);
                assertThat(payload.isForwarded()).isTrue();
                assertThat(payload.getSenderName()).isEqualTo("Иван");
            });
        }

        @Test
        @DisplayName("Should fail forwarding into a closed thread")
        void shouldRejectClosedThread() {
            when(threadRegistry.requireOpen(GROUP, 7L)).thenThrow(new TransportBadRequestException("closed"));

            assertThatThrownBy(() -> transport.forwardMessage(message("hi"), GROUP, 7L))
                    .isInstanceOf(TransportBadRequestException.class);
            assertThat(staffEvents).isEmpty();
        }

        @Test
        @DisplayName("Should create threads only in the configured staff group")
        void shouldCreateThread() {
            when(threadRegistry.create(GROUP, "Иван")).thenReturn(thread(3L, false));

            ThreadHandle handle = transport.createDiscussionThread(GROUP, "Иван");

            assertThat(handle).isEqualTo(new ThreadHandle(3L, "Иван"));
            assertThat(staffEvents).singleElement().satisfies(args -> {
                assertThat(args[0]).isEqualTo(SocketIoSupportTransport.THREAD_EVENT);
                assertThat(((ThreadEventPayload) args[1]).getAction()).isEqualTo(ThreadEventPayload.Action.CREATED);
            });
            assertThatThrownBy(() -> transport.createDiscussionThread("other-group", "x"))
                    .isInstanceOf(TransportBadRequestException.class);
        }

        @Test
        @DisplayName("Should announce thread closure")
        void shouldCloseThread() {
            when(threadRegistry.setClosed(GROUP, 7L, true)).thenReturn(thread(7L, true));

            transport.closeDiscussionThread(GROUP, 7L);

            verify(threadRegistry).setClosed(GROUP, 7L, true);
            assertThat(((ThreadEventPayload) staffEvents.get(0)[1]).getAction())
                    .isEqualTo(ThreadEventPayload.Action.CLOSED);
        }
    }

    @Nested
    @DisplayName("staff notices")
    class StaffNotices {

        @Test
        @DisplayName("Should post the resolution notice into a thread that was just closed")
        void shouldReachClosedThread() {
            SupportNotifier notifier = new SupportNotifier(transport, new SupportProperties());
            when(threadRegistry.setClosed(GROUP, 7L, true)).thenReturn(thread(7L, true));
            when(threadRegistry.require(GROUP, 7L)).thenReturn(thread(7L, true));
            when(threadRegistry.requireOpen(GROUP, 7L)).thenThrow(new TransportBadRequestException("closed"));

            transport.closeDiscussionThread(GROUP, 7L);
            boolean delivered = notifier.notifyStaff(7L, "✅ Тикет №42 закрыт");

            assertThat(delivered).isTrue();
            assertThat(staffEvents).hasSize(2);
            assertThat(staffEvents.get(1)[0]).isEqualTo(SocketIoSupportTransport.MESSAGE_EVENT);
            OutboundMessagePayload payload = (OutboundMessagePayload) staffEvents.get(1)[1];
            assertThat(payload.getThreadId()).isEqualTo(7L);
            assertThat(payload.getText()).isEqualTo("✅ Тикет №42 закрыт");
        }

        @Test
        @DisplayName("Should still refuse notices for unknown threads")
        void shouldRejectUnknownThread() {
            SupportNotifier notifier = new SupportNotifier(transport, new SupportProperties());
            when(threadRegistry.require(GROUP, 9L)).thenThrow(new TransportBadRequestException("Unknown thread 9"));

            assertThat(notifier.notifyStaff(9L, "text")).isFalse();
            assertThat(staffEvents).isEmpty();
        }

        @Test
        @DisplayName("Should keep participant messages out of closed threads")
        void shouldRejectParticipantMessageInClosedThread() {
            when(threadRegistry.requireOpen(GROUP, 7L)).thenThrow(new TransportBadRequestException("closed"));

            assertThatThrownBy(() -> transport.sendText(GROUP, "text",
                    MessageOptions.builder().threadId(7L).build()))
                    .isInstanceOf(TransportBadRequestException.class);
            assertThat(staffEvents).isEmpty();
        }
    }
}
