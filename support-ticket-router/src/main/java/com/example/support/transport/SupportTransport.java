package com.example.support.transport;

/**
 * Narrow view of the chat transport used by the routing engine. Every call may fail with
 * {@link TransportForbiddenException}, {@link TransportBadRequestException} or a plain
 * {@link TransportException}.
 */
public interface SupportTransport {

    MessageHandle sendText(String targetId, String text, MessageOptions options);

    MessageHandle forwardMessage(InboundMessage message, String groupId, long threadId);

    MessageHandle copyMessage(InboundMessage message, String targetId);

    void editText(String targetId, long messageId, String text, MessageOptions options);

    ThreadHandle createDiscussionThread(String groupId, String title);

    void closeDiscussionThread(String groupId, long threadId);

    void reopenDiscussionThread(String groupId, long threadId);
}
