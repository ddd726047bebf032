package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.transport.MessageOptions;
import com.example.support.transport.SupportTransport;
import com.example.support.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort notices. A failed notice is logged and never affects ticket state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupportNotifier {

    private final SupportTransport transport;
    private final SupportProperties supportProperties;

    public boolean notifyUser(String targetId, String text) {
        return notifyUser(targetId, text, MessageOptions.NONE);
    }

    public boolean notifyUser(String targetId, String text, MessageOptions options) {
        try {
            transport.sendText(targetId, text, options);
            return true;
        } catch (TransportException ex) {
            log.warn("Could not notify user {}: {}", targetId, ex.getMessage());
            return false;
        }
    }

    /**
     * Posts into the ticket thread, or into the staff group itself when {@code threadId} is null.
     * Thread notices are delivered even after the thread was closed.
     */
    public boolean notifyStaff(Long threadId, String text) {
        MessageOptions options = threadId != null ? MessageOptions.noticeInThread(threadId) : MessageOptions.NONE;
        try {
            transport.sendText(staffGroupId(), text, options);
            return true;
        } catch (TransportException ex) {
            log.warn("Could not notify staff in thread {}: {}", threadId, ex.getMessage());
            return false;
        }
    }

    public String staffGroupId() {
        return supportProperties.getStaff().getGroupId();
    }
}
