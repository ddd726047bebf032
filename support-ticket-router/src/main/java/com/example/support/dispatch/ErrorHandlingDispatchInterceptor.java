package com.example.support.dispatch;

import com.example.support.service.SupportNotifier;
import com.example.support.service.SupportTexts;
import com.example.support.service.exception.StorageUnavailableException;
import com.example.support.transport.EventOrigin;
import com.example.support.transport.SupportEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Outermost interceptor. Any failure escaping a handler is logged with its context and the sender
 * gets a generic temporary-error notice; conversation state is left as it was.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class ErrorHandlingDispatchInterceptor implements DispatchInterceptor {

    private final SupportNotifier notifier;

    @Override
    public void intercept(SupportEvent event, DispatchChain chain) {
        try {
            chain.proceed(event);
        } catch (StorageUnavailableException ex) {
            log.error("Storage unavailable while handling event from {} (thread {})", event.getChatId(),
                    event.getThreadId(), ex);
            reportTemporaryError(event);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while handling event from {} (thread {})", event.getChatId(),
                    event.getThreadId(), ex);
            reportTemporaryError(event);
        }
    }

    private void reportTemporaryError(SupportEvent event) {
        if (event.getOrigin() == EventOrigin.STAFF) {
            notifier.notifyStaff(event.getThreadId(), SupportTexts.TEMPORARY_ERROR);
        } else {
            notifier.notifyUser(event.getChatId(), SupportTexts.TEMPORARY_ERROR);
        }
    }
}
