package com.example.support.dispatch;

import com.example.support.transport.SupportEvent;

/**
 * Wraps the handling of one inbound event. Implementations call {@link DispatchChain#proceed}
 * to continue, and run in {@link org.springframework.core.annotation.Order} order, lowest first.
 */
public interface DispatchInterceptor {

    void intercept(SupportEvent event, DispatchChain chain);
}
