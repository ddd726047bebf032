package com.example.support.dispatch;

import com.example.support.transport.SupportEvent;

@FunctionalInterface
public interface DispatchChain {

    void proceed(SupportEvent event);
}
