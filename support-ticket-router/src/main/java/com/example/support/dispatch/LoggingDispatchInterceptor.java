package com.example.support.dispatch;

import com.example.support.transport.ChoiceEvent;
import com.example.support.transport.InboundMessage;
import com.example.support.transport.SupportEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(20)
public class LoggingDispatchInterceptor implements DispatchInterceptor {

    @Override
    public void intercept(SupportEvent event, DispatchChain chain) {
        long started = System.nanoTime();
        log.debug("Handling {} from {} (thread {})", describe(event), event.getChatId(), event.getThreadId());
        chain.proceed(event);
        log.debug("Handled {} from {} in {} ms", describe(event), event.getChatId(),
                (System.nanoTime() - started) / 1_000_000);
    }

    private String describe(SupportEvent event) {
        if (event instanceof InboundMessage message) {
            return message.isAnyCommand() ? "command " + message.getText().split(" ")[0]
                    : message.hasContact() ? "contact" : event.getOrigin().name().toLowerCase() + " message";
        }
        if (event instanceof ChoiceEvent choice) {
            return "choice " + choice.getPayload();
        }
        return event.getClass().getSimpleName();
    }
}
