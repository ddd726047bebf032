package com.example.support.event;

import com.example.support.config.SupportProperties;
import com.example.support.domain.Ticket;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans ticket lifecycle events out to in-process listeners and the Kafka ticket topic. Publishing
 * never fails the caller: the ticket change it reports is already committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketEventPublisher {

    private final List<TicketEventListener> listeners;
    private final KafkaTemplate<String, TicketEvent> ticketEventKafkaTemplate;
    private final SupportProperties supportProperties;
    private final Clock clock;

    public void publish(TicketEventType type, Ticket ticket) {
        publish(TicketEvent.of(type, ticket, clock.instant()));
    }

    public void publish(TicketEvent event) {
        for (TicketEventListener listener : listeners) {
            try {
                listener.onTicketEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Ticket event listener {} failed for ticket {}", listener.getClass().getSimpleName(),
                        event.getTicketId(), ex);
            }
        }
        String key = event.getTicketId() != null ? event.getTicketId().toString() : null;
        try {
            ticketEventKafkaTemplate.send(supportProperties.getKafka().getTicketTopic(), key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish {} event for ticket {}", event.getType(), event.getTicketId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.error("Failed to publish {} event for ticket {}", event.getType(), event.getTicketId(), ex);
        }
    }
}
