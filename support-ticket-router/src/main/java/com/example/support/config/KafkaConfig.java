package com.example.support.config;

import com.example.support.event.TicketEvent;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    private static final String CLIENT_ID = "support-ticket-router";

    @Bean
    public ProducerFactory<String, TicketEvent> ticketEventProducerFactory(KafkaProperties properties) {
        Map<String, Object> producer = new HashMap<>(properties.buildProducerProperties());
        // Events of one ticket share a key and must keep their order across producer retries.
        producer.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        producer.putIfAbsent(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        return new DefaultKafkaProducerFactory<>(producer);
    }

    @Bean
    public KafkaTemplate<String, TicketEvent> ticketEventKafkaTemplate(
            ProducerFactory<String, TicketEvent> ticketEventProducerFactory, SupportProperties supportProperties) {
        KafkaTemplate<String, TicketEvent> template = new KafkaTemplate<>(ticketEventProducerFactory);
        template.setDefaultTopic(supportProperties.getKafka().getTicketTopic());
        return template;
    }

    @Bean
    public NewTopic ticketTopic(SupportProperties supportProperties) {
        SupportProperties.Kafka kafka = supportProperties.getKafka();
        return TopicBuilder.name(kafka.getTicketTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicas())
                .build();
    }
}
