package com.flagship.token_wallet.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the billing engine. The usage topic belongs to the chat and
 * call services and is not created here.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.sessions:billing.sessions}")
    private String sessionsTopic;

    @Value("${kafka.topic.bookings:billing.bookings}")
    private String bookingsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic sessionsTopic() {
        return TopicBuilder.name(sessionsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic bookingsTopic() {
        return TopicBuilder.name(bookingsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
