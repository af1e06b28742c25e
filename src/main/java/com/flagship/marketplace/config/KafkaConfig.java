package com.flagship.marketplace.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by this service.
 *
 * The notifications topic carries outbox events to the notification
 * dispatcher. The payments topic is written by the payment collaborator
 * and only consumed here, but is declared so local environments work
 * without manual setup.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.notifications:marketplace-notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.payments:marketplace-payments}")
    private String paymentsTopic;

    /**
     * Partitioned by aggregate id, so events of one offer or transaction stay ordered.
     */
    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic paymentsTopic() {
        return TopicBuilder.name(paymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
