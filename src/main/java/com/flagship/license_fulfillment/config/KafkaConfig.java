package com.flagship.license_fulfillment.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that user notifications and admin alerts are relayed to.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.notifications:license-notifications}")
    private String notificationsTopic;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
