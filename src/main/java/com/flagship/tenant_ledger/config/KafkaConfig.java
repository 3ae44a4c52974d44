package com.flagship.tenant_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that carries VoucherPosted events.
 * Records are keyed by tenant id, so one tenant's vouchers stay in order
 * within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.vouchers:ledger.vouchers}")
    private String vouchersTopic;

    @Value("${kafka.topic.partitions:6}")
    private int partitions;

    @Bean
    public NewTopic vouchersTopic() {
        return TopicBuilder.name(vouchersTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
