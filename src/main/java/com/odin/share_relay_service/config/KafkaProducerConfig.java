package com.odin.share_relay_service.config;

import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.ShareAuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration for share audit events.
 */
@Slf4j
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private int retries;

    @Value("${spring.kafka.producer.linger-ms:10}")
    private int lingerMs;

    @Value("${kafka.share-audit.topic:" + ApplicationConstants.KAFKA_SHARE_AUDIT_TOPIC + "}")
    private String auditTopic;

    @Bean
    public ProducerFactory<String, ShareAuditEvent> shareAuditProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, lingerMs);
        configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        log.info("Initializing share audit ProducerFactory with bootstrapServers={}, acks={}, retries={}",
                bootstrapServers, acks, retries);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, ShareAuditEvent> shareAuditKafkaTemplate() {
        KafkaTemplate<String, ShareAuditEvent> template = new KafkaTemplate<>(shareAuditProducerFactory());
        template.setDefaultTopic(auditTopic);
        log.info("Share audit KafkaTemplate configured with default topic: {}", auditTopic);
        return template;
    }
}
