package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.ShareAuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Publishes share-created events to Kafka, keyed by owner. Never fails the caller.
 */
@Slf4j
@Service
public class ShareAuditPublisher {

    private final KafkaTemplate<String, ShareAuditEvent> kafkaTemplate;
    private final ShareRelayProperties properties;

    public ShareAuditPublisher(KafkaTemplate<String, ShareAuditEvent> kafkaTemplate, ShareRelayProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
    }

    public void publishCreated(String shareToken, String ownerPrincipalId, int itemCount, String caption, String link) {
        if (!properties.isAuditEnabled()) {
            log.debug("Share audit publishing is disabled via configuration");
            return;
        }

        ShareAuditEvent event = ShareAuditEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .shareToken(shareToken)
                .ownerPrincipalId(ownerPrincipalId)
                .itemCount(itemCount)
                .caption(caption)
                .link(link)
                .createdAt(System.currentTimeMillis())
                .build();

        try {
            kafkaTemplate.sendDefault(ownerPrincipalId, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("[AUDIT] Failed to publish event for token={}: {}",
                                    shareToken, ex.getMessage());
                        } else {
                            log.debug("[AUDIT] Published event for token={} to partition={} offset={}",
                                    shareToken,
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("[AUDIT] Error publishing event for token={}: {}", shareToken, e.getMessage(), e);
        }
    }
}
