package com.odin.share_relay_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kafka payload published when a share is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareAuditEvent {

    private String eventId;
    private String shareToken;
    private String ownerPrincipalId;
    private int itemCount;
    private String caption;
    private String link;
    private Long createdAt; // epoch millis
}
