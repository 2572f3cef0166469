package com.odin.share_relay_service.dto;

import lombok.Builder;
import lombok.Value;

/**
 * An uploaded item as handed to the aggregator. {@code sequence} is the arrival order
 * within the principal's connection and decides the item's position in the share.
 */
@Value
@Builder
public class InboundItem {

    String principalId;
    String messageId;
    String groupId;
    String fileName;
    String mediaType;
    byte[] content;
    long sequence;

    public boolean isGrouped() {
        return groupId != null && !groupId.isBlank();
    }
}
