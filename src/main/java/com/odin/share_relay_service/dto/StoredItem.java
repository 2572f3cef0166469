package com.odin.share_relay_service.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StoredItem {

    ItemRef ref;
    String fileName;
    String mediaType;
    byte[] content;
}
