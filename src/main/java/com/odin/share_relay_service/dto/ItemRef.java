package com.odin.share_relay_service.dto;

import lombok.Value;

/**
 * Durable handle of a relayed item: the key of its folder in the item store.
 */
@Value(staticConstructor = "of")
public class ItemRef {

    String key;

    @Override
    public String toString() {
        return key;
    }
}
