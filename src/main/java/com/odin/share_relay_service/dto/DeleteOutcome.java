package com.odin.share_relay_service.dto;

import lombok.Value;

import java.util.List;

/**
 * A completed share deletion. {@code warnings} lists items whose retraction from the
 * store failed; the share itself is gone either way.
 */
@Value
public class DeleteOutcome {

    String shareToken;
    int retractedItems;
    List<String> warnings;

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
