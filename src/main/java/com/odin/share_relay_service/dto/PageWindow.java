package com.odin.share_relay_service.dto;

import lombok.Value;

/**
 * Result of paging: the clamped page, the page count and the slice {@code [offset, offset + length)}.
 */
@Value
public class PageWindow {

    int effectivePage;
    int totalPages;
    int offset;
    int length;

    public boolean hasPrevious() {
        return effectivePage > 1;
    }

    public boolean hasNext() {
        return effectivePage < totalPages;
    }
}
