package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.PageWindow;

import java.util.List;

/**
 * Page arithmetic over ordered lists. Pages are 1-based; an empty list still has one page.
 */
public final class Pager {

    private Pager() {
    }

    public static PageWindow paginate(int totalItems, int pageSize, int requestedPage) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        int total = Math.max(0, totalItems);
        int totalPages = Math.max(1, total / pageSize + (total % pageSize == 0 ? 0 : 1));
        int effectivePage = Math.min(Math.max(requestedPage, 1), totalPages);
        // below total whenever total > 0, so the product stays in range
        int offset = (effectivePage - 1) * pageSize;
        int length = Math.max(0, Math.min(pageSize, total - offset));
        return new PageWindow(effectivePage, totalPages, offset, length);
    }

    public static <T> List<T> slice(List<T> items, PageWindow window) {
        return items.subList(window.getOffset(), window.getOffset() + window.getLength());
    }
}
