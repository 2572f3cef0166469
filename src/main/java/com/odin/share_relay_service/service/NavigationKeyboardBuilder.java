package com.odin.share_relay_service.service;

import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.PageWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Renders page navigation as keyboard rows:
 * up to five page numbers centered on the current page, then previous/next,
 * then first/last whenever the current page is not already the first or last.
 * The current page button is a no-op.
 */
public final class NavigationKeyboardBuilder {

    static final int MAX_NUMBERED = 5;

    private NavigationKeyboardBuilder() {
    }

    /**
     * @param actionForPage callback data of the button leading to a page
     * @return rows, empty when there is only one page
     */
    public static List<List<NavigationButton>> build(PageWindow window, IntFunction<String> actionForPage) {
        int current = window.getEffectivePage();
        int totalPages = window.getTotalPages();
        if (totalPages <= 1) {
            return Collections.emptyList();
        }

        int first = Math.max(1, Math.min(current - MAX_NUMBERED / 2, totalPages - MAX_NUMBERED + 1));
        int last = Math.min(totalPages, first + MAX_NUMBERED - 1);

        List<NavigationButton> numbers = new ArrayList<>();
        for (int page = first; page <= last; page++) {
            numbers.add(page == current
                    ? NavigationButton.of("· " + page + " ·", ApplicationConstants.ACTION_NOOP)
                    : NavigationButton.of(String.valueOf(page), actionForPage.apply(page)));
        }

        List<List<NavigationButton>> rows = new ArrayList<>();
        rows.add(numbers);

        List<NavigationButton> steps = new ArrayList<>();
        if (window.hasPrevious()) {
            steps.add(NavigationButton.of(ApplicationConstants.BUTTON_PREVIOUS, actionForPage.apply(current - 1)));
        }
        if (window.hasNext()) {
            steps.add(NavigationButton.of(ApplicationConstants.BUTTON_NEXT, actionForPage.apply(current + 1)));
        }
        if (!steps.isEmpty()) {
            rows.add(steps);
        }

        List<NavigationButton> ends = new ArrayList<>();
        if (window.hasPrevious()) {
            ends.add(NavigationButton.of(ApplicationConstants.BUTTON_FIRST, actionForPage.apply(1)));
        }
        if (window.hasNext()) {
            ends.add(NavigationButton.of(ApplicationConstants.BUTTON_LAST, actionForPage.apply(totalPages)));
        }
        if (!ends.isEmpty()) {
            rows.add(ends);
        }
        return rows;
    }
}
