package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.PageWindow;
import com.odin.share_relay_service.utility.DelayScheduler;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * What one viewer currently sees of a share: the delivered item messages of one page and,
 * once the settle delay has passed, its navigation panel.
 */
@Getter
public class PageView {

    private final String shareToken;
    private final PageWindow window;
    private final List<ItemRef> itemRefs;
    private final List<String> itemMessageIds;
    private volatile String panelMessageId;
    private volatile DelayScheduler.Handle panelTimer;

    PageView(String shareToken, PageWindow window, List<ItemRef> itemRefs, List<String> itemMessageIds) {
        this.shareToken = shareToken;
        this.window = window;
        this.itemRefs = List.copyOf(itemRefs);
        this.itemMessageIds = List.copyOf(itemMessageIds);
    }

    public int getPage() {
        return window.getEffectivePage();
    }

    public boolean shows(String token, int page) {
        return shareToken.equals(token) && getPage() == page;
    }

    void panelScheduled(DelayScheduler.Handle handle) {
        this.panelTimer = handle;
    }

    void panelRendered(String messageId) {
        this.panelMessageId = messageId;
        this.panelTimer = null;
    }

    /**
     * Stop a panel that has not been rendered yet.
     */
    void cancelPanel() {
        DelayScheduler.Handle timer = panelTimer;
        if (timer != null) {
            timer.cancel();
            panelTimer = null;
        }
    }

    List<String> renderedMessageIds() {
        List<String> ids = new ArrayList<>(itemMessageIds);
        if (panelMessageId != null) {
            ids.add(panelMessageId);
        }
        return ids;
    }
}
