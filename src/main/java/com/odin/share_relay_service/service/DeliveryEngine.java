package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.PageWindow;
import com.odin.share_relay_service.dto.RetrievalResult;
import com.odin.share_relay_service.dto.StoredItem;
import com.odin.share_relay_service.entity.ShareRecord;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.exception.RelayException;
import com.odin.share_relay_service.exception.TransportException;
import com.odin.share_relay_service.utility.DelayScheduler;
import com.odin.share_relay_service.utility.KeyedSerialExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves shares page by page.
 *
 * Every request re-checks the gate, then looks the share up again, so a revoked member
 * or a deleted share is noticed on the very next page. Showing a new page first retracts
 * the previous page's messages. The navigation panel follows the items after a settle delay.
 *
 * Runs on the viewer's lane.
 */
@Slf4j
@Service
public class DeliveryEngine {

    private final GateGuard gateGuard;
    private final ShareRegistry shareRegistry;
    private final RelayPipeline relayPipeline;
    private final ChatTransport chatTransport;
    private final UserNotifier userNotifier;
    private final PendingRetrievalService pendingRetrievalService;
    private final DelayScheduler delayScheduler;
    private final KeyedSerialExecutor principalLanes;
    private final ShareRelayProperties properties;

    // viewer -> page on screen
    private final Map<String, PageView> views = new ConcurrentHashMap<>();

    public DeliveryEngine(GateGuard gateGuard,
                          ShareRegistry shareRegistry,
                          RelayPipeline relayPipeline,
                          ChatTransport chatTransport,
                          UserNotifier userNotifier,
                          PendingRetrievalService pendingRetrievalService,
                          DelayScheduler delayScheduler,
                          KeyedSerialExecutor principalLanes,
                          ShareRelayProperties properties) {
        this.gateGuard = gateGuard;
        this.shareRegistry = shareRegistry;
        this.relayPipeline = relayPipeline;
        this.chatTransport = chatTransport;
        this.userNotifier = userNotifier;
        this.pendingRetrievalService = pendingRetrievalService;
        this.delayScheduler = delayScheduler;
        this.principalLanes = principalLanes;
        this.properties = properties;
    }

    public RetrievalResult retrieve(String viewerId, String shareToken, int requestedPage) {
        return gateGuard.call(viewerId,
                () -> deliver(viewerId, shareToken, requestedPage),
                () -> deny(viewerId, shareToken));
    }

    /**
     * Drop the viewer's page state, e.g. when the connection closes.
     */
    public void forget(String viewerId) {
        PageView view = views.remove(viewerId);
        if (view != null) {
            view.cancelPanel();
        }
    }

    public PageView currentView(String viewerId) {
        return views.get(viewerId);
    }

    private RetrievalResult deny(String viewerId, String shareToken) {
        pendingRetrievalService.remember(viewerId, shareToken);
        gateGuard.notifyRestricted(viewerId, shareAction(1, shareToken));
        return RetrievalResult.UNAUTHORIZED;
    }

    private RetrievalResult deliver(String viewerId, String shareToken, int requestedPage) {
        ShareRecord record;
        try {
            record = shareRegistry.lookup(shareToken);
        } catch (NotFoundException e) {
            log.info("[DELIVERY] Unknown token={} viewer={}", shareToken, viewerId);
            retractCurrent(viewerId);
            userNotifier.notice(viewerId, "❌ This link is invalid or the files were removed.");
            return RetrievalResult.NOT_FOUND;
        } catch (PersistenceException e) {
            log.error("[DELIVERY] Lookup failed token={} viewer={}: {}", shareToken, viewerId, e.getMessage());
            userNotifier.notice(viewerId, "⚠️ Could not load the files right now. Please try again.");
            return RetrievalResult.FAILED;
        }
        pendingRetrievalService.clear(viewerId);

        PageWindow window = Pager.paginate(record.getItemCount(), properties.getPageSize(), requestedPage);
        PageView current = views.get(viewerId);
        if (current != null && current.shows(shareToken, window.getEffectivePage())) {
            log.debug("[DELIVERY] Page {} of token={} already shown to viewer={}", window.getEffectivePage(), shareToken, viewerId);
            return RetrievalResult.UNCHANGED;
        }
        retractCurrent(viewerId);

        List<ItemRef> refs = Pager.slice(record.getItemRefs(), window);
        List<String> messageIds = new ArrayList<>(refs.size());
        int missing = 0;
        for (ItemRef ref : refs) {
            try {
                StoredItem item = relayPipeline.load(ref);
                messageIds.add(chatTransport.sendItem(viewerId, item));
            } catch (RelayException e) {
                missing++;
                log.warn("[DELIVERY] Item {} of token={} unavailable: {}", ref, shareToken, e.getMessage());
            } catch (TransportException e) {
                log.warn("[DELIVERY] Item {} of token={} not delivered to viewer={}: {}", ref, shareToken, viewerId, e.getMessage());
            }
        }

        PageView view = new PageView(shareToken, window, refs, messageIds);
        views.put(viewerId, view);
        int unavailable = missing;
        view.panelScheduled(delayScheduler.schedule(properties.getPanelSettleDelay(),
                () -> principalLanes.submit(viewerId, () -> renderPanel(viewerId, view, record, unavailable))));

        log.info("[DELIVERY] Delivered page {}/{} token={} viewer={} items={} missing={}",
                window.getEffectivePage(), window.getTotalPages(), shareToken, viewerId, messageIds.size(), missing);
        return RetrievalResult.DELIVERED;
    }

    private void renderPanel(String viewerId, PageView view, ShareRecord record, int missing) {
        if (views.get(viewerId) != view) {
            log.debug("[DELIVERY] Panel of superseded page skipped viewer={}", viewerId);
            return;
        }
        PageWindow window = view.getWindow();
        StringBuilder text = new StringBuilder()
                .append("📄 ").append(record.getCaption())
                .append("\nPage ").append(window.getEffectivePage()).append(" of ").append(window.getTotalPages())
                .append(" · ").append(record.getItemCount()).append(" file(s)");
        if (missing > 0) {
            text.append("\n⚠️ ").append(missing).append(" file(s) on this page are no longer available.");
        }
        List<List<NavigationButton>> keyboard = NavigationKeyboardBuilder.build(window,
                page -> shareAction(page, view.getShareToken()));
        try {
            view.panelRendered(chatTransport.sendPanel(viewerId, text.toString(), keyboard));
        } catch (TransportException e) {
            log.warn("[DELIVERY] Panel not delivered viewer={} token={}: {}", viewerId, view.getShareToken(), e.getMessage());
        }
    }

    private void retractCurrent(String viewerId) {
        PageView previous = views.remove(viewerId);
        if (previous == null) {
            return;
        }
        previous.cancelPanel();
        List<String> ids = previous.renderedMessageIds();
        if (ids.isEmpty()) {
            return;
        }
        try {
            chatTransport.retractMessages(viewerId, ids);
        } catch (TransportException e) {
            log.warn("[DELIVERY] Retraction of {} message(s) failed viewer={}: {}", ids.size(), viewerId, e.getMessage());
        }
    }

    static String shareAction(int page, String shareToken) {
        return ApplicationConstants.ACTION_SHARE_PAGE + ApplicationConstants.CALLBACK_SEPARATOR + page
                + ApplicationConstants.CALLBACK_SEPARATOR + shareToken;
    }
}
