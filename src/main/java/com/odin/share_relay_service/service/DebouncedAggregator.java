package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.exception.InvalidStateException;
import com.odin.share_relay_service.exception.RelayException;
import com.odin.share_relay_service.utility.DelayScheduler;
import com.odin.share_relay_service.utility.KeyedSerialExecutor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns bursts of grouped uploads into one relay per group.
 *
 * Every item of a group restarts the group's quiet-period timer; when the timer finally
 * fires the whole buffer is relayed on the principal's lane and the refs are appended to
 * the upload session the items were sent into. Ungrouped items are relayed at once.
 *
 * Must be called from the principal's lane. Only the timer callback runs elsewhere.
 */
@Slf4j
@Service
public class DebouncedAggregator {

    private final RelayPipeline relayPipeline;
    private final SessionStore sessionStore;
    private final KeyedSerialExecutor principalLanes;
    private final DelayScheduler delayScheduler;
    private final UserNotifier userNotifier;
    private final ShareRelayProperties properties;

    private final Map<GroupKey, PendingGroup> groups = new ConcurrentHashMap<>();

    public DebouncedAggregator(RelayPipeline relayPipeline,
                               SessionStore sessionStore,
                               KeyedSerialExecutor principalLanes,
                               DelayScheduler delayScheduler,
                               UserNotifier userNotifier,
                               ShareRelayProperties properties) {
        this.relayPipeline = relayPipeline;
        this.sessionStore = sessionStore;
        this.principalLanes = principalLanes;
        this.delayScheduler = delayScheduler;
        this.userNotifier = userNotifier;
        this.properties = properties;
    }

    public void submit(InboundItem item, String sessionId) {
        String principalId = item.getPrincipalId();
        if (!item.isGrouped()) {
            userNotifier.notice(principalId, "📥 File received, processing...");
            relayAndAccept(principalId, sessionId, null, Collections.singletonList(item));
            return;
        }

        GroupKey key = new GroupKey(principalId, item.getGroupId());
        while (true) {
            boolean[] created = {false};
            PendingGroup group = groups.compute(key, (k, existing) -> {
                if (existing == null || existing.state() != PendingGroup.State.BUFFERING) {
                    created[0] = true;
                    return new PendingGroup(principalId, item.getGroupId(), sessionId);
                }
                return existing;
            });
            if (group.append(item, delayScheduler, properties.getGroupDebounce(), generation -> onQuiet(key, group, generation))) {
                if (created[0]) {
                    log.info("[AGGREGATOR] New group principal={} group={}", principalId, item.getGroupId());
                    userNotifier.notice(principalId, "📦 Received a group of files, processing...");
                }
                log.debug("[AGGREGATOR] Buffered message={} seq={} group={} size={}",
                        item.getMessageId(), item.getSequence(), item.getGroupId(), group.size());
                return;
            }
            // sealed between lookup and append: start a new group
        }
    }

    /**
     * Relay every group of the principal now, on the calling lane.
     */
    public void flush(String principalId) {
        for (Map.Entry<GroupKey, PendingGroup> entry : groupsOf(principalId)) {
            PendingGroup group = entry.getValue();
            group.seal();
            drain(entry.getKey(), group);
        }
    }

    /**
     * Drop the principal's groups without relaying them.
     *
     * A group whose timer already fired but whose relay has not started yet is dropped too;
     * its items are lost.
     *
     * @return number of items dropped
     */
    public int discard(String principalId) {
        int dropped = 0;
        for (Map.Entry<GroupKey, PendingGroup> entry : groupsOf(principalId)) {
            PendingGroup group = entry.getValue();
            List<InboundItem> items = group.discard();
            groups.remove(entry.getKey(), group);
            if (!items.isEmpty()) {
                dropped += items.size();
                log.warn("[AGGREGATOR] Discarded {} buffered item(s) principal={} group={}",
                        items.size(), principalId, group.groupId());
            }
        }
        return dropped;
    }

    public int pendingGroups(String principalId) {
        return groupsOf(principalId).size();
    }

    private void onQuiet(GroupKey key, PendingGroup group, long generation) {
        if (!group.sealIfCurrent(generation)) {
            return;
        }
        log.debug("[AGGREGATOR] Quiet period over principal={} group={} size={}",
                group.principalId(), group.groupId(), group.size());
        principalLanes.submit(group.principalId(), () -> drain(key, group));
    }

    private void drain(GroupKey key, PendingGroup group) {
        List<InboundItem> items = group.claim();
        groups.remove(key, group);
        if (items == null) {
            return;
        }
        relayAndAccept(group.principalId(), group.sessionId(), group.groupId(), items);
    }

    private void relayAndAccept(String principalId, String sessionId, String groupId, List<InboundItem> items) {
        List<ItemRef> refs;
        try {
            refs = relayPipeline.relay(principalId, items);
        } catch (RelayException e) {
            log.error("[AGGREGATOR] Dropped {} item(s) principal={} group={}: {}",
                    items.size(), principalId, groupId, e.getMessage());
            userNotifier.notice(principalId, "⚠️ " + items.size() + " file(s) may not have been saved. Please send them again.");
            return;
        }

        int total = 0;
        List<ItemRef> orphans = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            try {
                total = sessionStore.accept(principalId, sessionId, items.get(i).getSequence(), refs.get(i));
            } catch (InvalidStateException e) {
                orphans.add(refs.get(i));
            }
        }

        if (!orphans.isEmpty()) {
            log.warn("[AGGREGATOR] Session {} of principal={} ended before {} item(s) of group={} arrived; removing them",
                    sessionId, principalId, orphans.size(), groupId);
            relayPipeline.discard(principalId, orphans);
            return;
        }
        log.info("[AGGREGATOR] Accepted {} item(s) principal={} group={} total={}",
                refs.size(), principalId, groupId, total);
        userNotifier.notice(principalId, "✅ Saved " + refs.size() + " file(s). Files in this upload: " + total);
    }

    private List<Map.Entry<GroupKey, PendingGroup>> groupsOf(String principalId) {
        List<Map.Entry<GroupKey, PendingGroup>> owned = new ArrayList<>();
        for (Map.Entry<GroupKey, PendingGroup> entry : groups.entrySet()) {
            if (entry.getKey().getPrincipalId().equals(principalId)) {
                owned.add(Map.entry(entry.getKey(), entry.getValue()));
            }
        }
        return owned;
    }

    @Value
    private static class GroupKey {
        String principalId;
        String groupId;
    }
}
