package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.DrainedSession;
import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.exception.InvalidStateException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.service.DebouncedAggregator;
import com.odin.share_relay_service.service.GateGuard;
import com.odin.share_relay_service.service.RelayPipeline;
import com.odin.share_relay_service.service.SessionStore;
import com.odin.share_relay_service.service.ShareAuditPublisher;
import com.odin.share_relay_service.service.ShareRegistry;
import com.odin.share_relay_service.service.UserNotifier;
import com.odin.share_relay_service.utility.KeyedSerialExecutor;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Component for the upload flow: begin, items, finish, cancel.
 * 
 * All methods except {@link #abandonIdleSessions()} run on the principal's lane.
 */
@Slf4j
@Component
public class UploadComponent {

    private final SessionStore sessionStore;
    private final DebouncedAggregator debouncedAggregator;
    private final RelayPipeline relayPipeline;
    private final ShareRegistry shareRegistry;
    private final ShareAuditPublisher shareAuditPublisher;
    private final ShareLinkFormatter shareLinkFormatter;
    private final GateGuard gateGuard;
    private final UserNotifier userNotifier;
    private final KeyedSerialExecutor principalLanes;
    private final ShareRelayProperties properties;

    public UploadComponent(SessionStore sessionStore,
                           DebouncedAggregator debouncedAggregator,
                           RelayPipeline relayPipeline,
                           ShareRegistry shareRegistry,
                           ShareAuditPublisher shareAuditPublisher,
                           ShareLinkFormatter shareLinkFormatter,
                           GateGuard gateGuard,
                           UserNotifier userNotifier,
                           KeyedSerialExecutor principalLanes,
                           ShareRelayProperties properties) {
        this.sessionStore = sessionStore;
        this.debouncedAggregator = debouncedAggregator;
        this.relayPipeline = relayPipeline;
        this.shareRegistry = shareRegistry;
        this.shareAuditPublisher = shareAuditPublisher;
        this.shareLinkFormatter = shareLinkFormatter;
        this.gateGuard = gateGuard;
        this.userNotifier = userNotifier;
        this.principalLanes = principalLanes;
        this.properties = properties;
    }

    public void beginUpload(String principalId) {
        gateGuard.guarded(this::startCollecting, commandAction(ApplicationConstants.COMMAND_BEGIN_UPLOAD))
                .accept(principalId);
    }

    public void onItem(InboundItem item) {
        String principalId = item.getPrincipalId();
        if (!gateGuard.check(principalId)) {
            gateGuard.notifyRestricted(principalId, null);
            return;
        }

        String sessionId;
        try {
            sessionId = sessionStore.requireCollecting(principalId);
        } catch (InvalidStateException e) {
            log.info("[UPLOAD] Item message={} from idle principal={} rejected", item.getMessageId(), principalId);
            userNotifier.notice(principalId, "⚠️ Press \"" + ApplicationConstants.BUTTON_UPLOAD + "\" first, then send your files.",
                    List.of(List.of(uploadButton())));
            return;
        }

        sessionStore.touch(principalId);
        debouncedAggregator.submit(item, sessionId);
    }

    /**
     * Publish everything relayed so far as one share.
     *
     * @return the share token, empty if nothing was published
     */
    public Optional<String> finishUpload(String principalId) {
        debouncedAggregator.flush(principalId);
        DrainedSession drained = sessionStore.drain(principalId);
        if (drained.isEmpty()) {
            userNotifier.notice(principalId, "You did not upload any files.", List.of(List.of(uploadButton())));
            return Optional.empty();
        }

        int count = drained.getCount();
        String caption = String.format(ApplicationConstants.BATCH_CAPTION_FORMAT, count);
        ShareKind kind = count == 1 ? ShareKind.FILE : ShareKind.COLLECTION;
        String token;
        try {
            token = shareRegistry.create(principalId, drained.getRefs(), caption, kind);
        } catch (PersistenceException e) {
            log.error("[UPLOAD] Share not saved principal={} items={}, session restored: {}",
                    principalId, count, e.getMessage());
            sessionStore.restore(drained);
            userNotifier.notice(principalId, "⚠️ Could not save your files right now. Your upload is kept, please finish again.",
                    List.of(List.of(finishButton())));
            return Optional.empty();
        }

        String link = shareLinkFormatter.format(token);
        log.info("[UPLOAD] Upload finished principal={} token={} items={}", principalId, token, count);
        userNotifier.notice(principalId, "✅ Saved " + count + " file(s).\n🔗 Share link: " + link);
        shareAuditPublisher.publishCreated(token, principalId, count, caption, link);
        return Optional.of(token);
    }

    /**
     * Stop collecting. Buffered groups are dropped; what was already relayed is published.
     */
    public Optional<String> cancel(String principalId) {
        int dropped = debouncedAggregator.discard(principalId);
        if (!sessionStore.isCollecting(principalId)) {
            userNotifier.notice(principalId, "Nothing to cancel.");
            return Optional.empty();
        }
        if (dropped > 0) {
            userNotifier.notice(principalId, "⚠️ " + dropped + " file(s) still being received were dropped.");
        }
        log.info("[UPLOAD] Upload cancelled principal={} dropped={}", principalId, dropped);
        return finishUpload(principalId);
    }

    /**
     * Close sessions idle for longer than share.relay.session-idle-ttl and remove their items.
     */
    public int abandonIdleSessions() {
        List<DrainedSession> abandoned = sessionStore.abandonIdle(properties.getSessionIdleTtl());
        for (DrainedSession drained : abandoned) {
            String principalId = drained.getPrincipalId();
            principalLanes.submit(principalId, () -> {
                debouncedAggregator.discard(principalId);
                relayPipeline.discard(principalId, drained.getRefs());
                userNotifier.notice(principalId, "⌛ Your upload was closed after a long time without activity.");
            });
        }
        return abandoned.size();
    }

    private void startCollecting(String principalId) {
        debouncedAggregator.discard(principalId);
        DrainedSession stale = sessionStore.abandon(principalId);
        if (!stale.isEmpty()) {
            log.info("[UPLOAD] Discarding {} item(s) of unfinished upload principal={}", stale.getCount(), principalId);
            relayPipeline.discard(principalId, stale.getRefs());
        }
        sessionStore.begin(principalId);
        userNotifier.notice(principalId, "📤 Send me your files now. Press \"" + ApplicationConstants.BUTTON_FINISH
                + "\" when you are done.", List.of(List.of(finishButton())));
    }

    static String commandAction(String command) {
        return ApplicationConstants.ACTION_COMMAND + ApplicationConstants.CALLBACK_SEPARATOR + command;
    }

    static NavigationButton uploadButton() {
        return NavigationButton.of(ApplicationConstants.BUTTON_UPLOAD, commandAction(ApplicationConstants.COMMAND_BEGIN_UPLOAD));
    }

    static NavigationButton finishButton() {
        return NavigationButton.of(ApplicationConstants.BUTTON_FINISH, commandAction(ApplicationConstants.COMMAND_FINISH_UPLOAD));
    }
}
