package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.PageWindow;
import com.odin.share_relay_service.dto.ShareSummary;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.entity.ShareRecord;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.service.GateGuard;
import com.odin.share_relay_service.service.IShareManagementService;
import com.odin.share_relay_service.service.Pager;
import com.odin.share_relay_service.service.ShareRegistry;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Component for share management business logic.
 * 
 * Responsibilities:
 * - Page through an owner's shares
 * - Resolve share links for their owner
 * - Delete shares on behalf of their owner
 */
@Slf4j
@Component("shareManagementComponent")
public class ShareManagementComponent implements IShareManagementService {

    private final ShareRegistry shareRegistry;
    private final GateGuard gateGuard;
    private final ShareLinkFormatter shareLinkFormatter;
    private final ShareRelayProperties properties;

    public ShareManagementComponent(ShareRegistry shareRegistry,
                                    GateGuard gateGuard,
                                    ShareLinkFormatter shareLinkFormatter,
                                    ShareRelayProperties properties) {
        this.shareRegistry = shareRegistry;
        this.gateGuard = gateGuard;
        this.shareLinkFormatter = shareLinkFormatter;
        this.properties = properties;
    }

    @Override
    public ShareSummaryPage listShares(String ownerPrincipalId, int page) {
        if (!gateGuard.check(ownerPrincipalId)) {
            throw new ForbiddenException("Principal " + ownerPrincipalId + " is not a member");
        }

        long total = shareRegistry.countByOwner(ownerPrincipalId);
        PageWindow window = Pager.paginate((int) Math.min(total, Integer.MAX_VALUE), properties.getPageSize(), page);

        List<ShareSummary> shares = window.getLength() == 0
                ? Collections.emptyList()
                : shareRegistry.listByOwner(ownerPrincipalId, window.getOffset(), window.getLength())
                        .stream()
                        .map(this::toSummary)
                        .collect(Collectors.toList());

        log.info("[SHARE-COMPONENT] Listed page {}/{} for owner={} ({} of {} shares)",
                window.getEffectivePage(), window.getTotalPages(), ownerPrincipalId, shares.size(), total);

        return ShareSummaryPage.builder()
                .page(window.getEffectivePage())
                .totalPages(window.getTotalPages())
                .totalShares(total)
                .shares(shares)
                .build();
    }

    @Override
    public String getLink(String shareToken, String requesterPrincipalId) {
        ShareRecord record = shareRegistry.lookup(shareToken);
        if (!record.getOwnerPrincipalId().equals(requesterPrincipalId)) {
            log.warn("[SHARE-COMPONENT] Link of token={} refused to requester={}", shareToken, requesterPrincipalId);
            throw new ForbiddenException("Only the owner may view the link of share " + shareToken);
        }
        return shareLinkFormatter.format(shareToken);
    }

    @Override
    public DeleteOutcome deleteShare(String shareToken, String requesterPrincipalId) {
        return shareRegistry.delete(shareToken, requesterPrincipalId);
    }

    private ShareSummary toSummary(ShareRecord record) {
        return ShareSummary.builder()
                .shareToken(record.getShareToken())
                .caption(record.getCaption())
                .kind(record.getKind())
                .itemCount(record.getItemCount())
                .createdAt(record.getCreatedAt())
                .link(shareLinkFormatter.format(record.getShareToken()))
                .build();
    }
}
