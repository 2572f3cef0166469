package com.odin.share_relay_service.service.impl;

import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.service.IShareManagementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Service layer of share management; business logic lives in the component layer.
 */
@Slf4j
@Service("shareManagementServiceImpl")
public class ShareManagementServiceImpl implements IShareManagementService {

    private final IShareManagementService shareManagementComponent;

    public ShareManagementServiceImpl(@Qualifier("shareManagementComponent") IShareManagementService shareManagementComponent) {
        this.shareManagementComponent = shareManagementComponent;
    }

    @Override
    public ShareSummaryPage listShares(String ownerPrincipalId, int page) {
        log.debug("[SHARE-SERVICE] Delegating listing to component layer");
        return shareManagementComponent.listShares(ownerPrincipalId, page);
    }

    @Override
    public String getLink(String shareToken, String requesterPrincipalId) {
        return shareManagementComponent.getLink(shareToken, requesterPrincipalId);
    }

    @Override
    public DeleteOutcome deleteShare(String shareToken, String requesterPrincipalId) {
        log.debug("[SHARE-SERVICE] Delegating delete to component layer");
        return shareManagementComponent.deleteShare(shareToken, requesterPrincipalId);
    }
}
