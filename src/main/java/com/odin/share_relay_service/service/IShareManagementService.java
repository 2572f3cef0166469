package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ShareSummaryPage;

/**
 * Owner-facing operations on published shares.
 */
public interface IShareManagementService {

    /**
     * One page of the owner's shares, newest first.
     *
     * @param page 1-based, clamped into range
     * @throws com.odin.share_relay_service.exception.ForbiddenException if the owner fails the gate
     */
    ShareSummaryPage listShares(String ownerPrincipalId, int page);

    /**
     * Public link of a share.
     *
     * @throws com.odin.share_relay_service.exception.NotFoundException if the token is unknown
     * @throws com.odin.share_relay_service.exception.ForbiddenException if the requester is not the owner
     */
    String getLink(String shareToken, String requesterPrincipalId);

    /**
     * Delete a share and retract its items.
     *
     * @return the outcome, with warnings for items that could not be retracted
     * @throws com.odin.share_relay_service.exception.NotFoundException if the token is unknown
     * @throws com.odin.share_relay_service.exception.ForbiddenException if the requester is not the owner
     */
    DeleteOutcome deleteShare(String shareToken, String requesterPrincipalId);
}
