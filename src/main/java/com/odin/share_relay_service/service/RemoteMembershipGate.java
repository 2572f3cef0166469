package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.GateProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.MembershipStatus;
import com.odin.share_relay_service.exception.GateException;
import com.odin.share_relay_service.repo.MembershipRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Gate backed by the membership service: a principal passes unless it left, was banned
 * or was kicked from the required group. Any failure denies.
 */
@Slf4j
@Service
public class RemoteMembershipGate implements MembershipGate {

    private static final Set<String> DENIED_STATUSES = Set.of(
            ApplicationConstants.MEMBER_STATUS_LEFT,
            ApplicationConstants.MEMBER_STATUS_BANNED,
            ApplicationConstants.MEMBER_STATUS_KICKED);

    private final MembershipRepository membershipRepository;
    private final GateProperties gateProperties;

    public RemoteMembershipGate(MembershipRepository membershipRepository, GateProperties gateProperties) {
        this.membershipRepository = membershipRepository;
        this.gateProperties = gateProperties;
    }

    @Override
    public boolean isAuthorized(String principalId) {
        if (!gateProperties.isEnabled()) {
            return true;
        }
        String groupId = gateProperties.getRequiredGroupId();
        if (groupId == null || groupId.isBlank()) {
            log.error("[GATE] share.gate.required-group-id is not set, denying principal={}", principalId);
            return false;
        }

        try {
            MembershipStatus membership = membershipRepository.findStatus(principalId, groupId);
            if (membership == null || membership.getStatus() == null) {
                log.warn("[GATE] No membership status for principal={} group={}, denying", principalId, groupId);
                return false;
            }
            boolean authorized = !DENIED_STATUSES.contains(membership.getStatus().toUpperCase());
            log.debug("[GATE] principal={} group={} status={} authorized={}",
                    principalId, groupId, membership.getStatus(), authorized);
            return authorized;
        } catch (GateException e) {
            log.warn("[GATE] Membership check failed principal={} group={}, denying: {}",
                    principalId, groupId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[GATE] Unexpected gate failure principal={}, denying", principalId, e);
            return false;
        }
    }
}
