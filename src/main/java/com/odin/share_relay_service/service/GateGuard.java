package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.GateProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.NavigationButton;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Wraps entry points with the membership check. The gate is asked on every call;
 * results are never cached because membership can be revoked at any time.
 */
@Slf4j
@Service
public class GateGuard {

    private final MembershipGate membershipGate;
    private final UserNotifier userNotifier;
    private final GateProperties gateProperties;

    public GateGuard(MembershipGate membershipGate, UserNotifier userNotifier, GateProperties gateProperties) {
        this.membershipGate = membershipGate;
        this.userNotifier = userNotifier;
        this.gateProperties = gateProperties;
    }

    public boolean check(String principalId) {
        boolean authorized = membershipGate.isAuthorized(principalId);
        if (!authorized) {
            log.info("[GATE] Denied principal={}", principalId);
        }
        return authorized;
    }

    public <T> T call(String principalId, Supplier<T> action, Supplier<T> denial) {
        return check(principalId) ? action.get() : denial.get();
    }

    /**
     * Guarded version of {@code action}; denied principals get the restricted notice
     * with a retry button carrying {@code retryAction}.
     */
    public Consumer<String> guarded(Consumer<String> action, String retryAction) {
        return principalId -> {
            if (check(principalId)) {
                action.accept(principalId);
            } else {
                notifyRestricted(principalId, retryAction);
            }
        };
    }

    public void notifyRestricted(String principalId, String retryAction) {
        List<List<NavigationButton>> keyboard = new ArrayList<>();
        if (gateProperties.getInviteLink() != null && !gateProperties.getInviteLink().isBlank()) {
            keyboard.add(List.of(NavigationButton.link(ApplicationConstants.BUTTON_JOIN_GROUP, gateProperties.getInviteLink())));
        }
        if (retryAction != null) {
            keyboard.add(List.of(NavigationButton.of(ApplicationConstants.BUTTON_RETRY, retryAction)));
        }
        userNotifier.notice(principalId,
                "🔒 Access restricted. Join the group to use this service, then try again.", keyboard);
    }
}
