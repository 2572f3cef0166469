package com.odin.share_relay_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the membership gate that guards uploads and retrievals.
 */
@Data
@Component
@ConfigurationProperties(prefix = "share.gate")
public class GateProperties {

    /**
     * When false every principal is authorized (local development only).
     */
    private boolean enabled = true;

    /**
     * Base URL of the membership service.
     */
    private String baseUrl = "http://localhost:8085";

    /**
     * Group a principal must belong to.
     */
    private String requiredGroupId;

    /**
     * Invite link shown to principals that fail the gate.
     */
    private String inviteLink;
}
