package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Remembers the share token a viewer asked for while the gate denied them, so a later
 * {@code start} can pick it up.
 * 
 * Redis Key Format: {prefix}:pending:{principalId}
 * Value: share token, expiring after share.relay.pending-token-ttl
 *
 * Redis failures are logged and read as "nothing pending".
 */
@Slf4j
@Service
public class PendingRetrievalService {

    private final StringRedisTemplate redisTemplate;
    private final ShareRelayProperties properties;

    public PendingRetrievalService(StringRedisTemplate redisTemplate, ShareRelayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    public void remember(String principalId, String shareToken) {
        try {
            redisTemplate.opsForValue().set(key(principalId), shareToken, properties.getPendingTokenTtl());
            log.info("[PENDING] Remembered token={} for principal={}", shareToken, principalId);
        } catch (RuntimeException e) {
            log.error("[PENDING] Failed to remember token={} for principal={}: {}", shareToken, principalId, e.getMessage());
        }
    }

    public Optional<String> pendingToken(String principalId) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key(principalId)));
        } catch (RuntimeException e) {
            log.error("[PENDING] Failed to read pending token for principal={}: {}", principalId, e.getMessage());
            return Optional.empty();
        }
    }

    public void clear(String principalId) {
        try {
            redisTemplate.delete(key(principalId));
        } catch (RuntimeException e) {
            log.error("[PENDING] Failed to clear pending token for principal={}: {}", principalId, e.getMessage());
        }
    }

    private String key(String principalId) {
        return properties.getRedisKeyPrefix() + ":" + ApplicationConstants.REDIS_PENDING_TOKEN_SEGMENT + ":" + principalId;
    }
}
