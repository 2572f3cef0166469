package com.odin.share_relay_service.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import lombok.extern.slf4j.Slf4j;

/**
 * Open connections by principal. A principal has at most one live connection; a new one
 * replaces the old. Sessions are decorated so lanes and timers can send concurrently.
 */
@Slf4j
@Service
public class SessionRegistryService {

    // principalId -> decorated session
    private final Map<String, WebSocketSession> activeSessions = new ConcurrentHashMap<>();
    // raw session id -> principalId
    private final Map<String, String> principalsBySessionId = new ConcurrentHashMap<>();

    @Value("${websocket.send-time-limit-ms:10000}")
    private int sendTimeLimitMs = 10000;

    @Value("${websocket.send-buffer-size-limit:134217728}")
    private int sendBufferSizeLimit = 134217728;

    public void registerSession(String principalId, WebSocketSession session) {
        if (principalId == null || session == null) return;
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        WebSocketSession previous = activeSessions.put(principalId, decorated);
        principalsBySessionId.put(session.getId(), principalId);
        if (previous != null) {
            principalsBySessionId.remove(previous.getId());
            log.info("Replaced session {} of principal: {}", previous.getId(), principalId);
        }
        log.info("Registered session {} for principal: {}", session.getId(), principalId);
    }

    /**
     * Remove a closed session and return its principal if it was still the principal's live one.
     */
    public String removeSession(WebSocketSession session) {
        if (session == null) return null;
        String principalId = principalsBySessionId.remove(session.getId());
        if (principalId == null) {
            return null;
        }
        WebSocketSession current = activeSessions.get(principalId);
        if (current != null && current.getId().equals(session.getId())) {
            activeSessions.remove(principalId, current);
            log.info("Removed session {} for principal: {}", session.getId(), principalId);
            return principalId;
        }
        return null;
    }

    public WebSocketSession getSession(String principalId) {
        return activeSessions.get(principalId);
    }

    public boolean isOnline(String principalId) {
        WebSocketSession session = activeSessions.get(principalId);
        return session != null && session.isOpen();
    }

    public String getPrincipalIdBySession(WebSocketSession session) {
        return session == null ? null : principalsBySessionId.get(session.getId());
    }

}
