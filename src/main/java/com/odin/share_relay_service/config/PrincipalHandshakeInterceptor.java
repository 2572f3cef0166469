package com.odin.share_relay_service.config;

import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.utility.JwtUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates the WebSocket upgrade: the {@code token} query parameter must be a valid JWT.
 * The JWT subject becomes the principal id of every frame on that connection.
 */
@Slf4j
public class PrincipalHandshakeInterceptor implements HandshakeInterceptor {

    private final JwtUtil jwtUtil;

    public PrincipalHandshakeInterceptor(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(ApplicationConstants.TOKEN_QUERY_PARAM);

        if (token == null || !jwtUtil.validateToken(token)) {
            log.warn("[HANDSHAKE] Rejected upgrade without a valid token - uri={}", request.getURI().getPath());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        String principalId = jwtUtil.getPrincipalId(token);
        attributes.put(ApplicationConstants.PRINCIPAL_ATTRIBUTE, principalId);
        log.debug("[HANDSHAKE] Upgrade accepted for principal={}", principalId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.error("[HANDSHAKE] WebSocket handshake failed: {}", exception.getMessage(), exception);
        }
    }
}
