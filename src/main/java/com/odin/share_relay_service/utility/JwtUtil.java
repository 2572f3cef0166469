package com.odin.share_relay_service.utility;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.odin.share_relay_service.constants.ApplicationConstants;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates the JWTs that identify principals. The subject claim is the principal id.
 */
@Slf4j
@Component
public class JwtUtil {

    @Value("${jwt.secret}")
    private String secret;

    private Key key;

    @PostConstruct
    public void init() {
        key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public boolean validateToken(String token) {
        try {
            parse(token);
            return true;
        } catch (io.jsonwebtoken.ExpiredJwtException e) {
            log.warn("JWT expired for principal={} (exp={})", e.getClaims().getSubject(), e.getClaims().getExpiration());
        } catch (io.jsonwebtoken.security.SignatureException e) {
            log.warn("Invalid JWT signature: {}", e.getMessage());
        } catch (io.jsonwebtoken.MalformedJwtException e) {
            log.warn("Malformed JWT: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
        }
        return false;
    }

    public String getPrincipalId(String token) {
        return parse(token).getSubject();
    }

    /**
     * Resolve the principal from an {@code Authorization: Bearer ...} header value.
     *
     * @return the principal id, empty when the header is absent or the token invalid
     */
    public Optional<String> resolveBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(ApplicationConstants.BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(ApplicationConstants.BEARER_PREFIX.length()).trim();
        if (!validateToken(token)) {
            return Optional.empty();
        }
        return Optional.ofNullable(getPrincipalId(token));
    }

    private Claims parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
    }
}
