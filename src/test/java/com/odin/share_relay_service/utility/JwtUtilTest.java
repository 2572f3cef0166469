package com.odin.share_relay_service.utility;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class JwtUtilTest {

    private static final String SECRET = "unit-test-secret-unit-test-secret-unit-test-0123";

    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        jwtUtil = new JwtUtil();
        ReflectionTestUtils.setField(jwtUtil, "secret", SECRET);
        jwtUtil.init();
    }

    @Test
    void resolvesPrincipalFromBearerHeader() {
        String token = token(SECRET, "alice", 60_000);

        assertThat(jwtUtil.validateToken(token)).isTrue();
        assertThat(jwtUtil.getPrincipalId(token)).isEqualTo("alice");
        assertThat(jwtUtil.resolveBearer("Bearer " + token)).contains("alice");
    }

    @Test
    void rejectsMissingForeignAndExpiredTokens() {
        assertThat(jwtUtil.resolveBearer(null)).isEmpty();
        assertThat(jwtUtil.resolveBearer("Basic abc")).isEmpty();
        assertThat(jwtUtil.resolveBearer("Bearer " + token("another-secret-another-secret-another-0123", "alice", 60_000))).isEmpty();
        assertThat(jwtUtil.resolveBearer("Bearer " + token(SECRET, "alice", -60_000))).isEmpty();
        assertThat(jwtUtil.validateToken("not-a-jwt")).isFalse();
    }

    private static String token(String secret, String subject, long ttlMillis) {
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + ttlMillis))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
