package com.odin.share_relay_service.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Unguessable share tokens: 64 random bits, URL-safe base64 without padding (11 characters).
 */
@Component
public class ShareTokenGenerator {

    private static final int TOKEN_BYTES = 8;

    private final SecureRandom random = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    public String next() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }
}
