package com.odin.share_relay_service.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ShareTokenGeneratorTest {

    private final ShareTokenGenerator generator = new ShareTokenGenerator();

    @Test
    @DisplayName("10,000 tokens are all distinct")
    void tokensDoNotCollide() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            tokens.add(generator.next());
        }
        assertThat(tokens).hasSize(10_000);
    }

    @Test
    void tokensAreUrlSafeAndUnpadded() {
        for (int i = 0; i < 100; i++) {
            assertThat(generator.next()).hasSize(11).matches("[A-Za-z0-9_-]+");
        }
    }
}
