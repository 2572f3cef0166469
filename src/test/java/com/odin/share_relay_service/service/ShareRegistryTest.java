package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.entity.ShareRecord;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.RelayException;
import com.odin.share_relay_service.utility.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DataJpaTest
@Import({ShareRegistry.class, ShareTokenGenerator.class, ShareRegistryTest.ClockConfig.class})
class ShareRegistryTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        }
    }

    @Autowired
    private ShareRegistry shareRegistry;

    @Autowired
    private MutableClock clock;

    @MockBean
    private RelayPipeline relayPipeline;

    private static List<ItemRef> refs(String... keys) {
        return Arrays.stream(keys).map(ItemRef::of).collect(Collectors.toList());
    }

    @Test
    void createdShareKeepsItemOrder() {
        String token = shareRegistry.create("alice", refs("k3", "k1", "k2"), "Holiday", ShareKind.COLLECTION);

        ShareRecord record = shareRegistry.lookup(token);

        assertThat(record.getItemRefs()).extracting(ItemRef::getKey).containsExactly("k3", "k1", "k2");
        assertThat(record.getOwnerPrincipalId()).isEqualTo("alice");
        assertThat(record.getCaption()).isEqualTo("Holiday");
        assertThat(record.getKind()).isEqualTo(ShareKind.COLLECTION);
        assertThat(record.getCreatedAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
    }

    @Test
    void listsOwnSharesNewestFirst() {
        String older = shareRegistry.create("alice", refs("a"), "first", ShareKind.FILE);
        clock.advance(Duration.ofMinutes(1));
        shareRegistry.create("bob", refs("b"), "other", ShareKind.FILE);
        clock.advance(Duration.ofMinutes(1));
        String newer = shareRegistry.create("alice", refs("c", "d"), "second", ShareKind.COLLECTION);

        List<ShareRecord> page = shareRegistry.listByOwner("alice", 0, 10);

        assertThat(page).extracting(ShareRecord::getShareToken).containsExactly(newer, older);
        assertThat(shareRegistry.countByOwner("alice")).isEqualTo(2);
        assertThat(shareRegistry.listByOwner("alice", 1, 10)).extracting(ShareRecord::getShareToken).containsExactly(older);
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> shareRegistry.lookup("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> shareRegistry.delete("nope", "alice")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void onlyOwnerMayDelete() {
        String token = shareRegistry.create("alice", refs("a", "b"), "mine", ShareKind.COLLECTION);

        assertThatThrownBy(() -> shareRegistry.delete(token, "mallory")).isInstanceOf(ForbiddenException.class);

        assertThat(shareRegistry.lookup(token).getItemRefs()).extracting(ItemRef::getKey).containsExactly("a", "b");
        verifyNoInteractions(relayPipeline);
    }

    @Test
    void deleteRemovesRecordAndRetractsItems() {
        String token = shareRegistry.create("alice", refs("a", "b"), "mine", ShareKind.COLLECTION);

        DeleteOutcome outcome = shareRegistry.delete(token, "alice");

        assertThat(outcome.isClean()).isTrue();
        assertThat(outcome.getRetractedItems()).isEqualTo(2);
        verify(relayPipeline).retract(ItemRef.of("a"));
        verify(relayPipeline).retract(ItemRef.of("b"));
        assertThatThrownBy(() -> shareRegistry.lookup(token)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void failedRetractionIsReportedButDeleteStands() {
        String token = shareRegistry.create("alice", refs("a", "b"), "mine", ShareKind.COLLECTION);
        doThrow(new RelayException("disk gone")).when(relayPipeline).retract(ItemRef.of("b"));

        DeleteOutcome outcome = shareRegistry.delete(token, "alice");

        assertThat(outcome.isClean()).isFalse();
        assertThat(outcome.getRetractedItems()).isEqualTo(1);
        assertThat(outcome.getWarnings()).containsExactly("disk gone");
        assertThatThrownBy(() -> shareRegistry.lookup(token)).isInstanceOf(NotFoundException.class);
    }
}
