package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.GateProperties;
import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.service.DebouncedAggregator;
import com.odin.share_relay_service.service.GateGuard;
import com.odin.share_relay_service.service.ItemStorageService;
import com.odin.share_relay_service.service.MembershipGate;
import com.odin.share_relay_service.service.RecordingChatTransport;
import com.odin.share_relay_service.service.RelayPipeline;
import com.odin.share_relay_service.service.SessionStore;
import com.odin.share_relay_service.service.ShareAuditPublisher;
import com.odin.share_relay_service.service.ShareRegistry;
import com.odin.share_relay_service.service.UserNotifier;
import com.odin.share_relay_service.utility.KeyedSerialExecutor;
import com.odin.share_relay_service.utility.ManualDelayScheduler;
import com.odin.share_relay_service.utility.MutableClock;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Upload flow over a real item store and session store; only the share registry,
 * the gate and the audit publisher are mocked.
 */
class UploadFlowTest {

    private static final Duration QUIET = Duration.ofSeconds(2);
    private static final String ALICE = "alice";

    @TempDir
    Path storeDir;

    private final ManualDelayScheduler scheduler = new ManualDelayScheduler();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
    private final RecordingChatTransport transport = new RecordingChatTransport();
    private SessionStore sessionStore;
    private ItemStorageService itemStorageService;
    private ShareRegistry shareRegistry;
    private ShareAuditPublisher shareAuditPublisher;
    private MembershipGate membershipGate;
    private UploadComponent uploadComponent;
    private long sequence;

    @BeforeEach
    void setUp() {
        ShareRelayProperties properties = new ShareRelayProperties();
        properties.setStoreDir(storeDir.toString());
        properties.setGroupDebounce(QUIET);
        properties.setSessionIdleTtl(Duration.ofHours(2));
        properties.setLinkBase("https://share.example.com/s/");

        itemStorageService = new ItemStorageService(properties);
        RelayPipeline relayPipeline = new RelayPipeline(itemStorageService);
        sessionStore = new SessionStore(clock);
        KeyedSerialExecutor lanes = new KeyedSerialExecutor(Runnable::run);
        UserNotifier notifier = new UserNotifier(transport);
        DebouncedAggregator aggregator = new DebouncedAggregator(relayPipeline, sessionStore, lanes, scheduler, notifier, properties);

        membershipGate = mock(MembershipGate.class);
        when(membershipGate.isAuthorized(anyString())).thenReturn(true);
        shareRegistry = mock(ShareRegistry.class);
        when(shareRegistry.create(anyString(), anyList(), anyString(), any(ShareKind.class))).thenReturn("Tok3n_abc-1");
        shareAuditPublisher = mock(ShareAuditPublisher.class);

        uploadComponent = new UploadComponent(sessionStore, aggregator, relayPipeline, shareRegistry, shareAuditPublisher,
                new ShareLinkFormatter(properties), new GateGuard(membershipGate, notifier, new GateProperties()),
                notifier, lanes, properties);
    }

    private InboundItem item(String name, String groupId) {
        return InboundItem.builder()
                .principalId(ALICE)
                .messageId("msg-" + name)
                .groupId(groupId)
                .fileName(name)
                .mediaType("image/jpeg")
                .content(name.getBytes(StandardCharsets.UTF_8))
                .sequence(++sequence)
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<ItemRef> publishedRefs() {
        ArgumentCaptor<List<ItemRef>> refs = ArgumentCaptor.forClass(List.class);
        verify(shareRegistry).create(eq(ALICE), refs.capture(), anyString(), any(ShareKind.class));
        return refs.getValue();
    }

    private List<String> fileNames(List<ItemRef> refs) {
        return refs.stream().map(ref -> {
            try {
                return itemStorageService.load(ref).getFileName();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }).collect(Collectors.toList());
    }

    @Test
    @DisplayName("A burst of grouped items becomes one collection share in arrival order")
    void groupedBurstBecomesOneShare() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("a.jpg", "album"));
        scheduler.advance(Duration.ofMillis(500));
        uploadComponent.onItem(item("b.jpg", "album"));
        scheduler.advance(Duration.ofMillis(500));
        uploadComponent.onItem(item("c.jpg", "album"));
        scheduler.advance(QUIET);

        Optional<String> token = uploadComponent.finishUpload(ALICE);

        assertThat(token).contains("Tok3n_abc-1");
        assertThat(fileNames(publishedRefs())).containsExactly("a.jpg", "b.jpg", "c.jpg");
        verify(shareRegistry).create(eq(ALICE), anyList(), eq("Batch upload (3 files)"), eq(ShareKind.COLLECTION));
        assertThat(transport.noticeTexts()).contains("✅ Saved 3 file(s). Files in this upload: 3",
                "✅ Saved 3 file(s).\n🔗 Share link: https://share.example.com/s/Tok3n_abc-1");
        verify(shareAuditPublisher).publishCreated("Tok3n_abc-1", ALICE, 3, "Batch upload (3 files)",
                "https://share.example.com/s/Tok3n_abc-1");
        assertThat(sessionStore.isCollecting(ALICE)).isFalse();
    }

    @Test
    @DisplayName("Finish right after a group keeps singles and the buffered group in arrival order")
    void finishFlushesBufferedGroup() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("single.pdf", null));
        uploadComponent.onItem(item("g1.jpg", "g"));
        uploadComponent.onItem(item("g2.jpg", "g"));

        uploadComponent.finishUpload(ALICE);

        assertThat(fileNames(publishedRefs())).containsExactly("single.pdf", "g1.jpg", "g2.jpg");
        assertThat(scheduler.pending()).isZero();
    }

    @Test
    void singleItemIsPublishedAsFile() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("only.pdf", null));

        uploadComponent.finishUpload(ALICE);

        verify(shareRegistry).create(eq(ALICE), anyList(), eq("Batch upload (1 files)"), eq(ShareKind.FILE));
    }

    @Test
    void finishWithoutItemsPublishesNothing() {
        uploadComponent.beginUpload(ALICE);

        assertThat(uploadComponent.finishUpload(ALICE)).isEmpty();

        verify(shareRegistry, never()).create(anyString(), anyList(), anyString(), any(ShareKind.class));
        assertThat(transport.noticeTexts()).last().isEqualTo("You did not upload any files.");
    }

    @Test
    void failedSaveKeepsTheUpload() {
        when(shareRegistry.create(anyString(), anyList(), anyString(), any(ShareKind.class)))
                .thenThrow(new PersistenceException("db down"))
                .thenReturn("Tok3n_abc-2");
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("a.jpg", null));
        uploadComponent.onItem(item("b.jpg", null));

        assertThat(uploadComponent.finishUpload(ALICE)).isEmpty();
        assertThat(sessionStore.count(ALICE)).isEqualTo(2);

        assertThat(uploadComponent.finishUpload(ALICE)).contains("Tok3n_abc-2");
        verify(shareAuditPublisher).publishCreated(eq("Tok3n_abc-2"), eq(ALICE), eq(2), anyString(), anyString());
    }

    @Test
    void itemWhileIdleIsRejected() {
        uploadComponent.onItem(item("stray.jpg", null));

        assertThat(transport.noticeTexts()).singleElement().asString().contains("first, then send your files");
        assertThat(storeDir.toFile().list()).isEmpty();
    }

    @Test
    void cancelDropsBufferedGroupButPublishesRelayedItems() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("kept.jpg", null));
        uploadComponent.onItem(item("lost.jpg", "g"));

        Optional<String> token = uploadComponent.cancel(ALICE);

        assertThat(token).isPresent();
        assertThat(fileNames(publishedRefs())).containsExactly("kept.jpg");
        assertThat(transport.noticeTexts()).contains("⚠️ 1 file(s) still being received were dropped.");
    }

    @Test
    void cancelWhileIdleSaysSo() {
        assertThat(uploadComponent.cancel(ALICE)).isEmpty();
        assertThat(transport.noticeTexts()).containsExactly("Nothing to cancel.");
    }

    @Test
    void beginAgainDiscardsUnfinishedUpload() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("old.jpg", null));
        assertThat(storeDir.toFile().list()).hasSize(1);

        uploadComponent.beginUpload(ALICE);

        assertThat(sessionStore.count(ALICE)).isZero();
        assertThat(storeDir.toFile().list()).isEmpty();
    }

    @Test
    void deniedPrincipalCannotBeginUpload() {
        when(membershipGate.isAuthorized(ALICE)).thenReturn(false);

        uploadComponent.beginUpload(ALICE);

        assertThat(sessionStore.isCollecting(ALICE)).isFalse();
        RecordingChatTransport.Sent notice = transport.notices.get(0);
        assertThat(notice.text).contains("Access restricted");
        assertThat(notice.keyboard.get(0).get(0).getAction()).isEqualTo("cmd:begin-upload");
    }

    @Test
    void idleSessionsAreClosedAndTheirItemsRemoved() {
        uploadComponent.beginUpload(ALICE);
        uploadComponent.onItem(item("forgotten.jpg", null));
        clock.advance(Duration.ofHours(3));

        int closed = uploadComponent.abandonIdleSessions();

        assertThat(closed).isEqualTo(1);
        assertThat(sessionStore.isCollecting(ALICE)).isFalse();
        assertThat(storeDir.toFile().list()).isEmpty();
        assertThat(transport.noticeTexts()).last().asString().contains("without activity");
    }
}
