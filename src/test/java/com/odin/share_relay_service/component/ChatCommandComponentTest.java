package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.ShareSummary;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.service.DeliveryEngine;
import com.odin.share_relay_service.service.IShareManagementService;
import com.odin.share_relay_service.service.PendingRetrievalService;
import com.odin.share_relay_service.service.RecordingChatTransport;
import com.odin.share_relay_service.service.SessionStore;
import com.odin.share_relay_service.service.UserNotifier;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatCommandComponentTest {

    private static final String BOB = "bob";

    private final RecordingChatTransport transport = new RecordingChatTransport();
    private UploadComponent uploadComponent;
    private DeliveryEngine deliveryEngine;
    private IShareManagementService shareManagementService;
    private PendingRetrievalService pendingRetrievalService;
    private SessionStore sessionStore;
    private ChatCommandComponent component;

    @BeforeEach
    void setUp() {
        uploadComponent = mock(UploadComponent.class);
        deliveryEngine = mock(DeliveryEngine.class);
        shareManagementService = mock(IShareManagementService.class);
        pendingRetrievalService = mock(PendingRetrievalService.class);
        when(pendingRetrievalService.pendingToken(anyString())).thenReturn(Optional.empty());
        sessionStore = new SessionStore(Clock.systemUTC());

        ShareRelayProperties properties = new ShareRelayProperties();
        properties.setLinkBase("https://share.example.com/s/");
        properties.setListCaptionLength(10);
        component = new ChatCommandComponent(uploadComponent, deliveryEngine, shareManagementService,
                pendingRetrievalService, sessionStore, new UserNotifier(transport), new ShareLinkFormatter(properties), properties);
    }

    @Test
    void startWithTokenRetrievesFirstPage() {
        component.onCommand(BOB, "start", "AbCdEfGh123");

        verify(deliveryEngine).retrieve(BOB, "AbCdEfGh123", 1);
    }

    @Test
    void startAcceptsAFullLink() {
        component.onCommand(BOB, "START", "https://share.example.com/s/AbCdEfGh123");

        verify(deliveryEngine).retrieve(BOB, "AbCdEfGh123", 1);
    }

    @Test
    void startWithoutTokenResumesPendingRetrieval() {
        when(pendingRetrievalService.pendingToken(BOB)).thenReturn(Optional.of("Pending1234"));

        component.onCommand(BOB, "start", null);

        verify(deliveryEngine).retrieve(BOB, "Pending1234", 1);
    }

    @Test
    void startWithNothingPendingWelcomes() {
        component.onCommand(BOB, "start", "");

        verifyNoInteractions(deliveryEngine);
        assertThat(transport.noticeTexts()).singleElement().asString().startsWith("👋 Welcome!");
    }

    @Test
    void uploadCommandsReachTheUploadFlow() {
        component.onCommand(BOB, "begin-upload", null);
        component.onCommand(BOB, "finish-upload", null);
        component.onCommand(BOB, "cancel", null);

        verify(uploadComponent).beginUpload(BOB);
        verify(uploadComponent).finishUpload(BOB);
        verify(uploadComponent).cancel(BOB);
    }

    @Test
    void unknownCommandIsAnswered() {
        component.onCommand(BOB, "dance", null);

        assertThat(transport.noticeTexts()).singleElement().asString().startsWith("Unknown command");
    }

    @Test
    void sharePageCallbackRetrievesRequestedPage() {
        component.onCallback(BOB, "spage:3:AbCdEfGh123", "m9");

        verify(deliveryEngine).retrieve(BOB, "AbCdEfGh123", 3);
    }

    @Test
    void commandCallbackRunsTheCommand() {
        component.onCallback(BOB, "cmd:begin-upload", "m9");

        verify(uploadComponent).beginUpload(BOB);
    }

    @Test
    void malformedCallbacksAreIgnored() {
        component.onCallback(BOB, "spage:x:AbCdEfGh123", "m1");
        component.onCallback(BOB, "spage", "m1");
        component.onCallback(BOB, "noop", "m1");
        component.onCallback(BOB, "", "m1");

        verify(deliveryEngine, never()).retrieve(anyString(), anyString(), anyInt());
        assertThat(transport.notices).isEmpty();
    }

    @Test
    void pastedLinkRetrievesShare() {
        component.onText(BOB, "look at this https://share.example.com/s/Tok_en-42 !");

        verify(deliveryEngine).retrieve(BOB, "Tok_en-42", 1);
    }

    @Test
    void plainTextWhileCollectingPointsAtFinish() {
        sessionStore.begin(BOB);

        component.onText(BOB, "hello");

        RecordingChatTransport.Sent notice = transport.notices.get(0);
        assertThat(notice.text).startsWith("⏳ Waiting for your files");
        assertThat(notice.keyboard.get(0).get(0).getAction()).isEqualTo("cmd:finish-upload");
    }

    @Test
    void listShowsInfoAndDeleteRowsPlusPager() {
        when(shareManagementService.listShares(BOB, 1)).thenReturn(ShareSummaryPage.builder()
                .page(1).totalPages(2).totalShares(12)
                .shares(List.of(summary("tokA", "A very long holiday caption"), summary("tokB", "Short")))
                .build());

        component.onCommand(BOB, "list-my-shares", null);

        RecordingChatTransport.Sent list = transport.notices.get(0);
        assertThat(list.text).isEqualTo("📂 Your shares (12) · page 1 of 2");
        List<NavigationButton> first = list.keyboard.get(0);
        assertThat(first.get(0).getLabel()).isEqualTo("📄 A very lon...");
        assertThat(first.get(0).getAction()).isEqualTo("info:tokA");
        assertThat(first.get(1).getAction()).isEqualTo("delete:tokA:1");
        assertThat(list.keyboard.get(2).get(1).getAction()).isEqualTo("page:2");
    }

    @Test
    void listPageCallbackEditsTheListInPlace() {
        when(shareManagementService.listShares(BOB, 2)).thenReturn(ShareSummaryPage.builder()
                .page(2).totalPages(2).totalShares(12).shares(List.of(summary("tokC", "c"))).build());

        component.onCallback(BOB, "page:2", "m5");

        assertThat(transport.replacements).extracting(sent -> sent.messageId).containsExactly("m5");
        assertThat(transport.notices).isEmpty();
    }

    @Test
    void deleteCallbackDeletesAndRefreshesList() {
        when(shareManagementService.deleteShare("tokA", BOB)).thenReturn(new DeleteOutcome("tokA", 2, List.of()));
        when(shareManagementService.listShares(BOB, 1)).thenReturn(ShareSummaryPage.builder()
                .page(1).totalPages(1).totalShares(0).shares(List.of()).build());

        component.onCallback(BOB, "delete:tokA:1", "m5");

        assertThat(transport.noticeTexts()).containsExactly("🗑️ Share deleted.");
        assertThat(transport.replacements.get(0).text).isEqualTo("You have no shares yet.");
    }

    @Test
    void deletingSomeoneElsesShareIsRefused() {
        when(shareManagementService.deleteShare("tokA", BOB)).thenThrow(new ForbiddenException("not yours"));

        component.onCallback(BOB, "delete:tokA:1", "m5");

        assertThat(transport.noticeTexts()).containsExactly("⛔ You can only delete your own shares.");
        verify(shareManagementService, never()).listShares(anyString(), anyInt());
    }

    private static ShareSummary summary(String token, String caption) {
        return ShareSummary.builder()
                .shareToken(token)
                .caption(caption)
                .kind(ShareKind.COLLECTION)
                .itemCount(2)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .link("https://share.example.com/s/" + token)
                .build();
    }
}
