package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.GateProperties;
import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.entity.ShareRecord;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.service.GateGuard;
import com.odin.share_relay_service.service.MembershipGate;
import com.odin.share_relay_service.service.RecordingChatTransport;
import com.odin.share_relay_service.service.ShareRegistry;
import com.odin.share_relay_service.service.UserNotifier;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShareManagementComponentTest {

    private ShareRegistry shareRegistry;
    private MembershipGate membershipGate;
    private ShareManagementComponent component;

    @BeforeEach
    void setUp() {
        shareRegistry = mock(ShareRegistry.class);
        membershipGate = mock(MembershipGate.class);
        when(membershipGate.isAuthorized(anyString())).thenReturn(true);
        ShareRelayProperties properties = new ShareRelayProperties();
        properties.setPageSize(2);
        properties.setLinkBase("https://share.example.com/s/");
        component = new ShareManagementComponent(shareRegistry,
                new GateGuard(membershipGate, new UserNotifier(new RecordingChatTransport()), new GateProperties()),
                new ShareLinkFormatter(properties), properties);
    }

    private static ShareRecord record(String token, String owner) {
        return ShareRecord.builder()
                .shareToken(token)
                .itemRefs(List.of(ItemRef.of("k1"), ItemRef.of("k2")))
                .ownerPrincipalId(owner)
                .caption("c-" + token)
                .kind(ShareKind.COLLECTION)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void listsRequestedPageWithLinks() {
        when(shareRegistry.countByOwner("alice")).thenReturn(5L);
        when(shareRegistry.listByOwner("alice", 2, 2)).thenReturn(List.of(record("t3", "alice"), record("t4", "alice")));

        ShareSummaryPage page = component.listShares("alice", 2);

        assertThat(page.getPage()).isEqualTo(2);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getTotalShares()).isEqualTo(5);
        assertThat(page.getShares()).extracting("link")
                .containsExactly("https://share.example.com/s/t3", "https://share.example.com/s/t4");
        assertThat(page.getShares().get(0).getItemCount()).isEqualTo(2);
    }

    @Test
    void emptyListDoesNotQueryRows() {
        when(shareRegistry.countByOwner("alice")).thenReturn(0L);

        ShareSummaryPage page = component.listShares("alice", 4);

        assertThat(page.getPage()).isEqualTo(1);
        assertThat(page.getShares()).isEmpty();
        verify(shareRegistry, never()).listByOwner(anyString(), anyInt(), anyInt());
    }

    @Test
    void listingRequiresMembership() {
        when(membershipGate.isAuthorized("alice")).thenReturn(false);

        assertThatThrownBy(() -> component.listShares("alice", 1)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void linkIsOnlyGivenToOwner() {
        when(shareRegistry.lookup("t1")).thenReturn(record("t1", "alice"));

        assertThat(component.getLink("t1", "alice")).isEqualTo("https://share.example.com/s/t1");
        assertThatThrownBy(() -> component.getLink("t1", "bob")).isInstanceOf(ForbiddenException.class);
    }
}
