package com.odin.share_relay_service.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.StoredItem;
import com.odin.share_relay_service.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketChatTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SessionRegistryService registry = new SessionRegistryService();
    private final WebSocketChatTransport transport = new WebSocketChatTransport(registry, objectMapper);
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        registry.registerSession("bob", session);
    }

    private JsonNode lastFrame() throws Exception {
        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(frame.capture());
        return objectMapper.readTree(frame.getValue().getPayload());
    }

    @Test
    void noticeCarriesTextKeyboardAndFreshId() throws Exception {
        String id = transport.sendNotice("bob", "hi", List.of(List.of(NavigationButton.of("Go", "cmd:start"))));

        JsonNode frame = lastFrame();
        assertThat(frame.get("type").asText()).isEqualTo("notice");
        assertThat(frame.get("messageId").asText()).isEqualTo(id);
        assertThat(frame.get("text").asText()).isEqualTo("hi");
        assertThat(frame.get("keyboard").get(0).get(0).get("action").asText()).isEqualTo("cmd:start");
    }

    @Test
    void itemContentIsBase64() throws Exception {
        transport.sendItem("bob", StoredItem.builder().ref(ItemRef.of("k")).fileName("a.txt")
                .mediaType("text/plain").content("abc".getBytes()).build());

        JsonNode frame = lastFrame();
        assertThat(frame.get("type").asText()).isEqualTo("item");
        assertThat(frame.get("content").asText()).isEqualTo("YWJj");
        assertThat(frame.has("keyboard")).isFalse();
    }

    @Test
    void retractListsMessageIds() throws Exception {
        transport.retractMessages("bob", List.of("m1", "m2"));

        JsonNode frame = lastFrame();
        assertThat(frame.get("type").asText()).isEqualTo("retract");
        assertThat(frame.get("retractIds")).hasSize(2);
    }

    @Test
    void offlinePrincipalFails() {
        assertThatThrownBy(() -> transport.sendNotice("carol", "hi", List.of()))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void sendFailureIsTransportException() throws Exception {
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        assertThatThrownBy(() -> transport.sendPanel("bob", "p", List.of()))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
