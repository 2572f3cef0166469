package com.odin.share_relay_service.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.OutboundMessage;
import com.odin.share_relay_service.dto.StoredItem;
import com.odin.share_relay_service.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * {@link ChatTransport} over the principal's WebSocket connection. Frames are JSON
 * {@link OutboundMessage}s; message ids are generated here.
 */
@Slf4j
@Service
public class WebSocketChatTransport implements ChatTransport {

    private final SessionRegistryService sessionRegistryService;
    private final ObjectMapper objectMapper;

    public WebSocketChatTransport(SessionRegistryService sessionRegistryService, ObjectMapper objectMapper) {
        this.sessionRegistryService = sessionRegistryService;
        this.objectMapper = objectMapper;
    }

    @Override
    public String sendNotice(String principalId, String text, List<List<NavigationButton>> keyboard) {
        return send(principalId, OutboundMessage.builder()
                .type(ApplicationConstants.OUT_NOTICE)
                .messageId(newMessageId())
                .text(text)
                .keyboard(emptyToNull(keyboard))
                .build());
    }

    @Override
    public String sendItem(String principalId, StoredItem item) {
        return send(principalId, OutboundMessage.builder()
                .type(ApplicationConstants.OUT_ITEM)
                .messageId(newMessageId())
                .fileName(item.getFileName())
                .mediaType(item.getMediaType())
                .content(Base64.getEncoder().encodeToString(item.getContent()))
                .build());
    }

    @Override
    public String sendPanel(String principalId, String text, List<List<NavigationButton>> keyboard) {
        return send(principalId, OutboundMessage.builder()
                .type(ApplicationConstants.OUT_PANEL)
                .messageId(newMessageId())
                .text(text)
                .keyboard(emptyToNull(keyboard))
                .build());
    }

    @Override
    public void replaceMessage(String principalId, String messageId, String text, List<List<NavigationButton>> keyboard) {
        send(principalId, OutboundMessage.builder()
                .type(ApplicationConstants.OUT_REPLACE)
                .targetMessageId(messageId)
                .text(text)
                .keyboard(emptyToNull(keyboard))
                .build());
    }

    @Override
    public void retractMessages(String principalId, List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return;
        }
        send(principalId, OutboundMessage.builder()
                .type(ApplicationConstants.OUT_RETRACT)
                .retractIds(messageIds)
                .build());
    }

    private String send(String principalId, OutboundMessage message) {
        WebSocketSession session = sessionRegistryService.getSession(principalId);
        if (session == null || !session.isOpen()) {
            throw new TransportException("No open connection for principal " + principalId);
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            log.debug("[TRANSPORT] Sent {} id={} to principal={}", message.getType(), message.getMessageId(), principalId);
            return message.getMessageId();
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not serialize " + message.getType() + " frame", e);
        } catch (IOException | RuntimeException e) {
            throw new TransportException("Could not send " + message.getType() + " frame to principal " + principalId, e);
        }
    }

    private static List<List<NavigationButton>> emptyToNull(List<List<NavigationButton>> keyboard) {
        return keyboard == null || keyboard.isEmpty() ? null : keyboard;
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }
}
