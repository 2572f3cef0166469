package com.odin.share_relay_service.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.share_relay_service.component.ChatCommandComponent;
import com.odin.share_relay_service.component.UploadComponent;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.InboundCommand;
import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.service.DeliveryEngine;
import com.odin.share_relay_service.service.SessionRegistryService;
import com.odin.share_relay_service.service.SessionStore;
import com.odin.share_relay_service.service.UserNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;

import java.util.Base64;

/**
 * Entry point of every client frame. Frames are parsed here and handed to the principal's
 * lane; only pings are answered inline. Item arrival order is fixed here, before dispatch.
 *
 * A failing frame is logged and never closes the connection.
 */
@Slf4j
@Component
public class RelayWebSocketHandler implements WebSocketHandler {

    private final SessionRegistryService sessionRegistryService;
    private final SessionStore sessionStore;
    private final KeyedSerialExecutor principalLanes;
    private final UploadComponent uploadComponent;
    private final ChatCommandComponent chatCommandComponent;
    private final DeliveryEngine deliveryEngine;
    private final UserNotifier userNotifier;
    private final ObjectMapper objectMapper;

    public RelayWebSocketHandler(SessionRegistryService sessionRegistryService,
                                 SessionStore sessionStore,
                                 KeyedSerialExecutor principalLanes,
                                 UploadComponent uploadComponent,
                                 ChatCommandComponent chatCommandComponent,
                                 DeliveryEngine deliveryEngine,
                                 UserNotifier userNotifier,
                                 ObjectMapper objectMapper) {
        this.sessionRegistryService = sessionRegistryService;
        this.sessionStore = sessionStore;
        this.principalLanes = principalLanes;
        this.uploadComponent = uploadComponent;
        this.chatCommandComponent = chatCommandComponent;
        this.deliveryEngine = deliveryEngine;
        this.userNotifier = userNotifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String principalId = principalOf(session);
        if (principalId == null) {
            log.warn("[WS] Session {} has no principal. Closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        sessionRegistryService.registerSession(principalId, session);
        log.info("[WS] Principal {} connected with session {}", principalId, session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
        String principalId = principalOf(session);
        CorrelationIdUtil.begin(principalId);
        try {
            if (!(message instanceof TextMessage)) {
                log.warn("[WS] Ignoring non-text frame {} from principal={}", message.getClass().getSimpleName(), principalId);
                return;
            }
            InboundCommand frame = objectMapper.readValue(((TextMessage) message).getPayload(), InboundCommand.class);
            dispatch(session, principalId, frame);

        } catch (JsonProcessingException e) {
            log.warn("[WS] Unreadable frame from principal={}: {}", principalId, e.getOriginalMessage());
        } catch (Exception e) {
            log.error("[WS] Frame handling failed principal={} session={}", principalId, session.getId(), e);
            // connection stays open
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    private void dispatch(WebSocketSession session, String principalId, InboundCommand frame) throws Exception {
        String type = frame.getType() == null ? "" : frame.getType();
        switch (type) {
            case ApplicationConstants.FRAME_PING:
                session.sendMessage(new TextMessage("{\"type\":\"" + ApplicationConstants.OUT_PONG + "\"}"));
                break;
            case ApplicationConstants.FRAME_ITEM:
                InboundItem item = toItem(principalId, frame);
                if (item != null) {
                    principalLanes.submit(principalId, () -> uploadComponent.onItem(item));
                }
                break;
            case ApplicationConstants.FRAME_COMMAND:
                principalLanes.submit(principalId,
                        () -> chatCommandComponent.onCommand(principalId, frame.getName(), frame.getArgs()));
                break;
            case ApplicationConstants.FRAME_CALLBACK:
                principalLanes.submit(principalId,
                        () -> chatCommandComponent.onCallback(principalId, frame.getData(), frame.getMessageId()));
                break;
            case ApplicationConstants.FRAME_TEXT:
                principalLanes.submit(principalId, () -> chatCommandComponent.onText(principalId, frame.getText()));
                break;
            default:
                log.warn("[WS] Unknown frame type '{}' from principal={}", frame.getType(), principalId);
        }
    }

    private InboundItem toItem(String principalId, InboundCommand frame) {
        byte[] content;
        try {
            content = frame.getContent() == null ? new byte[0] : Base64.getDecoder().decode(frame.getContent());
        } catch (IllegalArgumentException e) {
            log.warn("[WS] Item message={} from principal={} is not valid base64", frame.getMessageId(), principalId);
            principalLanes.submit(principalId,
                    () -> userNotifier.notice(principalId, "⚠️ Could not read file " + frame.getFileName() + ". Please send it again."));
            return null;
        }
        long sequence = sessionStore.nextSequence(principalId);
        log.debug("[WS] Item message={} group={} seq={} from principal={}",
                frame.getMessageId(), frame.getGroupId(), sequence, principalId);
        return InboundItem.builder()
                .principalId(principalId)
                .messageId(frame.getMessageId())
                .groupId(frame.getGroupId())
                .fileName(frame.getFileName())
                .mediaType(frame.getMediaType())
                .content(content)
                .sequence(sequence)
                .build();
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("[WS] Transport error for session {} (principal={}): {}",
                session.getId(), principalOf(session), exception.getMessage(), exception);
        session.close(CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        String principalId = sessionRegistryService.removeSession(session);
        if (principalId != null) {
            deliveryEngine.forget(principalId);
            log.info("[WS] Principal {} disconnected (session={}, status={})", principalId, session.getId(), closeStatus);
        } else {
            log.debug("[WS] Closed session {} was not the live one (status={})", session.getId(), closeStatus);
        }
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private String principalOf(WebSocketSession session) {
        Object principal = session.getAttributes().get(ApplicationConstants.PRINCIPAL_ATTRIBUTE);
        return principal == null ? null : principal.toString();
    }
}
