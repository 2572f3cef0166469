package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Best-effort user notices. A notice that cannot be delivered is logged and dropped.
 */
@Slf4j
@Service
public class UserNotifier {

    private final ChatTransport chatTransport;

    public UserNotifier(ChatTransport chatTransport) {
        this.chatTransport = chatTransport;
    }

    public Optional<String> notice(String principalId, String text) {
        return notice(principalId, text, Collections.emptyList());
    }

    public Optional<String> notice(String principalId, String text, List<List<NavigationButton>> keyboard) {
        try {
            return Optional.ofNullable(chatTransport.sendNotice(principalId, text, keyboard));
        } catch (TransportException e) {
            log.warn("[NOTIFY] Notice not delivered principal={}: {}", principalId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Edit an earlier message in place, or send a new one when there is nothing to edit
     * or the edit fails.
     */
    public Optional<String> replaceOrSend(String principalId, String messageId, String text,
                                          List<List<NavigationButton>> keyboard) {
        if (messageId != null) {
            try {
                chatTransport.replaceMessage(principalId, messageId, text, keyboard);
                return Optional.of(messageId);
            } catch (TransportException e) {
                log.warn("[NOTIFY] Edit of message={} failed principal={}, sending anew: {}",
                        messageId, principalId, e.getMessage());
            }
        }
        return notice(principalId, text, keyboard);
    }
}
