package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.StoredItem;
import com.odin.share_relay_service.exception.TransportException;

import java.util.List;

/**
 * Outbound side of the messaging channel. Every call is a remote call that may fail with
 * {@link TransportException}, including when the principal has no open connection.
 * Send methods return the id of the rendered message for later replace or retract.
 */
public interface ChatTransport {

    String sendNotice(String principalId, String text, List<List<NavigationButton>> keyboard);

    String sendItem(String principalId, StoredItem item);

    String sendPanel(String principalId, String text, List<List<NavigationButton>> keyboard);

    void replaceMessage(String principalId, String messageId, String text, List<List<NavigationButton>> keyboard);

    void retractMessages(String principalId, List<String> messageIds);
}
