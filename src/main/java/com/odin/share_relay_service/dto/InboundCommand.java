package com.odin.share_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One JSON frame sent by a client over the WebSocket.
 *
 * Which fields are set depends on {@code type}:
 * command (name, args), item (messageId, groupId, fileName, mediaType, content),
 * callback (data, messageId), text (text), ping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundCommand {

    private String type;
    private String name;
    private String args;
    private String messageId;
    private String groupId;
    private String fileName;
    private String mediaType;
    private String content; // base64
    private String data;
    private String text;
}
