package com.odin.share_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Frame pushed to a client. {@code messageId} is assigned by the server so later frames
 * can replace or retract it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundMessage {

    private String type;
    private String messageId;
    private String text;
    private String fileName;
    private String mediaType;
    private String content; // base64
    private List<List<NavigationButton>> keyboard;
    private String targetMessageId;
    private List<String> retractIds;
}
