package com.odin.share_relay_service.dto;

import com.odin.share_relay_service.entity.ShareKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareSummary {

    private String shareToken;
    private String caption;
    private ShareKind kind;
    private int itemCount;
    private Instant createdAt;
    private String link;
}
