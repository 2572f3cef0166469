package com.odin.share_relay_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareSummaryPage {

    private int page;
    private int totalPages;
    private long totalShares;
    private List<ShareSummary> shares;
}
