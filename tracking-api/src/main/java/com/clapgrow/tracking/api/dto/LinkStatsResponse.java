package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkStatsResponse {
    private String url;
    private long clicks;
    private long uniqueClicks;
    private long humanClicks;
}
