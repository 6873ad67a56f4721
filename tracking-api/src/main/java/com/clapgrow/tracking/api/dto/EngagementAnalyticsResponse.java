package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngagementAnalyticsResponse {
    private String campaignId;
    private int daysBack;
    private Map<String, Long> byEventType;
    private Map<String, Long> byDeviceType;
    private List<DailyCounts> byDay;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyCounts {
        private String day;
        private Map<String, Long> counts;
    }
}
