package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Campaign engagement totals. Rates are unique counts over messages sent; the human
 * variants only count events classified as human.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignSummaryResponse {
    private String campaignId;
    private long messagesSent;
    private long opens;
    private long uniqueOpens;
    private long clicks;
    private long uniqueClicks;
    private double openRate;
    private double clickRate;
    private long humanOpens;
    private long uniqueHumanOpens;
    private long humanClicks;
    private long uniqueHumanClicks;
    private double humanOpenRate;
    private double humanClickRate;
    private LocalDateTime refreshedAt;
    private boolean fresh;
}
