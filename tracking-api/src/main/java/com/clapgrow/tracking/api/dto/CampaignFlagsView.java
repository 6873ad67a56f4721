package com.clapgrow.tracking.api.dto;

import java.io.Serializable;

/**
 * Cached tracking flags of a campaign. A campaign without a settings row tracks both
 * opens and clicks.
 */
public record CampaignFlagsView(
    String campaignId,
    boolean openTrackingEnabled,
    boolean clickTrackingEnabled
) implements Serializable {

    public static CampaignFlagsView defaults(String campaignId) {
        return new CampaignFlagsView(campaignId, true, true);
    }
}
