package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptOutResponse {
    private String recipientHash;
    private Set<EngagementEventType> suppressedEventTypes;
    private LocalDateTime optedOutAt;
}
