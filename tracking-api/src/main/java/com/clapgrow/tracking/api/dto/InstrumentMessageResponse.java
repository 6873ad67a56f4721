package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentMessageResponse {
    private String messageId;
    private String recipientHash;
    private String html;
}
