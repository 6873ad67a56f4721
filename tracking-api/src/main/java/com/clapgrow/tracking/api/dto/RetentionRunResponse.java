package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetentionRunResponse {
    private int batches;
    private int anonymized;
    private int archived;
    private int deleted;
    private boolean cancelled;
    private boolean failed;
}
