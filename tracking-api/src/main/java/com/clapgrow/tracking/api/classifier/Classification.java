package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.api.enums.ClientLabel;

/**
 * Classifier verdict.
 *
 * @param rule name of the matching table rule, or the fallback name when none matched
 */
public record Classification(
    ClientLabel label,
    double confidence,
    String rule,
    String deviceType,
    String clientName
) {

    public boolean isAutomated() {
        return label.isAutomated();
    }
}
