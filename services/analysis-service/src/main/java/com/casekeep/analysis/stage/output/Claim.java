package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Claim(
    String claimText,
    String speakerPersonId,
    String category,
    String evidence,
    String verificationStatus,
    String notes
) {
}
