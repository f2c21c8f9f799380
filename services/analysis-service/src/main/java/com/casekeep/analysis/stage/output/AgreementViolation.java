package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgreementViolation(
    String agreementItemId,
    String violationType,
    String description,
    List<String> messageIds,
    String severity
) {
}
