package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgreementChecksOutput(
    List<AgreementViolation> agreementViolations,
    List<DetectedAgreement> detectedAgreements
) implements StageOutput {
}
