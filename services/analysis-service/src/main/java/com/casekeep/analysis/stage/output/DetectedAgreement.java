package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectedAgreement(
    String topic,
    String summary,
    String fullText,
    List<String> messageIds,
    @JsonProperty("isTemporary") Boolean temporary,
    String conditionText,
    List<String> potentialOverrideTopics,
    String confidence,
    String reasoning
) {
}
