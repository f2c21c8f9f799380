package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonAnalysis(
    String personId,
    BehavioralAssessment behavioralAssessment,
    NotablePatterns notablePatterns,
    List<String> interactionRecommendations,
    List<Concern> concerns
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BehavioralAssessment(
        String summary,
        String cooperationLevel,
        String flexibilityLevel,
        String responsivenessLevel,
        String accountabilityLevel,
        String boundaryRespect
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotablePatterns(List<String> positive, List<String> concerning) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Concern(String type, String description, List<String> evidence, String severity) {
    }
}
