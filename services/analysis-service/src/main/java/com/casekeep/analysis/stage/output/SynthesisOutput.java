package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SynthesisOutput(
    ConversationState conversationState,
    List<AlternativeInterpretation> alternativeInterpretations,
    List<MissingContext> missingContext,
    List<String> topicCategorySlugs
) implements StageOutput {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AlternativeInterpretation(String findingDescription, String alternativeExplanation) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MissingContext(String description, String howItCouldChangeConclusions) {
    }
}
