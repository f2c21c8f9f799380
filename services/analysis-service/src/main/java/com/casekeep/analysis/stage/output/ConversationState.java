package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationState(
    String status,
    String pendingResponderName,
    String reasoning,
    String pendingActionSummary
) {

    public static ConversationState undetermined() {
        return new ConversationState("open", null, "", null);
    }
}
