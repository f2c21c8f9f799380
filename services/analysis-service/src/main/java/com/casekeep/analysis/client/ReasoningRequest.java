package com.casekeep.analysis.client;

public record ReasoningRequest(
    String stageId,
    String systemPrompt,
    String userPrompt
) {
}
