package com.casekeep.analysis.stage;

public record StagePrompt(String systemPrompt, String userPrompt) {
}
