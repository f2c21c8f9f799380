package com.casekeep.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(List<Choice> choices) {

    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty() || choices.get(0) == null || choices.get(0).message() == null) {
            return Optional.empty();
        }
        String content = choices.get(0).message().content();
        return content == null || content.isBlank() ? Optional.empty() : Optional.of(content);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {
    }
}
