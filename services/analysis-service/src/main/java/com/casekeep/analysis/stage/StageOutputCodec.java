package com.casekeep.analysis.stage;

import com.casekeep.analysis.stage.output.StageOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class StageOutputCodec {

    private final ObjectMapper objectMapper;

    public StageOutputCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StageOutput parse(StageDefinition stage, String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new StageParseException("Response for " + stage.id() + " is not valid JSON", ex);
        }
        return decode(stage, node);
    }

    public StageOutput decode(StageDefinition stage, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new StageParseException("Response for " + stage.id() + " is not a JSON object");
        }
        List<String> missing = stage.requiredFields().stream()
            .filter(field -> !node.hasNonNull(field))
            .toList();
        if (!missing.isEmpty()) {
            throw new StageParseException("Response for " + stage.id() + " is missing " + String.join(", ", missing));
        }
        try {
            return objectMapper.treeToValue(node, stage.outputType());
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new StageParseException("Response for " + stage.id() + " does not match its expected shape", ex);
        }
    }

    public String toJson(StageOutput output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize " + output.getClass().getSimpleName(), ex);
        }
    }
}
