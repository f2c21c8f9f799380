package com.casekeep.analysis.stage;

import com.casekeep.analysis.stage.output.StageOutput;
import java.util.List;
import java.util.Set;

public record StageDefinition(
    String id,
    String displayName,
    int ordinal,
    Class<? extends StageOutput> outputType,
    List<String> requiredFields,
    Set<String> dependsOn,
    StageRequestBuilder requestBuilder
) {

    public StageDefinition {
        requiredFields = List.copyOf(requiredFields);
        dependsOn = Set.copyOf(dependsOn);
    }

    public static StageDefinition of(
        String id,
        String displayName,
        Class<? extends StageOutput> outputType,
        List<String> requiredFields,
        Set<String> dependsOn,
        StageRequestBuilder requestBuilder
    ) {
        return new StageDefinition(id, displayName, -1, outputType, requiredFields, dependsOn, requestBuilder);
    }

    StageDefinition withOrdinal(int position) {
        return new StageDefinition(id, displayName, position, outputType, requiredFields, dependsOn, requestBuilder);
    }

    public int stageNumber() {
        return ordinal + 1;
    }
}
