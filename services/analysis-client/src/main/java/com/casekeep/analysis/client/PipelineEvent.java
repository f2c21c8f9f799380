package com.casekeep.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PipelineEvent.StageStarted.class, name = "stage_start"),
    @JsonSubTypes.Type(value = PipelineEvent.StageCompleted.class, name = "stage_complete"),
    @JsonSubTypes.Type(value = PipelineEvent.StageFailed.class, name = "stage_error"),
    @JsonSubTypes.Type(value = PipelineEvent.PipelineCompleted.class, name = "complete"),
    @JsonSubTypes.Type(value = PipelineEvent.PipelineFailed.class, name = "error")
})
public interface PipelineEvent {

    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StageStarted(String stage, String stageName, int stageNumber, int totalStages) implements PipelineEvent {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StageCompleted(String stage, long durationMs) implements PipelineEvent {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StageFailed(String stage, String message, List<String> completedStages) implements PipelineEvent {

        public StageFailed {
            completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        }

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PipelineCompleted(JsonNode result) implements PipelineEvent {

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PipelineFailed(String message) implements PipelineEvent {

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }
}
