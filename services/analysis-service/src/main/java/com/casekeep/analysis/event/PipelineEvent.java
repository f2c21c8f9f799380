package com.casekeep.analysis.event;

import com.casekeep.analysis.result.AnalysisResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PipelineEvent.StageStart.class, name = "stage_start"),
    @JsonSubTypes.Type(value = PipelineEvent.StageComplete.class, name = "stage_complete"),
    @JsonSubTypes.Type(value = PipelineEvent.StageError.class, name = "stage_error"),
    @JsonSubTypes.Type(value = PipelineEvent.Complete.class, name = "complete"),
    @JsonSubTypes.Type(value = PipelineEvent.RunError.class, name = "error")
})
public interface PipelineEvent {

    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }

    record StageStart(String stage, String stageName, int stageNumber, int totalStages) implements PipelineEvent {
    }

    record StageComplete(String stage, long durationMs) implements PipelineEvent {
    }

    record StageError(String stage, String message, List<String> completedStages) implements PipelineEvent {

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }

    record Complete(AnalysisResult result) implements PipelineEvent {

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }

    record RunError(String message) implements PipelineEvent {

        @Override
        @JsonIgnore
        public boolean isTerminal() {
            return true;
        }
    }
}
