package com.casekeep.analysis.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public interface PipelineStreamListener {

    void onProgress(PipelineEvent.StageStarted event);

    default void onStageComplete(PipelineEvent.StageCompleted event) {
    }

    void onComplete(JsonNode result);

    void onError(String message, String stage, List<String> completedStages);
}
