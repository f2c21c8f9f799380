package com.casekeep.analysis.service;

import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.stage.PriorOutputs;
import java.util.UUID;

public record PreparedRun(
    UUID runId,
    int attempt,
    boolean resume,
    PipelineContext context,
    int startIndex,
    PriorOutputs seed
) {
}
