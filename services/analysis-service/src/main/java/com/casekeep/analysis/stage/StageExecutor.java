package com.casekeep.analysis.stage;

import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.stage.output.StageOutput;

public interface StageExecutor {

    StageOutput execute(StageDefinition stage, PipelineContext context, PriorOutputs priorOutputs);
}
