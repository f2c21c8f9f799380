package com.casekeep.analysis.stage;

import com.casekeep.analysis.context.PipelineContext;

@FunctionalInterface
public interface StageRequestBuilder {

    StagePrompt build(PipelineContext context, PriorOutputs dependencies);
}
