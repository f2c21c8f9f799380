package com.casekeep.analysis.stage;

import com.casekeep.analysis.client.ReasoningClient;
import com.casekeep.analysis.client.ReasoningRequest;
import com.casekeep.analysis.config.AnalysisProperties;
import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.stage.output.StageOutput;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ReasoningStageExecutor implements StageExecutor {

    private final ReasoningClient reasoningClient;
    private final StageOutputCodec codec;
    private final ExecutorService callExecutor;
    private final Duration stageTimeout;

    @Autowired
    public ReasoningStageExecutor(
        ReasoningClient reasoningClient,
        StageOutputCodec codec,
        @Qualifier("reasoningCallExecutor") ExecutorService callExecutor,
        AnalysisProperties properties
    ) {
        this(reasoningClient, codec, callExecutor, properties.getStageTimeout());
    }

    ReasoningStageExecutor(
        ReasoningClient reasoningClient,
        StageOutputCodec codec,
        ExecutorService callExecutor,
        Duration stageTimeout
    ) {
        this.reasoningClient = reasoningClient;
        this.codec = codec;
        this.callExecutor = callExecutor;
        this.stageTimeout = stageTimeout;
    }

    @Override
    public StageOutput execute(StageDefinition stage, PipelineContext context, PriorOutputs priorOutputs) {
        StagePrompt prompt = stage.requestBuilder().build(context, priorOutputs.restrictTo(stage.dependsOn()));
        ReasoningRequest request = new ReasoningRequest(stage.id(), prompt.systemPrompt(), prompt.userPrompt());
        return codec.parse(stage, call(request));
    }

    private String call(ReasoningRequest request) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
            () -> reasoningClient.complete(request), callExecutor);
        try {
            return future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new UpstreamServiceException(
                "AI call for " + request.stageId() + " timed out after " + stageTimeout.toSeconds() + "s", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamServiceException("Interrupted while waiting for " + request.stageId(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof StageExecutionException) {
                throw (StageExecutionException) cause;
            }
            throw new UpstreamServiceException(
                "AI call for " + request.stageId() + " failed: " + (cause == null ? ex.getMessage() : cause.getMessage()),
                cause == null ? ex : cause);
        }
    }
}
