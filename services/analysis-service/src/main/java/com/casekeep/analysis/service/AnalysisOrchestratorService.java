package com.casekeep.analysis.service;

import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.context.PipelineContextBuilder;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.AnalysisRunView;
import com.casekeep.analysis.event.PipelineEvent;
import com.casekeep.analysis.event.PipelineEventSink;
import com.casekeep.analysis.ledger.AnalysisRun;
import com.casekeep.analysis.ledger.LedgerWriteException;
import com.casekeep.analysis.ledger.RunAttemptSupersededException;
import com.casekeep.analysis.ledger.RunHandle;
import com.casekeep.analysis.ledger.RunLedger;
import com.casekeep.analysis.result.AnalysisResultAssembler;
import com.casekeep.analysis.result.AssembledResult;
import com.casekeep.analysis.stage.PriorOutputs;
import com.casekeep.analysis.stage.StageDefinition;
import com.casekeep.analysis.stage.StageExecutionException;
import com.casekeep.analysis.stage.StageExecutor;
import com.casekeep.analysis.stage.StageOutputCodec;
import com.casekeep.analysis.stage.StageParseException;
import com.casekeep.analysis.stage.StageRegistry;
import com.casekeep.analysis.stage.UpstreamServiceException;
import com.casekeep.analysis.stage.output.StageOutput;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnalysisOrchestratorService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisOrchestratorService.class);

    private final PipelineContextBuilder contextBuilder;
    private final StageRegistry stageRegistry;
    private final StageExecutor stageExecutor;
    private final StageOutputCodec codec;
    private final RunLedger runLedger;
    private final AnalysisResultAssembler resultAssembler;

    public AnalysisOrchestratorService(
        PipelineContextBuilder contextBuilder,
        StageRegistry stageRegistry,
        StageExecutor stageExecutor,
        StageOutputCodec codec,
        RunLedger runLedger,
        AnalysisResultAssembler resultAssembler
    ) {
        this.contextBuilder = contextBuilder;
        this.stageRegistry = stageRegistry;
        this.stageExecutor = stageExecutor;
        this.codec = codec;
        this.runLedger = runLedger;
        this.resultAssembler = resultAssembler;
    }

    public PreparedRun prepare(AnalysisRunRequest request) {
        PipelineContext context = contextBuilder.build(request);
        Optional<StageDefinition> requestedStart = requestedStart(request.resumeFromStage());
        Map<String, StageOutput> supplied = decodeSupplied(request.priorOutputs());

        RunHandle handle = runLedger.getOrCreateRun(context.subjectId());
        AnalysisRun run = handle.run();
        OptionalInt claimed = runLedger.beginAttempt(run.id());
        if (claimed.isEmpty()) {
            throw new RunInProgressException(run.id(), context.subjectId());
        }
        int attempt = claimed.getAsInt();

        Map<String, StageOutput> available = new LinkedHashMap<>();
        try {
            for (StageDefinition stage : stageRegistry.stages()) {
                Optional<StageOutput> persisted = run.stageOutputs().get(stage.id(), StageOutput.class);
                if (persisted.isPresent()) {
                    available.put(stage.id(), persisted.get());
                } else if (supplied.containsKey(stage.id())) {
                    runLedger.recordStageOutput(run.id(), attempt, stage.id(), supplied.get(stage.id()));
                    available.put(stage.id(), supplied.get(stage.id()));
                }
            }
        } catch (LedgerWriteException ex) {
            failQuietly(run.id(), attempt, ex.getMessage(), null);
            throw ex;
        }

        int firstMissing = stageRegistry.firstMissing(PriorOutputs.of(available));
        int startIndex;
        if (requestedStart.isPresent()) {
            startIndex = Math.min(requestedStart.get().ordinal(), firstMissing);
        } else {
            startIndex = handle.resume() ? firstMissing : 0;
        }

        Map<String, StageOutput> seed = new LinkedHashMap<>();
        for (int i = 0; i < startIndex; i++) {
            String stageId = stageRegistry.get(i).id();
            seed.put(stageId, available.get(stageId));
        }

        if (handle.resume()) {
            LOGGER.info("Resuming run {} for subject {} at stage {} of {} (attempt {})",
                run.id(), context.subjectId(), startIndex + 1, stageRegistry.totalStages(), attempt);
        } else {
            LOGGER.info("Starting run {} for subject {} with {} messages",
                run.id(), context.subjectId(), context.messages().size());
        }
        return new PreparedRun(run.id(), attempt, handle.resume(), context, startIndex, PriorOutputs.of(seed));
    }

    /**
     * Runs the prepared stages, reporting through {@code sink}. Never throws: every failure ends
     * in a {@code stage_error} or {@code error} event, and the sink is always closed.
     */
    public void execute(PreparedRun prepared, PipelineEventSink sink) {
        UUID runId = prepared.runId();
        int attempt = prepared.attempt();
        Map<String, StageOutput> outputs = new LinkedHashMap<>(prepared.seed().asMap());
        String activeStage = null;
        try {
            for (int i = prepared.startIndex(); i < stageRegistry.totalStages(); i++) {
                StageDefinition stage = stageRegistry.get(i);
                activeStage = stage.id();
                runLedger.setCurrentStage(runId, attempt, stage.id());
                sink.send(new PipelineEvent.StageStart(
                    stage.id(), stage.displayName(), stage.stageNumber(), stageRegistry.totalStages()));

                long startedAt = System.nanoTime();
                StageOutput output;
                try {
                    output = stageExecutor.execute(stage, prepared.context(), PriorOutputs.of(outputs));
                    runLedger.recordStageOutput(runId, attempt, stage.id(), output);
                } catch (StageExecutionException | LedgerWriteException ex) {
                    String message = describe(ex);
                    LOGGER.warn("Run {} failed at stage {}: {}", runId, stage.id(), message);
                    failQuietly(runId, attempt, message, stage.id());
                    sink.send(new PipelineEvent.StageError(stage.id(), message, List.copyOf(outputs.keySet())));
                    return;
                }
                outputs.put(stage.id(), output);

                long durationMs = (System.nanoTime() - startedAt) / 1_000_000;
                LOGGER.info("Run {} stage {} complete in {}ms", runId, stage.id(), durationMs);
                sink.send(new PipelineEvent.StageComplete(stage.id(), durationMs));
            }

            activeStage = null;
            AssembledResult assembled = resultAssembler.assembleWithWarnings(PriorOutputs.of(outputs));
            if (!assembled.warnings().isEmpty()) {
                LOGGER.warn("Run {} result sanitized: {}", runId, assembled.warnings());
            }
            runLedger.complete(runId, attempt);
            LOGGER.info("Run {} complete: {} issue actions, {} person analyses", runId,
                assembled.result().issueActions().size(), assembled.result().personAnalyses().size());
            sink.send(new PipelineEvent.Complete(assembled.result()));
        } catch (RunAttemptSupersededException ex) {
            LOGGER.warn("Run {} attempt {} stopped at stage {}: {}", runId, attempt, activeStage, ex.getMessage());
            sink.send(new PipelineEvent.RunError(ex.getMessage()));
        } catch (RuntimeException ex) {
            LOGGER.error("Run {} aborted", runId, ex);
            String message = ex.getMessage() == null ? "Pipeline failed" : ex.getMessage();
            failQuietly(runId, attempt, message, activeStage);
            sink.send(new PipelineEvent.RunError(message));
        } finally {
            sink.close();
        }
    }

    public void abandon(PreparedRun prepared, String reason) {
        LOGGER.warn("Run {} abandoned before execution: {}", prepared.runId(), reason);
        failQuietly(prepared.runId(), prepared.attempt(), reason, null);
    }

    public void run(AnalysisRunRequest request, PipelineEventSink sink) {
        execute(prepare(request), sink);
    }

    public Optional<AnalysisRunView> getRun(UUID runId) {
        return runLedger.findRun(runId).map(this::toView);
    }

    public Optional<AnalysisRunView> getLatestRun(String subjectId) {
        return runLedger.findLatestRun(subjectId).map(this::toView);
    }

    private Optional<StageDefinition> requestedStart(String resumeFromStage) {
        if (resumeFromStage == null || resumeFromStage.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(stageRegistry.find(resumeFromStage)
            .orElseThrow(() -> new AnalysisValidationException("Unknown stage: " + resumeFromStage)));
    }

    private Map<String, StageOutput> decodeSupplied(Map<String, JsonNode> priorOutputs) {
        Map<String, StageOutput> decoded = new LinkedHashMap<>();
        if (priorOutputs == null) {
            return decoded;
        }
        for (Map.Entry<String, JsonNode> entry : priorOutputs.entrySet()) {
            StageDefinition stage = stageRegistry.find(entry.getKey())
                .orElseThrow(() -> new AnalysisValidationException("Unknown stage in priorOutputs: " + entry.getKey()));
            try {
                decoded.put(stage.id(), codec.decode(stage, entry.getValue()));
            } catch (StageParseException ex) {
                throw new AnalysisValidationException("Invalid prior output: " + ex.getMessage(), ex);
            }
        }
        return decoded;
    }

    private String describe(RuntimeException ex) {
        String message = ex.getMessage() == null ? "Stage failed" : ex.getMessage();
        if (ex instanceof UpstreamServiceException && ((UpstreamServiceException) ex).isRateLimited()) {
            return "Rate limited by reasoning service: " + message;
        }
        return message;
    }

    private void failQuietly(UUID runId, int attempt, String reason, String stageId) {
        try {
            runLedger.fail(runId, attempt, reason, stageId);
        } catch (RunAttemptSupersededException ex) {
            LOGGER.warn("Not recording failure of run {}: {}", runId, ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Could not record failure of run {}", runId, ex);
        }
    }

    private AnalysisRunView toView(AnalysisRun run) {
        return new AnalysisRunView(
            run.id(),
            run.subjectId(),
            run.status(),
            run.currentStage(),
            run.stageOutputs().stageIds(),
            run.failureStage(),
            run.failureReason(),
            run.attempts(),
            run.createdAt(),
            run.updatedAt(),
            run.completedAt()
        );
    }
}
