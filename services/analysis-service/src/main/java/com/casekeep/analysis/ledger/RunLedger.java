package com.casekeep.analysis.ledger;

import com.casekeep.analysis.stage.output.StageOutput;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Durable record of runs and their per-stage outputs. Mutating methods throw
 * {@link LedgerWriteException} when the store rejects the write, and the attempt-scoped ones throw
 * {@link RunAttemptSupersededException} once the attempt no longer owns a running run.
 */
public interface RunLedger {

    RunHandle getOrCreateRun(String subjectId);

    /**
     * Atomically moves a {@code PENDING} or {@code FAILED} run to {@code RUNNING} and returns the
     * new attempt number, or nothing when the run is already running or completed.
     */
    OptionalInt beginAttempt(UUID runId);

    void setCurrentStage(UUID runId, int attempt, String stageId);

    void recordStageOutput(UUID runId, int attempt, String stageId, StageOutput output);

    void complete(UUID runId, int attempt);

    void fail(UUID runId, int attempt, String reason, String stageId);

    Optional<AnalysisRun> findRun(UUID runId);

    Optional<AnalysisRun> findLatestRun(String subjectId);

    int failStaleRuns(Instant cutoff);
}
