package com.casekeep.analysis.ledger;

import com.casekeep.analysis.domain.AnalysisRunStatus;
import com.casekeep.analysis.stage.PriorOutputs;
import java.time.Instant;
import java.util.UUID;

public record AnalysisRun(
    UUID id,
    String subjectId,
    AnalysisRunStatus status,
    String currentStage,
    PriorOutputs stageOutputs,
    String failureStage,
    String failureReason,
    int attempts,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {
}
