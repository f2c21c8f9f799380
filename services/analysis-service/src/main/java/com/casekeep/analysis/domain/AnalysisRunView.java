package com.casekeep.analysis.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AnalysisRunView(
    UUID runId,
    String subjectId,
    AnalysisRunStatus status,
    String currentStage,
    List<String> completedStages,
    String failureStage,
    String failureReason,
    int attempts,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {
}
