package com.casekeep.analysis.service;

import java.util.UUID;

public class RunInProgressException extends IllegalStateException {

    private final UUID runId;

    public RunInProgressException(UUID runId, String subjectId) {
        super("Analysis already in progress for subject " + subjectId + " (run " + runId + ")");
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
