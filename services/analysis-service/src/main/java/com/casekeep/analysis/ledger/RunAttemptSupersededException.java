package com.casekeep.analysis.ledger;

import java.util.UUID;

public class RunAttemptSupersededException extends RuntimeException {

    public RunAttemptSupersededException(UUID runId, int attempt) {
        super("Run " + runId + " is no longer owned by attempt " + attempt);
    }
}
