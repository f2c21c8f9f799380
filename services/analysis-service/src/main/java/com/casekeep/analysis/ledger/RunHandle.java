package com.casekeep.analysis.ledger;

public record RunHandle(AnalysisRun run, boolean resume) {
}
