package com.casekeep.analysis.domain;

import java.util.EnumSet;
import java.util.Set;

public enum AnalysisRunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isClaimable() {
        return this == PENDING || this == FAILED;
    }

    public static Set<AnalysisRunStatus> claimable() {
        EnumSet<AnalysisRunStatus> statuses = EnumSet.noneOf(AnalysisRunStatus.class);
        for (AnalysisRunStatus status : values()) {
            if (status.isClaimable()) {
                statuses.add(status);
            }
        }
        return statuses;
    }
}
