package com.casekeep.analysis.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "analysis_runs")
public class AnalysisRunEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private String subjectId;

    // unique; cleared when the run completes or is closed
    @Column(name = "open_subject_id", unique = true)
    private String openSubjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AnalysisRunStatus status;

    @Column(name = "current_stage")
    private String currentStage;

    @Column(name = "failure_stage")
    private String failureStage;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static AnalysisRunEntity startNew(String subjectId) {
        AnalysisRunEntity run = new AnalysisRunEntity();
        run.id = UUID.randomUUID();
        run.subjectId = subjectId;
        run.openSubjectId = subjectId;
        run.status = AnalysisRunStatus.PENDING;
        return run;
    }

    public void moveTo(String stageId) {
        this.currentStage = stageId;
    }

    public void complete() {
        this.status = AnalysisRunStatus.COMPLETED;
        this.completedAt = Instant.now();
        this.openSubjectId = null;
        this.failureStage = null;
        this.failureReason = null;
    }

    public void fail(String reason, String stageId) {
        this.status = AnalysisRunStatus.FAILED;
        this.failureReason = reason;
        this.failureStage = stageId;
        this.completedAt = Instant.now();
    }

    public void close() {
        this.openSubjectId = null;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public AnalysisRunStatus getStatus() {
        return status;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public String getFailureStage() {
        return failureStage;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
