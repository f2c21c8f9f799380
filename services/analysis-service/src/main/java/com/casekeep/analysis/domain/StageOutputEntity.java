package com.casekeep.analysis.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "analysis_stage_outputs",
    uniqueConstraints = @UniqueConstraint(name = "uk_stage_output_run_stage", columnNames = {"run_id", "stage_id"})
)
public class StageOutputEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "stage_id", nullable = false, updatable = false)
    private String stageId;

    @Column(name = "stage_ordinal", nullable = false)
    private int stageOrdinal;

    @Column(name = "output_json", nullable = false, columnDefinition = "text")
    private String outputJson;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public static StageOutputEntity of(UUID runId, String stageId, int stageOrdinal, String outputJson) {
        StageOutputEntity entity = new StageOutputEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.stageId = stageId;
        entity.stageOrdinal = stageOrdinal;
        entity.outputJson = outputJson;
        entity.recordedAt = Instant.now();
        return entity;
    }

    public void overwrite(String outputJson) {
        this.outputJson = outputJson;
        this.recordedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getStageId() {
        return stageId;
    }

    public int getStageOrdinal() {
        return stageOrdinal;
    }

    public String getOutputJson() {
        return outputJson;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
