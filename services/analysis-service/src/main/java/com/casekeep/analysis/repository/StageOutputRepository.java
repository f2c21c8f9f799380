package com.casekeep.analysis.repository;

import com.casekeep.analysis.domain.StageOutputEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StageOutputRepository extends JpaRepository<StageOutputEntity, UUID> {

    List<StageOutputEntity> findByRunIdOrderByStageOrdinalAsc(UUID runId);

    Optional<StageOutputEntity> findByRunIdAndStageId(UUID runId, String stageId);
}
