package com.casekeep.analysis.repository;

import com.casekeep.analysis.domain.AnalysisRunEntity;
import com.casekeep.analysis.domain.AnalysisRunStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnalysisRunRepository extends JpaRepository<AnalysisRunEntity, UUID> {

    Optional<AnalysisRunEntity> findByOpenSubjectId(String openSubjectId);

    Optional<AnalysisRunEntity> findFirstBySubjectIdOrderByCreatedAtDesc(String subjectId);

    List<AnalysisRunEntity> findByStatusAndUpdatedAtBefore(AnalysisRunStatus status, Instant cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update AnalysisRunEntity r
           set r.status = com.casekeep.analysis.domain.AnalysisRunStatus.RUNNING,
               r.attempts = r.attempts + 1,
               r.failureStage = null,
               r.failureReason = null,
               r.completedAt = null,
               r.updatedAt = :now
         where r.id = :runId
           and r.status in :claimable
        """)
    int claim(
        @Param("runId") UUID runId,
        @Param("claimable") Collection<AnalysisRunStatus> claimable,
        @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update AnalysisRunEntity r
           set r.updatedAt = :now
         where r.id = :runId
           and r.attempts = :attempt
           and r.status = com.casekeep.analysis.domain.AnalysisRunStatus.RUNNING
        """)
    int touchOwned(
        @Param("runId") UUID runId,
        @Param("attempt") int attempt,
        @Param("now") Instant now
    );
}
