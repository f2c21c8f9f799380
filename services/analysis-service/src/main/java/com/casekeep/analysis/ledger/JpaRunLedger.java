package com.casekeep.analysis.ledger;

import com.casekeep.analysis.config.AnalysisProperties;
import com.casekeep.analysis.domain.AnalysisRunEntity;
import com.casekeep.analysis.domain.AnalysisRunStatus;
import com.casekeep.analysis.domain.StageOutputEntity;
import com.casekeep.analysis.repository.AnalysisRunRepository;
import com.casekeep.analysis.repository.StageOutputRepository;
import com.casekeep.analysis.stage.PriorOutputs;
import com.casekeep.analysis.stage.StageDefinition;
import com.casekeep.analysis.stage.StageOutputCodec;
import com.casekeep.analysis.stage.StageParseException;
import com.casekeep.analysis.stage.StageRegistry;
import com.casekeep.analysis.stage.output.StageOutput;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class JpaRunLedger implements RunLedger {

    private static final Logger LOGGER = LoggerFactory.getLogger(JpaRunLedger.class);

    private static final int CREATE_ATTEMPTS = 5;

    private final AnalysisRunRepository runRepository;
    private final StageOutputRepository outputRepository;
    private final StageRegistry stageRegistry;
    private final StageOutputCodec codec;
    private final AnalysisProperties properties;
    private final TransactionTemplate transactionTemplate;

    public JpaRunLedger(
        AnalysisRunRepository runRepository,
        StageOutputRepository outputRepository,
        StageRegistry stageRegistry,
        StageOutputCodec codec,
        AnalysisProperties properties,
        PlatformTransactionManager transactionManager
    ) {
        this.runRepository = runRepository;
        this.outputRepository = outputRepository;
        this.stageRegistry = stageRegistry;
        this.codec = codec;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public RunHandle getOrCreateRun(String subjectId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> openOrCreate(subjectId));
            } catch (DataIntegrityViolationException | TransientDataAccessException ex) {
                // another caller inserted the open run first; the next pass finds it
                if (attempt == CREATE_ATTEMPTS) {
                    throw new LedgerWriteException("Failed to open run for " + subjectId, ex);
                }
                LOGGER.debug("Lost open-run race for subject {}, retrying", subjectId);
            } catch (DataAccessException ex) {
                LOGGER.error("Ledger write failed: open run for {}", subjectId, ex);
                throw new LedgerWriteException("Failed to open run for " + subjectId, ex);
            }
        }
    }

    private RunHandle openOrCreate(String subjectId) {
        Optional<AnalysisRunEntity> open = runRepository.findByOpenSubjectId(subjectId);
        if (open.isPresent()) {
            AnalysisRunEntity run = open.get();
            if (isStale(run)) {
                LOGGER.warn("Run {} for subject {} stalled at {}, marking it failed",
                    run.getId(), subjectId, run.getCurrentStage());
                run.fail(abandonedReason(run), run.getCurrentStage());
            }
            if (run.getStatus() == AnalysisRunStatus.FAILED && run.getAttempts() >= properties.getMaxResumeAttempts()) {
                LOGGER.warn("Run {} for subject {} failed {} times, starting over",
                    run.getId(), subjectId, run.getAttempts());
                run.close();
                runRepository.saveAndFlush(run);
            } else {
                runRepository.saveAndFlush(run);
                return new RunHandle(toRun(run), true);
            }
        }
        AnalysisRunEntity created = runRepository.saveAndFlush(AnalysisRunEntity.startNew(subjectId));
        return new RunHandle(toRun(created), false);
    }

    @Override
    public OptionalInt beginAttempt(UUID runId) {
        return write("claim run " + runId, () -> {
            int claimed = runRepository.claim(runId, AnalysisRunStatus.claimable(), Instant.now());
            if (claimed == 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(requireRun(runId).getAttempts());
        });
    }

    @Override
    public void setCurrentStage(UUID runId, int attempt, String stageId) {
        writeOwned("set current stage of " + runId, runId, attempt, () -> {
            AnalysisRunEntity run = requireRun(runId);
            run.moveTo(stageId);
            return runRepository.save(run);
        });
    }

    @Override
    public void recordStageOutput(UUID runId, int attempt, String stageId, StageOutput output) {
        StageDefinition stage = stageRegistry.find(stageId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + stageId));
        String json = codec.toJson(output);
        writeOwned("record " + stageId + " output of " + runId, runId, attempt, () -> {
            StageOutputEntity entity = outputRepository.findByRunIdAndStageId(runId, stageId)
                .map(existing -> {
                    existing.overwrite(json);
                    return existing;
                })
                .orElseGet(() -> StageOutputEntity.of(runId, stageId, stage.ordinal(), json));
            return outputRepository.save(entity);
        });
    }

    @Override
    public void complete(UUID runId, int attempt) {
        writeOwned("complete run " + runId, runId, attempt, () -> {
            AnalysisRunEntity run = requireRun(runId);
            run.complete();
            return runRepository.save(run);
        });
    }

    @Override
    public void fail(UUID runId, int attempt, String reason, String stageId) {
        writeOwned("fail run " + runId, runId, attempt, () -> {
            AnalysisRunEntity run = requireRun(runId);
            run.fail(truncate(reason, 1000), stageId);
            return runRepository.save(run);
        });
    }

    @Override
    public Optional<AnalysisRun> findRun(UUID runId) {
        return runRepository.findById(runId).map(this::toRun);
    }

    @Override
    public Optional<AnalysisRun> findLatestRun(String subjectId) {
        return runRepository.findFirstBySubjectIdOrderByCreatedAtDesc(subjectId).map(this::toRun);
    }

    @Override
    public int failStaleRuns(Instant cutoff) {
        return write("fail stale runs", () -> {
            List<AnalysisRunEntity> stale = runRepository.findByStatusAndUpdatedAtBefore(AnalysisRunStatus.RUNNING, cutoff);
            for (AnalysisRunEntity run : stale) {
                run.fail(abandonedReason(run), run.getCurrentStage());
            }
            runRepository.saveAll(stale);
            return stale.size();
        });
    }

    private boolean isStale(AnalysisRunEntity run) {
        return run.getStatus() == AnalysisRunStatus.RUNNING
            && run.getUpdatedAt() != null
            && run.getUpdatedAt().isBefore(Instant.now().minus(properties.getStaleRunTimeout()));
    }

    private String abandonedReason(AnalysisRunEntity run) {
        return "Run abandoned while at stage " + (run.getCurrentStage() == null ? "none" : run.getCurrentStage());
    }

    private AnalysisRunEntity requireRun(UUID runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new IllegalArgumentException("Analysis run not found: " + runId));
    }

    private AnalysisRun toRun(AnalysisRunEntity entity) {
        return new AnalysisRun(
            entity.getId(),
            entity.getSubjectId(),
            entity.getStatus(),
            entity.getCurrentStage(),
            loadOutputs(entity.getId()),
            entity.getFailureStage(),
            entity.getFailureReason(),
            entity.getAttempts(),
            entity.getCreatedAt(),
            entity.getUpdatedAt(),
            entity.getCompletedAt()
        );
    }

    private PriorOutputs loadOutputs(UUID runId) {
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        for (StageOutputEntity entity : outputRepository.findByRunIdOrderByStageOrdinalAsc(runId)) {
            Optional<StageDefinition> stage = stageRegistry.find(entity.getStageId());
            if (stage.isEmpty()) {
                LOGGER.warn("Run {} has output for unknown stage {}, ignoring it", runId, entity.getStageId());
                continue;
            }
            try {
                outputs.put(entity.getStageId(), codec.parse(stage.get(), entity.getOutputJson()));
            } catch (StageParseException ex) {
                LOGGER.warn("Stored output of {} for run {} no longer decodes, ignoring it: {}",
                    entity.getStageId(), runId, ex.getMessage());
            }
        }
        return PriorOutputs.of(outputs);
    }

    private <T> T write(String description, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException ex) {
            LOGGER.error("Ledger write failed: {}", description, ex);
            throw new LedgerWriteException("Failed to " + description, ex);
        }
    }

    // the owning update holds the run's row lock until commit, so a reap or reclaim cannot slip in
    private <T> T writeOwned(String description, UUID runId, int attempt, Supplier<T> work) {
        return write(description, () -> {
            if (runRepository.touchOwned(runId, attempt, Instant.now()) == 0) {
                throw new RunAttemptSupersededException(runId, attempt);
            }
            return work.get();
        });
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
