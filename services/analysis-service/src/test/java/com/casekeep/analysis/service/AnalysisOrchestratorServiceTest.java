package com.casekeep.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.casekeep.analysis.TestData;
import com.casekeep.analysis.context.PipelineContextBuilder;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.AnalysisRunStatus;
import com.casekeep.analysis.domain.AnalysisRunView;
import com.casekeep.analysis.event.PipelineEvent;
import com.casekeep.analysis.ledger.AnalysisRun;
import com.casekeep.analysis.result.AnalysisResultAssembler;
import com.casekeep.analysis.stage.StageDefinition;
import com.casekeep.analysis.stage.StageIds;
import com.casekeep.analysis.stage.StageOutputCodec;
import com.casekeep.analysis.stage.StageParseException;
import com.casekeep.analysis.stage.StageRegistry;
import com.casekeep.analysis.stage.UpstreamServiceException;
import com.casekeep.analysis.stage.output.IssueAction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisOrchestratorServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StageRegistry registry = StageRegistry.standard();
    private final List<String> allStages = registry.stages().stream().map(StageDefinition::id).toList();

    private InMemoryRunLedger ledger;
    private ScriptedStageExecutor executor;
    private AnalysisOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryRunLedger();
        executor = new ScriptedStageExecutor();
        orchestrator = new AnalysisOrchestratorService(
            new PipelineContextBuilder(),
            registry,
            executor,
            new StageOutputCodec(objectMapper),
            ledger,
            new AnalysisResultAssembler()
        );
    }

    private RecordingEventSink run(AnalysisRunRequest request) {
        RecordingEventSink sink = new RecordingEventSink();
        orchestrator.run(request, sink);
        return sink;
    }

    @Test
    void runsEveryStageInOrderAndCompletes() {
        RecordingEventSink sink = run(TestData.request("conv-1"));

        assertThat(executor.calledStages()).containsExactlyElementsOf(allStages);
        for (int i = 0; i < allStages.size(); i++) {
            assertThat(executor.calls().get(i).prior().stageIds())
                .as("outputs visible to %s", allStages.get(i))
                .containsExactlyElementsOf(allStages.subList(0, i));
        }

        List<PipelineEvent.StageStart> starts = sink.eventsOf(PipelineEvent.StageStart.class);
        assertThat(starts).extracting(PipelineEvent.StageStart::stageNumber).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(starts).allSatisfy(start -> assertThat(start.totalStages()).isEqualTo(8));
        assertThat(starts.get(0).stageName()).isEqualTo("Mapping Conversation");
        assertThat(sink.eventsOf(PipelineEvent.StageComplete.class)).hasSize(8);
        assertThat(sink.events().get(0)).isInstanceOf(PipelineEvent.StageStart.class);
        assertThat(sink.events().get(1)).isInstanceOf(PipelineEvent.StageComplete.class);
        assertThat(sink.events()).hasSize(17);

        PipelineEvent.Complete complete = (PipelineEvent.Complete) sink.last();
        assertThat(complete.result().conversationAnalysis().summary()).isEqualTo("Dispute over Friday pickup");
        assertThat(complete.result().issueActions())
            .extracting(IssueAction::title)
            .containsExactly("Pickup schedule", "Pickup confirmation friction");
        assertThat(complete.result().issueActions().get(1).involvedPersonIds()).containsExactly("p2");
        assertThat(sink.closeCount()).isEqualTo(1);

        AnalysisRun stored = ledger.findLatestRun("conv-1").orElseThrow();
        assertThat(stored.status()).isEqualTo(AnalysisRunStatus.COMPLETED);
        assertThat(stored.stageOutputs().stageIds()).containsExactlyElementsOf(allStages);
    }

    @Test
    void firstFailureStopsTheRun() {
        executor.failAt(StageIds.AGREEMENT_CHECKS, new StageParseException("Response for agreement_checks is missing agreementViolations"));

        RecordingEventSink sink = run(TestData.request("conv-1"));

        assertThat(executor.calledStages()).containsExactlyElementsOf(allStages.subList(0, 5));
        assertThat(sink.eventsOf(PipelineEvent.StageComplete.class)).hasSize(4);
        assertThat(sink.eventsOf(PipelineEvent.Complete.class)).isEmpty();
        PipelineEvent.StageError error = (PipelineEvent.StageError) sink.last();
        assertThat(error.stage()).isEqualTo(StageIds.AGREEMENT_CHECKS);
        assertThat(error.message()).contains("missing agreementViolations");
        assertThat(error.completedStages()).containsExactlyElementsOf(allStages.subList(0, 4));
        assertThat(sink.closeCount()).isEqualTo(1);

        AnalysisRun stored = ledger.findLatestRun("conv-1").orElseThrow();
        assertThat(stored.status()).isEqualTo(AnalysisRunStatus.FAILED);
        assertThat(stored.failureStage()).isEqualTo(StageIds.AGREEMENT_CHECKS);
        assertThat(stored.stageOutputs().stageIds()).containsExactlyElementsOf(allStages.subList(0, 4));
    }

    @Test
    void failureAtThirdStageEmitsExactSequence() {
        executor.failAt(StageIds.ISSUE_LINKING, new UpstreamServiceException("AI call failed: 500", 500));

        RecordingEventSink sink = run(TestData.request("conv-1"));

        assertThat(executor.calls()).hasSize(3);
        assertThat(sink.events()).containsExactly(
            new PipelineEvent.StageStart(StageIds.CONVERSATION_MAP, "Mapping Conversation", 1, 8),
            sink.events().get(1),
            new PipelineEvent.StageStart(StageIds.CLAIMS_VERIFICATION, "Verifying Claims", 2, 8),
            sink.events().get(3),
            new PipelineEvent.StageStart(StageIds.ISSUE_LINKING, "Linking Issues", 3, 8),
            new PipelineEvent.StageError(StageIds.ISSUE_LINKING, "AI call failed: 500",
                List.of(StageIds.CONVERSATION_MAP, StageIds.CLAIMS_VERIFICATION))
        );
        assertThat(sink.events().get(1)).isInstanceOfSatisfying(PipelineEvent.StageComplete.class,
            event -> assertThat(event.stage()).isEqualTo(StageIds.CONVERSATION_MAP));
        assertThat(sink.events().get(3)).isInstanceOfSatisfying(PipelineEvent.StageComplete.class,
            event -> assertThat(event.stage()).isEqualTo(StageIds.CLAIMS_VERIFICATION));
    }

    @Test
    void resumeReexecutesTheFailedStageWithPersistedOutputs() {
        executor.failAt(StageIds.ISSUE_DETECTION, new UpstreamServiceException("AI call failed: 502", 502));
        RecordingEventSink first = run(TestData.request("conv-1"));
        UUID runId = ledger.findLatestRun("conv-1").orElseThrow().id();
        AnalysisRun failed = ledger.findRun(runId).orElseThrow();
        assertThat(first.last()).isInstanceOf(PipelineEvent.StageError.class);

        executor.clearFailures();
        executor.calls().clear();
        PreparedRun prepared = orchestrator.prepare(TestData.request("conv-1"));

        assertThat(prepared.runId()).isEqualTo(runId);
        assertThat(prepared.resume()).isTrue();
        assertThat(prepared.startIndex()).isEqualTo(3);

        RecordingEventSink second = new RecordingEventSink();
        orchestrator.execute(prepared, second);

        assertThat(executor.calledStages()).containsExactlyElementsOf(allStages.subList(3, 8));
        assertThat(executor.calls().get(0).prior().asMap()).isEqualTo(failed.stageOutputs().asMap());
        assertThat(second.events().get(0))
            .isEqualTo(new PipelineEvent.StageStart(StageIds.ISSUE_DETECTION, "Detecting New Issues", 4, 8));
        assertThat(second.eventsOf(PipelineEvent.Complete.class)).singleElement()
            .satisfies(complete -> assertThat(complete.result().issueActions())
                .extracting(IssueAction::title)
                .containsExactly("Pickup schedule", "Pickup confirmation friction"));
        assertThat(second.last()).isInstanceOf(PipelineEvent.Complete.class);
        assertThat(ledger.findRun(runId).orElseThrow().status()).isEqualTo(AnalysisRunStatus.COMPLETED);
        assertThat(ledger.runCount()).isEqualTo(1);
    }

    @Test
    void suppliedPriorOutputsSeedAFreshRun() {
        Map<String, JsonNode> prior = Map.of(
            StageIds.CONVERSATION_MAP, objectMapper.valueToTree(TestData.sampleOutput(StageIds.CONVERSATION_MAP)),
            StageIds.CLAIMS_VERIFICATION, objectMapper.valueToTree(TestData.sampleOutput(StageIds.CLAIMS_VERIFICATION))
        );

        PreparedRun prepared = orchestrator.prepare(TestData.request("conv-2", StageIds.ISSUE_LINKING, prior));

        assertThat(prepared.resume()).isFalse();
        assertThat(prepared.startIndex()).isEqualTo(2);
        assertThat(prepared.seed().stageIds()).containsExactly(StageIds.CONVERSATION_MAP, StageIds.CLAIMS_VERIFICATION);
        assertThat(ledger.findRun(prepared.runId()).orElseThrow().stageOutputs().size()).isEqualTo(2);
    }

    @Test
    void requestedStartIsClampedToFirstMissingOutput() {
        Map<String, JsonNode> prior = Map.of(
            StageIds.CONVERSATION_MAP, objectMapper.valueToTree(TestData.sampleOutput(StageIds.CONVERSATION_MAP))
        );

        PreparedRun prepared = orchestrator.prepare(TestData.request("conv-3", StageIds.SYNTHESIS, prior));

        assertThat(prepared.startIndex()).isEqualTo(1);
        assertThat(prepared.seed().stageIds()).containsExactly(StageIds.CONVERSATION_MAP);
    }

    @Test
    void unknownResumeStageIsRejectedBeforeTouchingTheLedger() {
        assertThatThrownBy(() -> orchestrator.prepare(TestData.request("conv-4", "made_up_stage", null)))
            .isInstanceOf(AnalysisValidationException.class)
            .hasMessageContaining("made_up_stage");
        assertThat(ledger.runCount()).isZero();
    }

    @Test
    void malformedPriorOutputIsRejectedBeforeTouchingTheLedger() {
        Map<String, JsonNode> prior = Map.of(StageIds.CONVERSATION_MAP, objectMapper.createObjectNode().put("tone", "x"));

        assertThatThrownBy(() -> orchestrator.prepare(TestData.request("conv-5", StageIds.CLAIMS_VERIFICATION, prior)))
            .isInstanceOf(AnalysisValidationException.class)
            .hasMessageContaining("missing summary");
        assertThat(ledger.runCount()).isZero();
    }

    @Test
    void emptyTranscriptNeverStartsARun() {
        AnalysisRunRequest request = new AnalysisRunRequest("conv-6", List.of(), null, null, null, null, null, null, null);

        assertThatThrownBy(() -> orchestrator.prepare(request)).isInstanceOf(AnalysisValidationException.class);
        assertThat(ledger.runCount()).isZero();
        assertThat(executor.calls()).isEmpty();
    }

    @Test
    void secondCallerIsRefusedWhileRunIsClaimed() {
        PreparedRun prepared = orchestrator.prepare(TestData.request("conv-7"));

        assertThatThrownBy(() -> orchestrator.prepare(TestData.request("conv-7")))
            .isInstanceOfSatisfying(RunInProgressException.class,
                ex -> assertThat(ex.getRunId()).isEqualTo(prepared.runId()));
    }

    @Test
    void rateLimitedStageIsLabelled() {
        executor.failAt(StageIds.CONVERSATION_MAP, new UpstreamServiceException("AI call failed: 429", 429));

        RecordingEventSink sink = run(TestData.request("conv-8"));

        PipelineEvent.StageError error = (PipelineEvent.StageError) sink.last();
        assertThat(error.message()).startsWith("Rate limited by reasoning service");
        assertThat(error.completedStages()).isEmpty();
    }

    @Test
    void ledgerWriteFailureEndsRunWithoutStageComplete() {
        ledger.rejectRecordingOf(StageIds.CLAIMS_VERIFICATION);

        RecordingEventSink sink = run(TestData.request("conv-9"));

        assertThat(executor.calledStages()).containsExactly(StageIds.CONVERSATION_MAP, StageIds.CLAIMS_VERIFICATION);
        assertThat(sink.eventsOf(PipelineEvent.StageComplete.class))
            .extracting(PipelineEvent.StageComplete::stage)
            .containsExactly(StageIds.CONVERSATION_MAP);
        PipelineEvent.StageError error = (PipelineEvent.StageError) sink.last();
        assertThat(error.stage()).isEqualTo(StageIds.CLAIMS_VERIFICATION);
        assertThat(error.completedStages()).containsExactly(StageIds.CONVERSATION_MAP);
        assertThat(ledger.findLatestRun("conv-9").orElseThrow().status()).isEqualTo(AnalysisRunStatus.FAILED);
    }

    @Test
    void completedSubjectStartsAFreshRun() {
        run(TestData.request("conv-10"));
        UUID firstRun = ledger.findLatestRun("conv-10").orElseThrow().id();

        PreparedRun prepared = orchestrator.prepare(TestData.request("conv-10"));

        assertThat(prepared.runId()).isNotEqualTo(firstRun);
        assertThat(prepared.resume()).isFalse();
        assertThat(prepared.startIndex()).isZero();
        assertThat(prepared.seed().size()).isZero();
    }

    @Test
    void runViewListsCompletedStages() {
        executor.failAt(StageIds.ISSUE_LINKING, new StageParseException("bad"));
        run(TestData.request("conv-11"));

        AnalysisRunView view = orchestrator.getLatestRun("conv-11").orElseThrow();

        assertThat(view.status()).isEqualTo(AnalysisRunStatus.FAILED);
        assertThat(view.completedStages()).containsExactly(StageIds.CONVERSATION_MAP, StageIds.CLAIMS_VERIFICATION);
        assertThat(view.failureStage()).isEqualTo(StageIds.ISSUE_LINKING);
        assertThat(view.currentStage()).isEqualTo(StageIds.ISSUE_LINKING);
        assertThat(orchestrator.getRun(view.runId())).map(AnalysisRunView::subjectId).contains("conv-11");
    }

    @Test
    void queuedAttemptOvertakenByARetryStopsWithoutRunningStages() {
        PreparedRun queued = orchestrator.prepare(TestData.request("conv-12"));
        ledger.fail(queued.runId(), queued.attempt(), "Run abandoned while at stage none", null);
        PreparedRun retry = orchestrator.prepare(TestData.request("conv-12"));
        assertThat(retry.attempt()).isEqualTo(queued.attempt() + 1);

        RecordingEventSink stale = new RecordingEventSink();
        orchestrator.execute(queued, stale);

        assertThat(executor.calls()).isEmpty();
        assertThat(stale.events()).hasSize(1);
        assertThat(stale.last()).isInstanceOf(PipelineEvent.RunError.class);
        assertThat(stale.closeCount()).isEqualTo(1);
        assertThat(ledger.findRun(queued.runId()).orElseThrow().status()).isEqualTo(AnalysisRunStatus.RUNNING);

        RecordingEventSink current = new RecordingEventSink();
        orchestrator.execute(retry, current);

        assertThat(current.last()).isInstanceOf(PipelineEvent.Complete.class);
        assertThat(executor.calledStages()).containsExactlyElementsOf(allStages);
    }
}
