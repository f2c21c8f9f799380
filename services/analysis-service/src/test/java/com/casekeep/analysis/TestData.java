package com.casekeep.analysis;

import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.context.PipelineContextBuilder;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.MessageInput;
import com.casekeep.analysis.domain.ParticipantInput;
import com.casekeep.analysis.stage.StageIds;
import com.casekeep.analysis.stage.output.AgreementChecksOutput;
import com.casekeep.analysis.stage.output.ClaimsVerificationOutput;
import com.casekeep.analysis.stage.output.ConversationMapOutput;
import com.casekeep.analysis.stage.output.ConversationState;
import com.casekeep.analysis.stage.output.IssueAction;
import com.casekeep.analysis.stage.output.IssueActionsOutput;
import com.casekeep.analysis.stage.output.MessageAnnotationOutput;
import com.casekeep.analysis.stage.output.PersonAnalysisOutput;
import com.casekeep.analysis.stage.output.PersonContribution;
import com.casekeep.analysis.stage.output.StageOutput;
import com.casekeep.analysis.stage.output.SynthesisOutput;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

public final class TestData {

    private TestData() {
    }

    public static AnalysisRunRequest request(String subjectId) {
        return request(subjectId, null, null);
    }

    public static AnalysisRunRequest request(String subjectId, String resumeFromStage, Map<String, JsonNode> priorOutputs) {
        return new AnalysisRunRequest(
            subjectId,
            List.of(
                new MessageInput("m1", "p1", "p2", "Are you picking up on Friday?", "2024-03-01T10:00:00Z"),
                new MessageInput("m2", "p2", "p1", "I said I would, stop asking.", "2024-03-01T10:02:00Z")
            ),
            List.of(
                new ParticipantInput("p1", "Alex Doe", "parent", null),
                new ParticipantInput("p2", "Sam Roe", "parent", null)
            ),
            List.of(),
            List.of(),
            "p1",
            null,
            resumeFromStage,
            priorOutputs
        );
    }

    public static PipelineContext context() {
        return new PipelineContextBuilder().build(request("conv-1"));
    }

    /**
     * A minimal valid output for each standard stage.
     */
    public static StageOutput sampleOutput(String stageId) {
        if (StageIds.CONVERSATION_MAP.equals(stageId)) {
            return new ConversationMapOutput("Dispute over Friday pickup", "tense", List.of("pickup"), List.of(), List.of());
        }
        if (StageIds.CLAIMS_VERIFICATION.equals(stageId)) {
            return new ClaimsVerificationOutput(List.of());
        }
        if (StageIds.ISSUE_LINKING.equals(stageId)) {
            return new IssueActionsOutput(List.of(new IssueAction(
                "update", "i1", "Pickup schedule", "Friday pickup discussed again", null, null,
                List.of("m1"), List.of(), List.of("p1", "p2"), "Continues i1")));
        }
        if (StageIds.ISSUE_DETECTION.equals(stageId)) {
            return new IssueActionsOutput(List.of(new IssueAction(
                "create", null, "Pickup confirmation friction", "Repeated confirmation requests", "medium", "open",
                List.of("m1", "m2"),
                List.of(new PersonContribution("p2", "dismissive_response", "Told the other parent to stop asking", "negative")),
                null,
                "Raised in m1 and m2")));
        }
        if (StageIds.AGREEMENT_CHECKS.equals(stageId)) {
            return new AgreementChecksOutput(List.of(), List.of());
        }
        if (StageIds.PERSON_ANALYSIS.equals(stageId)) {
            return new PersonAnalysisOutput(List.of());
        }
        if (StageIds.MESSAGE_ANNOTATION.equals(stageId)) {
            return new MessageAnnotationOutput(List.of());
        }
        if (StageIds.SYNTHESIS.equals(stageId)) {
            return new SynthesisOutput(
                new ConversationState("resolved", null, "Pickup confirmed", null), List.of(), List.of(), List.of("scheduling"));
        }
        throw new IllegalArgumentException("No sample for " + stageId);
    }
}
