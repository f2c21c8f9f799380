package com.casekeep.analysis.stage;

import com.casekeep.analysis.stage.output.AgreementChecksOutput;
import com.casekeep.analysis.stage.output.ClaimsVerificationOutput;
import com.casekeep.analysis.stage.output.ConversationMapOutput;
import com.casekeep.analysis.stage.output.IssueActionsOutput;
import com.casekeep.analysis.stage.output.MessageAnnotationOutput;
import com.casekeep.analysis.stage.output.PersonAnalysisOutput;
import com.casekeep.analysis.stage.output.SynthesisOutput;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class StageRegistry {

    private final List<StageDefinition> stages;

    public StageRegistry(List<StageDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        List<StageDefinition> ordered = new ArrayList<>(definitions.size());
        Set<String> earlier = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            StageDefinition definition = definitions.get(i);
            if (earlier.contains(definition.id())) {
                throw new IllegalArgumentException("Duplicate stage id: " + definition.id());
            }
            for (String dependency : definition.dependsOn()) {
                if (!earlier.contains(dependency)) {
                    throw new IllegalArgumentException(
                        "Stage " + definition.id() + " depends on " + dependency + " which does not run before it");
                }
            }
            ordered.add(definition.withOrdinal(i));
            earlier.add(definition.id());
        }
        this.stages = List.copyOf(ordered);
    }

    public static StageRegistry standard() {
        return new StageRegistry(List.of(
            StageDefinition.of(
                StageIds.CONVERSATION_MAP, "Mapping Conversation", ConversationMapOutput.class,
                List.of("summary"), Set.of(), StagePrompts::conversationMap),
            StageDefinition.of(
                StageIds.CLAIMS_VERIFICATION, "Verifying Claims", ClaimsVerificationOutput.class,
                List.of("claimsLedger"), Set.of(), StagePrompts::claimsVerification),
            StageDefinition.of(
                StageIds.ISSUE_LINKING, "Linking Issues", IssueActionsOutput.class,
                List.of("issueActions"), Set.of(), StagePrompts::issueLinking),
            StageDefinition.of(
                StageIds.ISSUE_DETECTION, "Detecting New Issues", IssueActionsOutput.class,
                List.of("issueActions"), Set.of(StageIds.CONVERSATION_MAP, StageIds.ISSUE_LINKING),
                StagePrompts::issueDetection),
            StageDefinition.of(
                StageIds.AGREEMENT_CHECKS, "Checking Agreements", AgreementChecksOutput.class,
                List.of("agreementViolations"), Set.of(), StagePrompts::agreementChecks),
            StageDefinition.of(
                StageIds.PERSON_ANALYSIS, "Analyzing Participants", PersonAnalysisOutput.class,
                List.of("personAnalyses"), Set.of(StageIds.CONVERSATION_MAP, StageIds.CLAIMS_VERIFICATION),
                StagePrompts::personAnalysis),
            StageDefinition.of(
                StageIds.MESSAGE_ANNOTATION, "Annotating Messages", MessageAnnotationOutput.class,
                List.of("messageAnnotations"), Set.of(StageIds.CLAIMS_VERIFICATION),
                StagePrompts::messageAnnotation),
            StageDefinition.of(
                StageIds.SYNTHESIS, "Synthesizing Results", SynthesisOutput.class,
                List.of("conversationState"),
                Set.of(
                    StageIds.CONVERSATION_MAP,
                    StageIds.CLAIMS_VERIFICATION,
                    StageIds.ISSUE_LINKING,
                    StageIds.ISSUE_DETECTION,
                    StageIds.AGREEMENT_CHECKS,
                    StageIds.PERSON_ANALYSIS,
                    StageIds.MESSAGE_ANNOTATION
                ),
                StagePrompts::synthesis)
        ));
    }

    public List<StageDefinition> stages() {
        return stages;
    }

    public int totalStages() {
        return stages.size();
    }

    public StageDefinition get(int ordinal) {
        return stages.get(ordinal);
    }

    public int indexOf(String stageId) {
        for (StageDefinition stage : stages) {
            if (stage.id().equals(stageId)) {
                return stage.ordinal();
            }
        }
        return -1;
    }

    public Optional<StageDefinition> find(String stageId) {
        int index = indexOf(stageId);
        return index < 0 ? Optional.empty() : Optional.of(stages.get(index));
    }

    public int firstMissing(PriorOutputs outputs) {
        for (StageDefinition stage : stages) {
            if (!outputs.contains(stage.id())) {
                return stage.ordinal();
            }
        }
        return stages.size();
    }
}
