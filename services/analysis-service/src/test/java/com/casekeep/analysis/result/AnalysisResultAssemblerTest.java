package com.casekeep.analysis.result;

import static org.assertj.core.api.Assertions.assertThat;

import com.casekeep.analysis.stage.PriorOutputs;
import com.casekeep.analysis.stage.StageIds;
import com.casekeep.analysis.stage.output.AgreementChecksOutput;
import com.casekeep.analysis.stage.output.DetectedAgreement;
import com.casekeep.analysis.stage.output.IssueAction;
import com.casekeep.analysis.stage.output.IssueActionsOutput;
import com.casekeep.analysis.stage.output.MessageAnnotation;
import com.casekeep.analysis.stage.output.MessageAnnotationOutput;
import com.casekeep.analysis.stage.output.PersonAnalysis;
import com.casekeep.analysis.stage.output.PersonAnalysisOutput;
import com.casekeep.analysis.stage.output.PersonContribution;
import com.casekeep.analysis.stage.output.StageOutput;
import com.casekeep.analysis.stage.output.SynthesisOutput;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalysisResultAssemblerTest {

    private final AnalysisResultAssembler assembler = new AnalysisResultAssembler();

    private static IssueAction action(String title, List<PersonContribution> contributions, List<String> involved) {
        return new IssueAction("create", null, title, "desc", "medium", "open", List.of("m1"), contributions, involved, null);
    }

    @Test
    void missingStagesFallBackToDefaults() {
        AnalysisResult result = assembler.assemble(PriorOutputs.empty());

        assertThat(result.conversationAnalysis().summary()).isEqualTo("Analysis incomplete");
        assertThat(result.conversationAnalysis().overallTone()).isEqualTo("neutral");
        assertThat(result.conversationAnalysis().keyTopics()).isEmpty();
        assertThat(result.conversationState().status()).isEqualTo("open");
        assertThat(result.conversationState().pendingResponderName()).isNull();
        assertThat(result.claimsLedger()).isEmpty();
        assertThat(result.issueActions()).isEmpty();
        assertThat(result.agreementViolations()).isEmpty();
        assertThat(result.detectedAgreements()).isEmpty();
        assertThat(result.personAnalyses()).isEmpty();
        assertThat(result.messageAnnotations()).isEmpty();
        assertThat(result.alternativeInterpretations()).isEmpty();
        assertThat(result.missingContext()).isEmpty();
        assertThat(result.topicCategorySlugs()).isEmpty();
    }

    @Test
    void outputsWithNullCollectionsAreDefaulted() {
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        outputs.put(StageIds.ISSUE_LINKING, new IssueActionsOutput(null));
        outputs.put(StageIds.AGREEMENT_CHECKS, new AgreementChecksOutput(null, null));
        outputs.put(StageIds.SYNTHESIS, new SynthesisOutput(null, null, null, null));

        AnalysisResult result = assembler.assemble(PriorOutputs.of(outputs));

        assertThat(result.issueActions()).isEmpty();
        assertThat(result.agreementViolations()).isEmpty();
        assertThat(result.conversationState().status()).isEqualTo("open");
    }

    @Test
    void linkingActionsPrecedeDetectionActionsAndInvolvedIdsAreDerived() {
        PersonContribution p1 = new PersonContribution("p1", "initiated", "Raised the issue", "neutral");
        PersonContribution partial = new PersonContribution("p3", null, "No type", null);
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        outputs.put(StageIds.ISSUE_LINKING, new IssueActionsOutput(List.of(
            action("Existing issue", List.of(), List.of("p9")))));
        outputs.put(StageIds.ISSUE_DETECTION, new IssueActionsOutput(List.of(
            action("New issue", List.of(p1, partial), null),
            action("  ", List.of(), null))));

        AssembledResult assembled = assembler.assembleWithWarnings(PriorOutputs.of(outputs));

        List<IssueAction> actions = assembled.result().issueActions();
        assertThat(actions).extracting(IssueAction::title).containsExactly("Existing issue", "New issue");
        assertThat(actions.get(0).involvedPersonIds()).containsExactly("p9");
        assertThat(actions.get(1).personContributions()).containsExactly(p1);
        assertThat(actions.get(1).involvedPersonIds()).containsExactly("p1");
        assertThat(assembled.warnings()).singleElement().asString().contains("missing title");
    }

    @Test
    void incompleteEntriesAreDroppedWithWarnings() {
        MessageAnnotation.Flag attributed = new MessageAnnotation.Flag("stonewalling", "Refused to answer", "p2", "medium", "m2", null);
        MessageAnnotation.Flag anonymous = new MessageAnnotation.Flag("sarcasm", "Eye roll", null, "low", null, null);
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        outputs.put(StageIds.AGREEMENT_CHECKS, new AgreementChecksOutput(List.of(), List.of(
            new DetectedAgreement("Pickups", "Pickup at 5", null, List.of("m2"), false, null, List.of(), "high", null),
            new DetectedAgreement(null, "No topic", null, List.of(), null, null, null, null, null))));
        outputs.put(StageIds.PERSON_ANALYSIS, new PersonAnalysisOutput(Arrays.asList(
            new PersonAnalysis("p1", null, null, null, null),
            new PersonAnalysis(" ", null, null, null, null),
            null)));
        outputs.put(StageIds.MESSAGE_ANNOTATION, new MessageAnnotationOutput(List.of(
            new MessageAnnotation("m2", List.of(attributed, anonymous)),
            new MessageAnnotation(null, List.of(attributed)))));

        AssembledResult assembled = assembler.assembleWithWarnings(PriorOutputs.of(outputs));
        AnalysisResult result = assembled.result();

        assertThat(result.detectedAgreements()).extracting(DetectedAgreement::topic).containsExactly("Pickups");
        assertThat(result.personAnalyses()).extracting(PersonAnalysis::personId).containsExactly("p1");
        assertThat(result.messageAnnotations()).singleElement()
            .satisfies(annotation -> assertThat(annotation.flags()).containsExactly(attributed));
        assertThat(assembled.warnings()).hasSize(3);
    }
}
