package com.casekeep.analysis.result;

import com.casekeep.analysis.stage.PriorOutputs;
import com.casekeep.analysis.stage.StageIds;
import com.casekeep.analysis.stage.output.AgreementChecksOutput;
import com.casekeep.analysis.stage.output.ClaimsVerificationOutput;
import com.casekeep.analysis.stage.output.ConversationMapOutput;
import com.casekeep.analysis.stage.output.ConversationState;
import com.casekeep.analysis.stage.output.DetectedAgreement;
import com.casekeep.analysis.stage.output.IssueAction;
import com.casekeep.analysis.stage.output.IssueActionsOutput;
import com.casekeep.analysis.stage.output.MessageAnnotation;
import com.casekeep.analysis.stage.output.MessageAnnotationOutput;
import com.casekeep.analysis.stage.output.PersonAnalysis;
import com.casekeep.analysis.stage.output.PersonAnalysisOutput;
import com.casekeep.analysis.stage.output.PersonContribution;
import com.casekeep.analysis.stage.output.SynthesisOutput;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class AnalysisResultAssembler {

    static final String INCOMPLETE_SUMMARY = "Analysis incomplete";
    static final String DEFAULT_TONE = "neutral";

    public AnalysisResult assemble(PriorOutputs outputs) {
        return assembleWithWarnings(outputs).result();
    }

    public AssembledResult assembleWithWarnings(PriorOutputs outputs) {
        List<String> warnings = new ArrayList<>();

        ConversationMapOutput map = outputs.get(StageIds.CONVERSATION_MAP, ConversationMapOutput.class)
            .orElse(new ConversationMapOutput(null, null, null, null, null));
        SynthesisOutput synthesis = outputs.get(StageIds.SYNTHESIS, SynthesisOutput.class)
            .orElse(new SynthesisOutput(null, null, null, null));
        AgreementChecksOutput agreements = outputs.get(StageIds.AGREEMENT_CHECKS, AgreementChecksOutput.class)
            .orElse(new AgreementChecksOutput(null, null));

        List<IssueAction> issueActions = new ArrayList<>();
        issueActions.addAll(issueActions(outputs, StageIds.ISSUE_LINKING));
        issueActions.addAll(issueActions(outputs, StageIds.ISSUE_DETECTION));

        AnalysisResult result = new AnalysisResult(
            new AnalysisResult.ConversationSummary(
                blankToDefault(map.summary(), INCOMPLETE_SUMMARY),
                blankToDefault(map.overallTone(), DEFAULT_TONE),
                orEmpty(map.keyTopics())
            ),
            orEmpty(outputs.get(StageIds.CLAIMS_VERIFICATION, ClaimsVerificationOutput.class)
                .map(ClaimsVerificationOutput::claimsLedger)
                .orElse(null)),
            conversationState(synthesis.conversationState()),
            orEmpty(synthesis.alternativeInterpretations()),
            orEmpty(synthesis.missingContext()),
            orEmpty(synthesis.topicCategorySlugs()),
            sanitizeIssueActions(issueActions, warnings),
            orEmpty(agreements.agreementViolations()),
            sanitizeDetectedAgreements(orEmpty(agreements.detectedAgreements()), warnings),
            sanitizePersonAnalyses(outputs, warnings),
            sanitizeAnnotations(outputs, warnings)
        );
        return new AssembledResult(result, List.copyOf(warnings));
    }

    private List<IssueAction> issueActions(PriorOutputs outputs, String stageId) {
        return orEmpty(outputs.get(stageId, IssueActionsOutput.class)
            .map(IssueActionsOutput::issueActions)
            .orElse(null));
    }

    private ConversationState conversationState(ConversationState state) {
        if (state == null) {
            return ConversationState.undetermined();
        }
        return new ConversationState(
            blankToDefault(state.status(), "open"),
            state.pendingResponderName(),
            state.reasoning() == null ? "" : state.reasoning(),
            state.pendingActionSummary()
        );
    }

    private List<IssueAction> sanitizeIssueActions(List<IssueAction> actions, List<String> warnings) {
        List<IssueAction> kept = new ArrayList<>();
        for (int i = 0; i < actions.size(); i++) {
            IssueAction action = actions.get(i);
            if (action == null || isBlank(action.title())) {
                warnings.add("issueActions[" + i + "] missing title, skipped");
                continue;
            }
            List<PersonContribution> contributions = orEmpty(action.personContributions()).stream()
                .filter(c -> c != null && c.isComplete())
                .toList();
            List<String> involved = orEmpty(action.involvedPersonIds());
            if (involved.isEmpty() && !contributions.isEmpty()) {
                involved = contributions.stream().map(PersonContribution::personId).toList();
            }
            kept.add(action.withContributions(contributions, involved));
        }
        return List.copyOf(kept);
    }

    private List<DetectedAgreement> sanitizeDetectedAgreements(List<DetectedAgreement> agreements, List<String> warnings) {
        List<DetectedAgreement> kept = new ArrayList<>();
        for (int i = 0; i < agreements.size(); i++) {
            DetectedAgreement agreement = agreements.get(i);
            if (agreement == null || isBlank(agreement.topic()) || isBlank(agreement.summary())) {
                warnings.add("detectedAgreements[" + i + "] missing required fields, skipped");
                continue;
            }
            kept.add(agreement);
        }
        return List.copyOf(kept);
    }

    private List<PersonAnalysis> sanitizePersonAnalyses(PriorOutputs outputs, List<String> warnings) {
        List<PersonAnalysis> analyses = orEmpty(outputs.get(StageIds.PERSON_ANALYSIS, PersonAnalysisOutput.class)
            .map(PersonAnalysisOutput::personAnalyses)
            .orElse(null));
        List<PersonAnalysis> kept = new ArrayList<>();
        for (int i = 0; i < analyses.size(); i++) {
            PersonAnalysis analysis = analyses.get(i);
            if (analysis == null || isBlank(analysis.personId())) {
                warnings.add("personAnalyses[" + i + "] missing personId, skipped");
                continue;
            }
            kept.add(analysis);
        }
        return List.copyOf(kept);
    }

    private List<MessageAnnotation> sanitizeAnnotations(PriorOutputs outputs, List<String> warnings) {
        List<MessageAnnotation> annotations = orEmpty(outputs.get(StageIds.MESSAGE_ANNOTATION, MessageAnnotationOutput.class)
            .map(MessageAnnotationOutput::messageAnnotations)
            .orElse(null));
        List<MessageAnnotation> kept = new ArrayList<>();
        for (int i = 0; i < annotations.size(); i++) {
            MessageAnnotation annotation = annotations.get(i);
            if (annotation == null || isBlank(annotation.messageId())) {
                warnings.add("messageAnnotations[" + i + "] missing messageId, skipped");
                continue;
            }
            kept.add(annotation.withFlags(orEmpty(annotation.flags()).stream()
                .filter(f -> f != null && f.isAttributed())
                .toList()));
        }
        return List.copyOf(kept);
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }
}
