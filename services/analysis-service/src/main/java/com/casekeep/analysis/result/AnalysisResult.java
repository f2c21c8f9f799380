package com.casekeep.analysis.result;

import com.casekeep.analysis.stage.output.AgreementViolation;
import com.casekeep.analysis.stage.output.Claim;
import com.casekeep.analysis.stage.output.ConversationState;
import com.casekeep.analysis.stage.output.DetectedAgreement;
import com.casekeep.analysis.stage.output.IssueAction;
import com.casekeep.analysis.stage.output.MessageAnnotation;
import com.casekeep.analysis.stage.output.PersonAnalysis;
import com.casekeep.analysis.stage.output.SynthesisOutput;
import java.util.List;

public record AnalysisResult(
    ConversationSummary conversationAnalysis,
    List<Claim> claimsLedger,
    ConversationState conversationState,
    List<SynthesisOutput.AlternativeInterpretation> alternativeInterpretations,
    List<SynthesisOutput.MissingContext> missingContext,
    List<String> topicCategorySlugs,
    List<IssueAction> issueActions,
    List<AgreementViolation> agreementViolations,
    List<DetectedAgreement> detectedAgreements,
    List<PersonAnalysis> personAnalyses,
    List<MessageAnnotation> messageAnnotations
) {

    public record ConversationSummary(String summary, String overallTone, List<String> keyTopics) {
    }
}
