package com.casekeep.analysis.stage;

import com.casekeep.analysis.context.PipelineContext;
import com.casekeep.analysis.stage.output.AgreementChecksOutput;
import com.casekeep.analysis.stage.output.Claim;
import com.casekeep.analysis.stage.output.ClaimsVerificationOutput;
import com.casekeep.analysis.stage.output.ConversationMapOutput;
import com.casekeep.analysis.stage.output.IssueAction;
import com.casekeep.analysis.stage.output.IssueActionsOutput;
import com.casekeep.analysis.stage.output.PersonAnalysis;
import com.casekeep.analysis.stage.output.PersonAnalysisOutput;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

final class StagePrompts {

    private static final String BASE_SYSTEM = """
        You are a case documentation analyst reviewing written communication between people in \
        conflict. Produce objective, evidence-cited findings usable as a professional record. Do not \
        give therapy, legal advice or diagnoses.

        Every material conclusion names who acted (personId), what they did, the evidence (quote or \
        message id), a verification status where relevant (supported, contradicted, ambiguous) and \
        its effect on cooperation.

        Always respond with a single valid JSON object.""";

    private static final String NOT_AVAILABLE = "Not available";

    private StagePrompts() {
    }

    static StagePrompt conversationMap(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("Map the conversation: main topics, key asks, decisions made and overall tone."),
            baseContext(context) + """

                Summarise this conversation.

                Return JSON:
                {
                  "summary": "2-3 paragraph case synopsis with attribution",
                  "overallTone": "cooperative" | "neutral" | "tense" | "contentious" | "hostile",
                  "keyTopics": ["main topics"],
                  "keyAsks": ["key questions or requests and who made them"],
                  "decisionsOrCommitments": ["decisions or commitments made"]
                }""");
    }

    static StagePrompt claimsVerification(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("Build a claims ledger verifying the most consequential claims made in the conversation."),
            baseContext(context) + """

                Return JSON:
                {
                  "claimsLedger": [
                    {
                      "claimText": "the claim",
                      "speakerPersonId": "personId of the speaker",
                      "category": "professional_guidance" | "agreement" | "factual" | "accusation" | "commitment" | "process",
                      "evidence": "quote or message reference",
                      "verificationStatus": "supported" | "contradicted" | "ambiguous",
                      "notes": "why this status"
                    }
                  ]
                }""");
    }

    static StagePrompt issueLinking(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("Evaluate every existing issue for relevance to this conversation and produce update actions."),
            baseContext(context) + "\n### Existing Issues:\n" + context.issueSection() + """


                An issue is relevant if the conversation discusses its topic, adds evidence, shows \
                related behaviour or references connected decisions.

                Return JSON:
                {
                  "issueActions": [
                    {
                      "action": "update",
                      "issueId": "existing issue id",
                      "title": "issue title",
                      "description": "updated description",
                      "priority": "low" | "medium" | "high",
                      "status": "open" | "monitoring",
                      "linkedMessageIds": ["message ids"],
                      "personContributions": [%s],
                      "reasoning": "why this conversation relates to the issue"
                    }
                  ]
                }""".formatted(CONTRIBUTION_SHAPE));
    }

    static StagePrompt issueDetection(PipelineContext context, PriorOutputs prior) {
        String linkedIds = prior.get(StageIds.ISSUE_LINKING, IssueActionsOutput.class)
            .map(IssueActionsOutput::issueActions)
            .orElse(List.of())
            .stream()
            .filter(Objects::nonNull)
            .map(IssueAction::issueId)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(", "));

        return new StagePrompt(
            system("Identify NEW issues worth tracking that are distinct from the already linked ones."),
            baseContext(context)
                + "\n### Already linked issue ids (do not duplicate):\n" + (linkedIds.isEmpty() ? "None" : linkedIds)
                + "\n\n### Conversation Summary:\n" + summaryOf(prior) + """


                Focus on resolution-blocking behaviour, safety concerns and agreement or guidance violations.

                Return JSON:
                {
                  "issueActions": [
                    {
                      "action": "create",
                      "title": "specific issue title",
                      "description": "description grounded in evidence",
                      "priority": "low" | "medium" | "high",
                      "status": "open",
                      "linkedMessageIds": ["message ids"],
                      "personContributions": [%s],
                      "reasoning": "why this issue matters"
                    }
                  ]
                }""".formatted(CONTRIBUTION_SHAPE));
    }

    static StagePrompt agreementChecks(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("Check for violations of active agreements and detect new mutual agreements."),
            baseContext(context) + "\n### Active Agreements:\n" + context.agreementSection() + """


                A new agreement needs clear mutual consent, not just a proposal.

                Return JSON:
                {
                  "agreementViolations": [
                    {
                      "agreementItemId": "id of the violated agreement",
                      "violationType": "direct" | "potential" | "pattern",
                      "description": "what was violated and how",
                      "messageIds": ["message ids"],
                      "severity": "minor" | "moderate" | "severe"
                    }
                  ],
                  "detectedAgreements": [
                    {
                      "topic": "agreement category",
                      "summary": "brief description",
                      "fullText": "quotes showing mutual consent",
                      "messageIds": ["message ids"],
                      "isTemporary": true | false,
                      "conditionText": "conditions or null",
                      "potentialOverrideTopics": ["existing topics this may modify"],
                      "confidence": "high" | "medium" | "low",
                      "reasoning": "why this counts as an agreement"
                    }
                  ]
                }""");
    }

    static StagePrompt personAnalysis(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("Profile each participant's observable communication behaviour. No diagnoses."),
            baseContext(context)
                + "\n### Conversation Summary:\n" + summaryOf(prior)
                + "\n\n### Claims Ledger:\n" + claimsOf(prior) + """


                Return JSON:
                {
                  "personAnalyses": [
                    {
                      "personId": "participant id",
                      "behavioralAssessment": {
                        "summary": "observed interaction patterns with evidence",
                        "cooperationLevel": "high" | "moderate" | "low" | "obstructive",
                        "flexibilityLevel": "high" | "moderate" | "low" | "rigid",
                        "responsivenessLevel": "high" | "moderate" | "low" | "avoidant",
                        "accountabilityLevel": "high" | "moderate" | "low" | "deflecting",
                        "boundaryRespect": "appropriate" | "moderate" | "poor"
                      },
                      "notablePatterns": { "positive": ["..."], "concerning": ["..."] },
                      "interactionRecommendations": ["practical strategies"],
                      "concerns": [
                        { "type": "concern type", "description": "what happened", "evidence": ["quotes"], "severity": "low" | "medium" | "high" }
                      ]
                    }
                  ]
                }""");
    }

    static StagePrompt messageAnnotation(PipelineContext context, PriorOutputs prior) {
        return new StagePrompt(
            system("""
                Flag individual messages showing noteworthy behaviour. Every flag names the person \
                it is attributed to and quotes evidence. Use the most precise flag type, for example \
                agreement_violation, safety_concern, communication_stonewalling, deflection_tactic, \
                accountability_avoidance, boundary_violation, positive_cooperation, repair_attempt."""),
            baseContext(context) + "\n### Claims Ledger:\n" + claimsOf(prior) + """


                Return JSON:
                {
                  "messageAnnotations": [
                    {
                      "messageId": "message id",
                      "flags": [
                        {
                          "type": "flag type",
                          "description": "what happened",
                          "attributedToPersonId": "person id",
                          "severity": "low" | "medium" | "high",
                          "evidence": "quote or reference",
                          "impact": "effect on resolution"
                        }
                      ]
                    }
                  ]
                }""");
    }

    static StagePrompt synthesis(PipelineContext context, PriorOutputs prior) {
        int issueCount = issueCount(prior, StageIds.ISSUE_LINKING) + issueCount(prior, StageIds.ISSUE_DETECTION);
        int violationCount = prior.get(StageIds.AGREEMENT_CHECKS, AgreementChecksOutput.class)
            .map(AgreementChecksOutput::agreementViolations)
            .map(List::size)
            .orElse(0);
        String highConcerns = prior.get(StageIds.PERSON_ANALYSIS, PersonAnalysisOutput.class)
            .map(PersonAnalysisOutput::personAnalyses)
            .orElse(List.of())
            .stream()
            .filter(p -> p != null && p.concerns() != null)
            .flatMap(p -> p.concerns().stream())
            .filter(c -> c != null && "high".equalsIgnoreCase(c.severity()))
            .map(PersonAnalysis.Concern::description)
            .collect(Collectors.joining("; "));

        StringBuilder user = new StringBuilder(baseContext(context))
            .append("\n### Analysis So Far:\n")
            .append("- Summary: ").append(summaryOf(prior)).append('\n')
            .append("- Issues found: ").append(issueCount).append('\n')
            .append("- Violations: ").append(violationCount).append('\n')
            .append("- High severity concerns: ").append(highConcerns.isEmpty() ? "None" : highConcerns).append('\n');
        context.guidance().ifPresent(g -> user.append("\n### Operator-Flagged Areas:\n").append(g).append('\n'));
        user.append("""

            Determine whether the conversation is open or resolved and who should respond next, offer \
            the strongest alternative interpretation of each negative finding, list missing context \
            that could change the conclusions, and choose 1-5 topic categories.

            Return JSON:
            {
              "conversationState": {
                "status": "open" | "resolved",
                "pendingResponderName": "name or null",
                "reasoning": "brief explanation",
                "pendingActionSummary": "expected response or action"
              },
              "alternativeInterpretations": [
                { "findingDescription": "finding", "alternativeExplanation": "plausible alternative" }
              ],
              "missingContext": [
                { "description": "missing information", "howItCouldChangeConclusions": "effect" }
              ],
              "topicCategorySlugs": ["decision_making" | "parenting_time" | "school" | "communication" | "financial" | "medical" | "other"]
            }""");

        return new StagePrompt(
            system("Synthesise the analysis into a conversation state, alternative interpretations and missing context."),
            user.toString());
    }

    private static final String CONTRIBUTION_SHAPE = """
        {
                          "personId": "person id",
                          "contributionType": "primary_contributor" | "affected_party" | "secondary_contributor" | "resolver" | "enabler" | "involved",
                          "contributionDescription": "2-3 sentences with evidence",
                          "contributionValence": "positive" | "negative" | "neutral" | "mixed"
                        }""";

    private static String system(String task) {
        return BASE_SYSTEM + "\n\n" + task;
    }

    private static String baseContext(PipelineContext context) {
        return "### Person ID Reference (for personId fields only):\n" + context.idReference()
            + "\n\n### Participants:\n" + context.participantSection()
            + "\n\n### Messages:\n" + context.messageSection() + "\n";
    }

    private static String summaryOf(PriorOutputs prior) {
        return prior.get(StageIds.CONVERSATION_MAP, ConversationMapOutput.class)
            .map(ConversationMapOutput::summary)
            .filter(s -> !s.isBlank())
            .orElse(NOT_AVAILABLE);
    }

    private static String claimsOf(PriorOutputs prior) {
        List<Claim> claims = prior.get(StageIds.CLAIMS_VERIFICATION, ClaimsVerificationOutput.class)
            .map(ClaimsVerificationOutput::claimsLedger)
            .orElse(List.of());
        if (claims.isEmpty()) {
            return "No claims recorded.";
        }
        return claims.stream()
            .filter(Objects::nonNull)
            .map(c -> "- [" + c.verificationStatus() + "] " + c.speakerPersonId() + ": " + c.claimText()
                + (c.notes() == null ? "" : " (" + c.notes() + ")"))
            .collect(Collectors.joining("\n"));
    }

    private static int issueCount(PriorOutputs prior, String stageId) {
        return prior.get(stageId, IssueActionsOutput.class)
            .map(IssueActionsOutput::issueActions)
            .map(List::size)
            .orElse(0);
    }
}
