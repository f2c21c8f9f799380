package com.casekeep.analysis.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;

public record AnalysisRunRequest(
    @NotBlank(message = "subjectId must not be blank")
    String subjectId,

    List<MessageInput> messages,

    List<ParticipantInput> participants,

    List<AgreementInput> agreementItems,

    List<IssueInput> existingIssues,

    String selfPersonId,

    String operatorGuidance,

    String resumeFromStage,

    Map<String, JsonNode> priorOutputs
) {
}
