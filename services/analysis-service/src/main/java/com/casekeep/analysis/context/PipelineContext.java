package com.casekeep.analysis.context;

import com.casekeep.analysis.domain.AgreementInput;
import com.casekeep.analysis.domain.IssueInput;
import com.casekeep.analysis.domain.MessageInput;
import com.casekeep.analysis.domain.ParticipantInput;
import java.util.List;
import java.util.Optional;

public record PipelineContext(
    String subjectId,
    List<MessageInput> messages,
    List<ParticipantInput> participants,
    List<AgreementInput> agreementItems,
    List<IssueInput> existingIssues,
    String selfPersonId,
    String operatorGuidance,
    String idReference,
    String participantSection,
    String messageSection,
    String agreementSection,
    String issueSection
) {

    public PipelineContext {
        messages = List.copyOf(messages);
        participants = List.copyOf(participants);
        agreementItems = List.copyOf(agreementItems);
        existingIssues = List.copyOf(existingIssues);
    }

    public Optional<String> guidance() {
        return operatorGuidance == null || operatorGuidance.isBlank()
            ? Optional.empty()
            : Optional.of(operatorGuidance.trim());
    }
}
