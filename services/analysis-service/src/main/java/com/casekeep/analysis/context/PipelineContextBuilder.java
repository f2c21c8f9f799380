package com.casekeep.analysis.context;

import com.casekeep.analysis.domain.AgreementInput;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.IssueInput;
import com.casekeep.analysis.domain.MessageInput;
import com.casekeep.analysis.domain.ParticipantInput;
import com.casekeep.analysis.service.AnalysisValidationException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class PipelineContextBuilder {

    private static final int AGREEMENT_EXCERPT_LENGTH = 200;

    public PipelineContext build(AnalysisRunRequest request) {
        if (request == null || request.subjectId() == null || request.subjectId().isBlank()) {
            throw new AnalysisValidationException("subjectId must not be blank");
        }

        List<MessageInput> messages = nonNull(request.messages()).stream()
            .filter(m -> m.rawText() != null && !m.rawText().isBlank())
            .toList();
        if (messages.isEmpty()) {
            throw new AnalysisValidationException("No messages provided for analysis");
        }

        List<ParticipantInput> participants = nonNull(request.participants());
        List<AgreementInput> agreements = nonNull(request.agreementItems());
        List<IssueInput> issues = nonNull(request.existingIssues());

        return new PipelineContext(
            request.subjectId().trim(),
            messages,
            participants,
            agreements,
            issues,
            request.selfPersonId(),
            request.operatorGuidance(),
            idReference(participants),
            participantSection(participants, request.selfPersonId()),
            messageSection(messages, participants),
            agreementSection(agreements),
            issueSection(issues)
        );
    }

    private String idReference(List<ParticipantInput> participants) {
        return participants.stream()
            .map(p -> "- " + p.fullName() + " -> " + p.id())
            .collect(Collectors.joining("\n"));
    }

    private String participantSection(List<ParticipantInput> participants, String selfPersonId) {
        return participants.stream()
            .map(p -> {
                StringBuilder line = new StringBuilder("- ").append(p.fullName())
                    .append(" (Role: ").append(safe(p.role(), "unspecified"));
                if (p.id() != null && p.id().equals(selfPersonId)) {
                    line.append(" - THIS IS THE USER");
                }
                line.append(')');
                if (p.roleContext() != null && !p.roleContext().isBlank()) {
                    line.append(" - Context: ").append(p.roleContext());
                }
                return line.toString();
            })
            .collect(Collectors.joining("\n"));
    }

    private String messageSection(List<MessageInput> messages, List<ParticipantInput> participants) {
        Map<String, String> names = participants.stream()
            .filter(p -> p.id() != null)
            .collect(Collectors.toMap(ParticipantInput::id, p -> safe(p.fullName(), "Unknown"), (a, b) -> a));
        Function<String, String> nameOf = id -> id == null ? "Unknown" : names.getOrDefault(id, "Unknown");

        return messages.stream()
            .map(m -> "[" + m.id() + "] " + safe(m.sentAt(), "") + " - "
                + nameOf.apply(m.senderId()) + " -> " + nameOf.apply(m.receiverId()) + ":\n" + m.rawText())
            .collect(Collectors.joining("\n\n"));
    }

    private String agreementSection(List<AgreementInput> agreements) {
        if (agreements.isEmpty()) {
            return "No formal agreements on file.";
        }
        return agreements.stream()
            .map(a -> "- [" + a.id() + "] " + a.topic() + ": " + agreementText(a))
            .collect(Collectors.joining("\n"));
    }

    private String agreementText(AgreementInput agreement) {
        if (agreement.summary() != null && !agreement.summary().isBlank()) {
            return agreement.summary();
        }
        String full = safe(agreement.fullText(), "");
        return full.length() <= AGREEMENT_EXCERPT_LENGTH ? full : full.substring(0, AGREEMENT_EXCERPT_LENGTH) + "...";
    }

    private String issueSection(List<IssueInput> issues) {
        if (issues.isEmpty()) {
            return "No existing issues tracked.";
        }
        return issues.stream()
            .map(i -> "- [" + i.id() + "] " + i.title() + " (" + safe(i.status(), "open") + ", "
                + safe(i.priority(), "medium") + " priority)\n  Description: "
                + safe(i.description(), "No description provided"))
            .collect(Collectors.joining("\n\n"));
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private static String safe(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
