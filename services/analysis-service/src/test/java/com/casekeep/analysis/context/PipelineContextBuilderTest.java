package com.casekeep.analysis.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.casekeep.analysis.domain.AgreementInput;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.IssueInput;
import com.casekeep.analysis.domain.MessageInput;
import com.casekeep.analysis.domain.ParticipantInput;
import com.casekeep.analysis.service.AnalysisValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class PipelineContextBuilderTest {

    private final PipelineContextBuilder builder = new PipelineContextBuilder();

    @Test
    void rendersParticipantsMessagesAndDefaults() {
        AnalysisRunRequest request = new AnalysisRunRequest(
            "conv-1",
            List.of(
                new MessageInput("m1", "p1", "p2", "Can you take the kids Friday?", "2024-03-01T10:00:00Z"),
                new MessageInput("m2", "p2", "p1", "Yes, pickup at 5.", "2024-03-01T10:05:00Z")
            ),
            List.of(
                new ParticipantInput("p1", "Alex Doe", "parent", "Primary caregiver"),
                new ParticipantInput("p2", "Sam Roe", null, null)
            ),
            null,
            null,
            "p1",
            "  focus on scheduling  ",
            null,
            null
        );

        PipelineContext context = builder.build(request);

        assertThat(context.subjectId()).isEqualTo("conv-1");
        assertThat(context.messages()).hasSize(2);
        assertThat(context.idReference()).isEqualTo("- Alex Doe -> p1\n- Sam Roe -> p2");
        assertThat(context.participantSection())
            .contains("- Alex Doe (Role: parent - THIS IS THE USER) - Context: Primary caregiver")
            .contains("- Sam Roe (Role: unspecified)");
        assertThat(context.messageSection())
            .startsWith("[m1] 2024-03-01T10:00:00Z - Alex Doe -> Sam Roe:\nCan you take the kids Friday?")
            .contains("\n\n[m2] ");
        assertThat(context.agreementSection()).isEqualTo("No formal agreements on file.");
        assertThat(context.issueSection()).isEqualTo("No existing issues tracked.");
        assertThat(context.guidance()).contains("focus on scheduling");
    }

    @Test
    void truncatesAgreementTextWithoutSummary() {
        String longText = "x".repeat(250);
        AnalysisRunRequest request = new AnalysisRunRequest(
            "conv-2",
            List.of(new MessageInput("m1", "p1", null, "hello", null)),
            List.of(),
            List.of(
                new AgreementInput("a1", "Holidays", "Alternate every year", null),
                new AgreementInput("a2", "Pickups", null, longText)
            ),
            List.of(new IssueInput("i1", "Late pickups", null, null, null)),
            null,
            null,
            null,
            null
        );

        PipelineContext context = builder.build(request);

        assertThat(context.agreementSection())
            .contains("- [a1] Holidays: Alternate every year")
            .contains("- [a2] Pickups: " + "x".repeat(200) + "...");
        assertThat(context.issueSection())
            .isEqualTo("- [i1] Late pickups (open, medium priority)\n  Description: No description provided");
        assertThat(context.messageSection()).contains("Unknown -> Unknown");
        assertThat(context.guidance()).isEmpty();
    }

    @Test
    void rejectsRequestWithoutUsableMessages() {
        AnalysisRunRequest request = new AnalysisRunRequest(
            "conv-3",
            List.of(new MessageInput("m1", "p1", "p2", "   ", null)),
            null, null, null, null, null, null, null
        );

        assertThatThrownBy(() -> builder.build(request))
            .isInstanceOf(AnalysisValidationException.class)
            .hasMessage("No messages provided for analysis");
    }

    @Test
    void rejectsBlankSubject() {
        AnalysisRunRequest request = new AnalysisRunRequest(
            " ",
            List.of(new MessageInput("m1", "p1", "p2", "hi", null)),
            null, null, null, null, null, null, null
        );

        assertThatThrownBy(() -> builder.build(request))
            .isInstanceOf(AnalysisValidationException.class);
    }
}
