package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationMapOutput(
    String summary,
    String overallTone,
    List<String> keyTopics,
    List<String> keyAsks,
    List<String> decisionsOrCommitments
) implements StageOutput {
}
