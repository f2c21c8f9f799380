package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueAction(
    String action,
    String issueId,
    String title,
    String description,
    String priority,
    String status,
    List<String> linkedMessageIds,
    List<PersonContribution> personContributions,
    List<String> involvedPersonIds,
    String reasoning
) {

    public IssueAction withContributions(List<PersonContribution> contributions, List<String> involved) {
        return new IssueAction(
            action,
            issueId,
            title,
            description,
            priority,
            status,
            linkedMessageIds,
            contributions,
            involved,
            reasoning
        );
    }
}
