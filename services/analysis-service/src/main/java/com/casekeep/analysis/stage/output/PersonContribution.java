package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonContribution(
    String personId,
    String contributionType,
    String contributionDescription,
    String contributionValence
) {

    @JsonIgnore
    public boolean isComplete() {
        return notBlank(personId) && notBlank(contributionType) && notBlank(contributionDescription);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
