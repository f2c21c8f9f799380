package com.casekeep.analysis.domain;

public record AgreementInput(
    String id,
    String topic,
    String summary,
    String fullText
) {
}
