package com.casekeep.analysis.domain;

public record IssueInput(
    String id,
    String title,
    String status,
    String priority,
    String description
) {
}
