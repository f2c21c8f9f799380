package com.casekeep.analysis.domain;

public record ParticipantInput(
    String id,
    String fullName,
    String role,
    String roleContext
) {
}
