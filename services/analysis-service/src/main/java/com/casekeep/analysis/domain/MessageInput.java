package com.casekeep.analysis.domain;

public record MessageInput(
    String id,
    String senderId,
    String receiverId,
    String rawText,
    String sentAt
) {
}
