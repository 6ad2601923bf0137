package com.example.datachat.model.dto;

import java.time.Instant;

public record ChatSummaryDto(
        String id,
        String title,
        Instant createdAt,
        Instant lastActivityAt,
        long messageCount,
        Instant lastMessageAt
) {}
