package com.example.datachat.model.dto;

import java.time.Instant;
import java.util.List;

public record ChatHistoryDto(
        String id,
        String projectId,
        String title,
        Instant createdAt,
        Instant lastActivityAt,
        List<ChatMessageDto> messages
) {}
