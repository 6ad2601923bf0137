package com.example.datachat.model.dto;

import java.time.Instant;
import java.util.List;

public record ChatMessageDto(
        Long id,
        String sender,
        String content,
        List<String> selectedDatasetIds,
        List<FileAttachmentDto> attachedFiles,
        Instant createdAt
) {}
