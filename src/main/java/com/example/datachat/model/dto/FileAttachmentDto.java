package com.example.datachat.model.dto;

/**
 * Metadatos del adjunto. Los bytes nunca salen por la API.
 */
public record FileAttachmentDto(
        String originalName,
        String mediaType,
        long sizeBytes,
        boolean hasContent
) {}
