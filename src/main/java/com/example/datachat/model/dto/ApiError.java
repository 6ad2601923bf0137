package com.example.datachat.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Forma estable de todos los errores de la API. upstreamStatus solo aparece
 * cuando el fallo viene del motor de análisis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String errorId,
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        List<String> details,
        Integer upstreamStatus
) {
}
