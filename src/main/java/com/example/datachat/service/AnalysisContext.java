package com.example.datachat.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contexto que viaja al motor en el campo {@code context}.
 * Se calcula en cada respuesta y no se persiste.
 */
public record AnalysisContext(
        @JsonProperty("history") List<Turn> recentTurns,
        @JsonProperty("datasets") List<DatasetRef> datasetRefs
) {

    /**
     * Marca de los ficheros subidos en el turno actual: no son datasets del registro
     * y el motor no debe intentar descargarlos.
     */
    public static final String CURRENT_UPLOAD = "Current Upload";

    public AnalysisContext {
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
        datasetRefs = datasetRefs == null ? List.of() : List.copyOf(datasetRefs);
    }

    public record Turn(String role, String content) {}

    public record DatasetRef(String name, String url) {
        public static DatasetRef currentUpload(String fileName) {
            return new DatasetRef(fileName, CURRENT_UPLOAD);
        }
    }
}
