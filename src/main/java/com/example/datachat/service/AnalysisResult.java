package com.example.datachat.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Respuesta del motor tal cual llega. Solo se reconocen insights, chartjs y error;
 * el resto de campos se conserva sin tocar para poder reproducir la respuesta.
 */
public record AnalysisResult(ObjectNode payload) {

    public AnalysisResult {
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
    }

    public static AnalysisResult empty() {
        return new AnalysisResult(null);
    }

    public String insights() {
        return text("insights");
    }

    /**
     * Configuración de gráfico. El motor la manda como chartjs; chartSpec se acepta como alias.
     */
    public JsonNode chartSpec() {
        JsonNode chart = payload.get("chartjs");
        if (chart == null || chart.isNull()) {
            chart = payload.get("chartSpec");
        }
        return (chart == null || chart.isNull()) ? null : chart;
    }

    public String error() {
        return text("error");
    }

    public boolean hasError() {
        String e = error();
        return e != null && !e.isBlank();
    }

    /**
     * JSON compacto que se guarda como contenido del mensaje del asistente.
     */
    public String toJson() {
        return payload.toString();
    }

    private String text(String field) {
        JsonNode node = payload.get(field);
        return (node == null || node.isNull()) ? null : node.asText();
    }
}
