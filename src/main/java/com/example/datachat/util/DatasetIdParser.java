package com.example.datachat.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normaliza el campo selectedDatasets del formulario.
 * Orden de intento: JSON (array de escalares o un escalar) y, si no es JSON, lista separada por comas.
 */
public final class DatasetIdParser {

    // Sin FAIL_ON_TRAILING_TOKENS, "1,2" se leería como el número 1.
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Longitud maxima de un id de dataset: la de la columna donde se guarda con el mensaje.
     */
    public static final int MAX_ID_LENGTH = 64;

    private DatasetIdParser() {
    }

    public sealed interface ParsedIds permits Ids, Invalid {
    }

    public record Ids(List<String> values) implements ParsedIds {
    }

    public record Invalid(String reason) implements ParsedIds {
    }

    public static ParsedIds parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Ids(List.of());
        }

        String text = raw.trim();
        JsonNode node;
        try {
            node = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return checkLengths(splitDelimited(text));
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new Ids(List.of());
        }

        if (node.isArray()) {
            Set<String> ids = new LinkedHashSet<>();
            for (JsonNode item : node) {
                if (item.isNull()) continue;
                if (!item.isValueNode()) {
                    return new Invalid("selectedDatasets solo admite valores simples, no objetos ni listas anidadas");
                }
                addClean(ids, item.asText());
            }
            return checkLengths(ids);
        }
        if (node.isValueNode()) {
            Set<String> ids = new LinkedHashSet<>();
            addClean(ids, node.asText());
            return checkLengths(ids);
        }
        return new Invalid("selectedDatasets debe ser una lista, no un objeto");
    }

    private static Set<String> splitDelimited(String text) {
        Set<String> ids = new LinkedHashSet<>();
        for (String token : text.split(",")) {
            addClean(ids, token);
        }
        return ids;
    }

    private static ParsedIds checkLengths(Set<String> ids) {
        for (String id : ids) {
            if (id.length() > MAX_ID_LENGTH) {
                return new Invalid("Id de dataset demasiado largo (max " + MAX_ID_LENGTH + " caracteres)");
            }
        }
        return new Ids(List.copyOf(ids));
    }

    private static void addClean(Set<String> ids, String value) {
        if (value == null) return;
        String clean = value.trim();
        if (!clean.isEmpty()) ids.add(clean);
    }
}
