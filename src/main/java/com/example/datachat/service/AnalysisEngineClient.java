package com.example.datachat.service;

import com.example.datachat.config.AnalysisProperties;
import com.example.datachat.exception.AnalysisTransportException;
import com.example.datachat.exception.AnalysisUpstreamException;
import com.example.datachat.model.entity.FileAttachment;
import com.example.datachat.util.AnalysisEndpoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.List;

/**
 * Cliente del motor de análisis. Una llamada multipart por respuesta y sin reintentos:
 * reintentar es decisión del cliente.
 */
@Component
public class AnalysisEngineClient {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngineClient.class);

    static final String FIELD_USER_TEXT = "user_text";
    static final String FIELD_CONTEXT = "context";
    static final String FIELD_FILES = "files";
    static final String SESSION_HEADER = "X-Session-ID";
    static final MediaType TABULAR = MediaType.parseMediaType("text/csv");

    private static final String GENERIC_UPSTREAM_MESSAGE = "Error llamando al motor de analisis";
    private static final int MAX_LOGGED_BODY = 500;

    private final RestClient http;
    private final AnalysisProperties props;
    private final ObjectMapper mapper;

    public AnalysisEngineClient(RestClient analysisRestClient, AnalysisProperties props, ObjectMapper mapper) {
        this.http = analysisRestClient;
        this.props = props;
        this.mapper = mapper;
    }

    /**
     * Envía la consulta con su contexto y los CSV del turno.
     *
     * @throws AnalysisUpstreamException  si el motor responde fuera de 2xx
     * @throws AnalysisTransportException si no hay respuesta (red, timeout)
     */
    public AnalysisResult dispatch(String userText, AnalysisContext context, List<FileAttachment> files, String chatId) {
        URI endpoint = AnalysisEndpoint.resolve(props.getBaseUrl(), props.getRoute());
        List<FileAttachment> sendable = files == null ? List.of() : files.stream()
                .filter(FileAttachment::hasContent)
                .toList();

        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part(FIELD_USER_TEXT, userText);
        form.part(FIELD_CONTEXT, toJson(context));
        for (FileAttachment f : sendable) {
            form.part(FIELD_FILES, asResource(f))
                    .filename(f.getOriginalName())
                    .contentType(TABULAR);
        }

        long start = System.nanoTime();
        log.info("analysis dispatch url={} datasets={} turns={} files={}",
                endpoint, context.datasetRefs().size(), context.recentTurns().size(), sendable.size());

        String body;
        try {
            RestClient.RequestBodySpec request = http.post()
                    .uri(endpoint)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .accept(MediaType.APPLICATION_JSON);
            if (chatId != null && !chatId.isBlank()) {
                request = request.header(SESSION_HEADER, chatId);
            }
            body = request.body(form.build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            String responseBody = e.getResponseBodyAsString();
            log.warn("analysis upstream error status={} url={} body={}",
                    e.getStatusCode().value(), endpoint, truncate(responseBody));
            throw new AnalysisUpstreamException(e.getStatusCode().value(), extractDetail(responseBody), e);
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            log.warn("analysis transport error url={} timeout={} msg={}", endpoint, timeout, e.getMessage());
            throw new AnalysisTransportException(
                    timeout ? "El motor de analisis no respondio a tiempo" : "No se pudo contactar con el motor de analisis",
                    timeout,
                    e
            );
        }

        AnalysisResult result = parseResult(body);
        log.info("analysis done ms={} hasChart={} hasError={}",
                (System.nanoTime() - start) / 1_000_000, result.chartSpec() != null, result.hasError());
        return result;
    }

    private AnalysisResult parseResult(String body) {
        if (body == null || body.isBlank()) {
            return AnalysisResult.empty();
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node instanceof ObjectNode obj) {
                return new AnalysisResult(obj);
            }
            throw new AnalysisUpstreamException(502, "El motor de analisis devolvio una respuesta que no es un objeto JSON", null);
        } catch (JsonProcessingException e) {
            log.warn("analysis response is not JSON body={}", truncate(body));
            throw new AnalysisUpstreamException(502, "El motor de analisis devolvio una respuesta que no es JSON", e);
        }
    }

    /**
     * detail (FastAPI) > error > message > texto genérico.
     */
    String extractDetail(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return GENERIC_UPSTREAM_MESSAGE;
        }
        try {
            JsonNode node = mapper.readTree(responseBody);
            for (String field : List.of("detail", "error", "message")) {
                JsonNode v = node == null ? null : node.get(field);
                if (v == null || v.isNull()) continue;
                String text = v.isValueNode() ? v.asText() : v.toString();
                if (!text.isBlank()) return text;
            }
        } catch (JsonProcessingException e) {
            log.debug("upstream error body is not JSON");
        }
        return GENERIC_UPSTREAM_MESSAGE;
    }

    private String toJson(AnalysisContext context) {
        try {
            return mapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el contexto de analisis", e);
        }
    }

    private static ByteArrayResource asResource(FileAttachment f) {
        return new ByteArrayResource(f.getRawContent()) {
            @Override
            public String getFilename() {
                return f.getOriginalName();
            }
        };
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > MAX_LOGGED_BODY ? s.substring(0, MAX_LOGGED_BODY) + "... [truncated]" : s;
    }
}
