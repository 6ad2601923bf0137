package com.example.datachat.service;

import com.example.datachat.config.AnalysisProperties;
import com.example.datachat.model.entity.ChatMessage;
import com.example.datachat.model.entity.FileAttachment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconstruye el contexto de análisis a partir del historial completo de un chat.
 *
 * Los datasets se acumulan sobre TODO el historial: un dataset elegido en el turno 1
 * sigue en juego en el turno 10 aunque no se vuelva a seleccionar. La memoria
 * conversacional, en cambio, es solo una ventana de los últimos mensajes.
 * No guarda estado: se recalcula en cada respuesta.
 */
@Component
public class ChatContextAggregator {

    private final DatasetRegistry datasetRegistry;
    private final AnalysisProperties props;

    public ChatContextAggregator(DatasetRegistry datasetRegistry, AnalysisProperties props) {
        this.datasetRegistry = datasetRegistry;
        this.props = props;
    }

    /**
     * @param projectId        proyecto dueño del chat; filtra los datasets resolubles
     * @param history          mensajes del chat en orden de creación
     * @param currentTurnFiles ficheros del turno actual; solo cuentan los que conservan contenido
     */
    public AnalysisContext aggregate(String projectId,
                                     List<ChatMessage> history,
                                     List<FileAttachment> currentTurnFiles) {
        List<ChatMessage> messages = history == null ? List.of() : history;

        List<String> datasetIds = accumulateDatasetIds(messages);
        List<AnalysisContext.Turn> turns = recentTurns(messages, props.getHistoryWindow());

        List<AnalysisContext.DatasetRef> refs = new ArrayList<>(datasetRegistry.resolve(projectId, datasetIds));
        for (FileAttachment f : sendableFiles(currentTurnFiles)) {
            refs.add(AnalysisContext.DatasetRef.currentUpload(f.getOriginalName()));
        }

        return new AnalysisContext(turns, refs);
    }

    /**
     * Unión sin duplicados de todos los datasets seleccionados, en orden de primera aparición.
     */
    public static List<String> accumulateDatasetIds(List<ChatMessage> history) {
        Set<String> ids = new LinkedHashSet<>();
        for (ChatMessage m : history) {
            for (String id : m.getSelectedDatasetIds()) {
                if (id == null) continue;
                String key = id.trim();
                if (!key.isEmpty()) ids.add(key);
            }
        }
        return List.copyOf(ids);
    }

    /**
     * Últimos {@code window} mensajes. El texto va tal cual, incluido el JSON
     * de respuestas anteriores del asistente.
     */
    public static List<AnalysisContext.Turn> recentTurns(List<ChatMessage> history, int window) {
        if (window <= 0 || history.isEmpty()) {
            return List.of();
        }
        return history.subList(Math.max(0, history.size() - window), history.size()).stream()
                .map(m -> new AnalysisContext.Turn(
                        m.getSender() == ChatMessage.Sender.USER ? "user" : "assistant",
                        m.getTextContent() == null ? "" : m.getTextContent()
                ))
                .toList();
    }

    /**
     * Adjuntos del último mensaje de usuario que aún conservan contenido.
     * Los de turnos anteriores no se reenvían.
     */
    public static List<FileAttachment> latestUserFiles(List<ChatMessage> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ChatMessage m = history.get(i);
            if (m.getSender() == ChatMessage.Sender.USER) {
                return sendableFiles(m.getAttachedFiles());
            }
        }
        return List.of();
    }

    static List<FileAttachment> sendableFiles(List<FileAttachment> files) {
        if (files == null || files.isEmpty()) {
            return List.of();
        }
        return files.stream().filter(FileAttachment::hasContent).toList();
    }
}
