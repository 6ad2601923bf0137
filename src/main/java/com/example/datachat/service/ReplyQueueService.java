package com.example.datachat.service;

import com.example.datachat.config.ChatQueueProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Cola por chat: las peticiones de respuesta de un mismo chat se procesan de una en una
 * y en orden de llegada, así cada turno agrega el contexto con el historial del anterior.
 * Chats distintos avanzan en paralelo. Quien llama espera a su propio turno.
 */
@Service
public class ReplyQueueService {

    private final ChatService chatService;
    private final ChatQueueProperties properties;
    private final ExecutorService executor;
    private final Map<String, ChatQueue> chatQueues = new ConcurrentHashMap<>();

    public ReplyQueueService(ChatService chatService, ChatQueueProperties properties) {
        this.chatService = chatService;
        this.properties = properties;
        this.executor = Executors.newCachedThreadPool(new CustomizableThreadFactory("reply-queue-"));
    }

    /**
     * Encola la petición y devuelve el resultado cuando el turno termina.
     * Los errores del turno se relanzan tal cual para que el handler global los traduzca.
     */
    public AnalysisResult replyAndWait(String username, String projectId, String chatId, String text) {
        if (chatId == null || chatId.isBlank()) {
            // Sin chat no hay nada que serializar: el servicio devuelve el error de validación.
            return chatService.requestReply(username, projectId, chatId, text);
        }
        try {
            return enqueueReply(username, projectId, chatId, text).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("La cola de respuestas fue interrumpida.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Error procesando la respuesta en la cola.", cause);
        }
    }

    /**
     * Encola la petición y devuelve un future para esperar el resultado.
     */
    public CompletableFuture<AnalysisResult> enqueueReply(String username, String projectId, String chatId, String text) {
        QueuedReply queued = new QueuedReply(username, projectId, chatId, text, MDC.getCopyOfContextMap());

        // Encolar dentro de compute: la limpieza de colas vacias usa la misma clave,
        // asi nunca se encola en una cola que ya salio del mapa.
        ChatQueue queue = chatQueues.compute(chatId, (key, existing) -> {
            ChatQueue q = existing == null ? new ChatQueue() : existing;
            q.enqueue(queued);
            return q;
        });
        startProcessingIfNeeded(chatId, queue);

        return queued.response();
    }

    private void startProcessingIfNeeded(String chatId, ChatQueue queue) {
        if (!queue.markProcessing()) {
            return;
        }

        executor.execute(() -> processQueue(chatId, queue));
    }

    private void processQueue(String chatId, ChatQueue queue) {
        try {
            while (true) {
                QueuedReply next = queue.poll();
                if (next == null) {
                    // Si entró algo justo después del poll no soltamos el flag.
                    if (queue.stopProcessingIfIdle()) {
                        cleanupIfIdle(chatId, queue);
                        return;
                    }
                    continue;
                }

                applyDelay();
                runWithCallerMdc(next);
            }
        } finally {
            cleanupIfIdle(chatId, queue);
        }
    }

    private void runWithCallerMdc(QueuedReply next) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (next.mdc() != null) {
            MDC.setContextMap(next.mdc());
        }
        try {
            AnalysisResult result = chatService.requestReply(
                    next.username(),
                    next.projectId(),
                    next.chatId(),
                    next.text()
            );
            next.response().complete(result);
        } catch (Exception ex) {
            next.response().completeExceptionally(ex);
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }

    private void applyDelay() {
        long delay = properties.getDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void cleanupIfIdle(String chatId, ChatQueue queue) {
        chatQueues.computeIfPresent(chatId, (key, current) -> current == queue && current.isIdle() ? null : current);
    }

    int activeQueues() {
        return chatQueues.size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Cola interna de un chat (FIFO).
     */
    private static final class ChatQueue {
        private final Deque<QueuedReply> queue = new ArrayDeque<>();
        private boolean processing;

        synchronized void enqueue(QueuedReply reply) {
            queue.addLast(reply);
        }

        synchronized QueuedReply poll() {
            return queue.pollFirst();
        }

        synchronized boolean markProcessing() {
            if (processing) {
                return false;
            }
            processing = true;
            return true;
        }

        /**
         * Detiene el procesamiento sólo si la cola está vacía.
         */
        synchronized boolean stopProcessingIfIdle() {
            if (!queue.isEmpty()) {
                return false;
            }
            processing = false;
            return true;
        }

        synchronized boolean isIdle() {
            return !processing && queue.isEmpty();
        }
    }

    private record QueuedReply(
            String username,
            String projectId,
            String chatId,
            String text,
            Map<String, String> mdc,
            CompletableFuture<AnalysisResult> response
    ) {
        QueuedReply(String username, String projectId, String chatId, String text, Map<String, String> mdc) {
            this(username, projectId, chatId, text, mdc, new CompletableFuture<>());
        }
    }
}
