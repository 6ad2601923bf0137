package com.example.datachat.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Claves de MDC para trazar una petición y el chat sobre el que trabaja.
 * El requestId también sirve como errorId en las respuestas de error.
 */
public final class LogContext {

    public static final String REQUEST_ID = "requestId";
    public static final String CHAT_ID = "chatId";

    private LogContext() {
    }

    public static String requestId() {
        String id = MDC.get(REQUEST_ID);
        return (id == null || id.isBlank()) ? null : id;
    }

    /**
     * Devuelve el requestId actual o genera uno si la petición no pasó por el filtro.
     */
    public static String ensureRequestId() {
        String id = requestId();
        if (id == null) {
            id = UUID.randomUUID().toString();
            MDC.put(REQUEST_ID, id);
        }
        return id;
    }

    public static Scope request(String requestId) {
        return put(REQUEST_ID, requestId);
    }

    public static Scope chat(String chatId) {
        return put(CHAT_ID, chatId);
    }

    private static Scope put(String key, String value) {
        String previous = MDC.get(key);
        if (value == null || value.isBlank()) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return new Scope(key, previous);
    }

    /**
     * Restaura el valor anterior de la clave al cerrarse.
     */
    public static final class Scope implements AutoCloseable {
        private final String key;
        private final String previous;

        private Scope(String key, String previous) {
            this.key = key;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null || previous.isBlank()) {
                MDC.remove(key);
                return;
            }
            MDC.put(key, previous);
        }
    }
}
