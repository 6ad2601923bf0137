package com.example.datachat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuración de la cola de respuestas por chat.
 */
@ConfigurationProperties(prefix = "chat.queue")
public class ChatQueueProperties {

    /**
     * Retardo en milisegundos antes de procesar cada petición de respuesta de la cola.
     */
    private long delayMs = 0;

    public long getDelayMs() {
        return delayMs;
    }

    public void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }
}
