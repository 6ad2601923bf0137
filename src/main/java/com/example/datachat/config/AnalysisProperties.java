package com.example.datachat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuración del motor de análisis externo.
 */
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    /**
     * URL base del motor. Si no trae esquema se asume http://.
     */
    private String baseUrl = "http://localhost:8000";

    /**
     * Nombre de la ruta de análisis que se añade a la URL base.
     */
    private String route = "analyze";

    /**
     * Tiempo máximo esperando la respuesta. Alto porque los CSV pueden ser grandes.
     */
    private Duration timeout = Duration.ofMinutes(3);

    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Cuántos mensajes recientes viajan como memoria conversacional.
     */
    private int historyWindow = 5;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getRoute() { return route; }
    public void setRoute(String route) { this.route = route; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public int getHistoryWindow() { return historyWindow; }
    public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
}
