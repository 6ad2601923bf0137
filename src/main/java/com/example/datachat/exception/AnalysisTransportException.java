package com.example.datachat.exception;

/**
 * No hubo respuesta del motor: fallo de red o timeout.
 */
public class AnalysisTransportException extends RuntimeException {

    private final boolean timeout;

    public AnalysisTransportException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
