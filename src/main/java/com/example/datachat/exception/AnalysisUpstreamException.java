package com.example.datachat.exception;

/**
 * El motor de análisis respondió con error. status es el código HTTP del motor.
 */
public class AnalysisUpstreamException extends RuntimeException {

    private final int status;
    private final String detail;

    public AnalysisUpstreamException(int status, String detail, Throwable cause) {
        super("Motor de analisis respondio " + status + ": " + detail, cause);
        this.status = status;
        this.detail = detail;
    }

    public int getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }
}
