package com.example.datachat.controller;

import com.example.datachat.exception.AnalysisTransportException;
import com.example.datachat.exception.AnalysisUpstreamException;
import com.example.datachat.exception.ChatAccessDeniedException;
import com.example.datachat.exception.ChatValidationException;
import com.example.datachat.model.dto.ApiError;
import com.example.datachat.util.LogContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::formatFieldError)
                .toList();
        return build(HttpStatus.BAD_REQUEST, "La peticion no es valida", details, null, req, ex, false);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, "El cuerpo de la peticion no es JSON valido", List.of(), null, req, ex, false);
    }

    @ExceptionHandler(ChatValidationException.class)
    public ResponseEntity<ApiError> handleChatValidation(ChatValidationException ex, HttpServletRequest req) {
        ChatValidationException.Reason reason = ex.getReason();
        List<String> details = List.of("code: " + reason.code(), "field: " + reason.field());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), details, null, req, ex, false);
    }

    @ExceptionHandler(ChatAccessDeniedException.class)
    public ResponseEntity<ApiError> handleChatAccessDenied(ChatAccessDeniedException ex, HttpServletRequest req) {
        return build(HttpStatus.FORBIDDEN, ex.getMessage(), List.of("code: " + ex.getReason().code()), null, req, ex, false);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex, HttpServletRequest req) {
        return build(HttpStatus.FORBIDDEN, "No tienes permisos para esta operacion", List.of(), null, req, ex, false);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        HttpStatus resolved = status == null ? HttpStatus.INTERNAL_SERVER_ERROR : status;
        return build(resolved, ex.getReason(), List.of(), null, req, ex, resolved.is5xxServerError());
    }

    /**
     * El motor respondió con error: se devuelve 502 con el detalle curado y el status del motor.
     */
    @ExceptionHandler(AnalysisUpstreamException.class)
    public ResponseEntity<ApiError> handleUpstream(AnalysisUpstreamException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_GATEWAY, ex.getDetail(), List.of(), ex.getStatus(), req, ex, true);
    }

    @ExceptionHandler(AnalysisTransportException.class)
    public ResponseEntity<ApiError> handleTransport(AnalysisTransportException ex, HttpServletRequest req) {
        HttpStatus status = ex.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return build(status, ex.getMessage(), List.of(), null, req, ex, true);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handlePersistence(DataAccessException ex, HttpServletRequest req) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno guardando o leyendo datos", List.of(), null, req, ex, true);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(), null, req, ex, false);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), null, req, ex, false);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno procesando la peticion", List.of(), null, req, ex, true);
    }

    private ResponseEntity<ApiError> build(HttpStatus status,
                                           String message,
                                           List<String> details,
                                           Integer upstreamStatus,
                                           HttpServletRequest req,
                                           Exception ex,
                                           boolean logStack) {
        String errorId = LogContext.ensureRequestId();
        String path = req != null ? req.getRequestURI() : "";
        String method = req != null ? req.getMethod() : "";
        String handler = resolveHandler(req);

        if (logStack) {
            log.error("errorId={} status={} method={} path={} handler={} upstreamStatus={} msg={}",
                    errorId, status.value(), method, path, handler, upstreamStatus, message, ex);
        } else {
            log.warn("errorId={} status={} method={} path={} handler={} msg={}",
                    errorId, status.value(), method, path, handler, message);
        }

        ApiError body = new ApiError(
                errorId,
                status.value(),
                status.getReasonPhrase(),
                message,
                path,
                Instant.now(),
                details == null ? Collections.emptyList() : details,
                upstreamStatus
        );
        return ResponseEntity.status(status).body(body);
    }

    private String resolveHandler(HttpServletRequest req) {
        if (req == null) return "";
        Object handler = req.getAttribute(HandlerMapping.BEST_MATCHING_HANDLER_ATTRIBUTE);
        if (handler instanceof HandlerMethod hm) {
            return hm.getBeanType().getSimpleName() + "#" + hm.getMethod().getName();
        }
        return handler == null ? "" : handler.toString();
    }

    private String formatFieldError(FieldError err) {
        String code = err.getCode() == null ? "" : err.getCode();
        return err.getField() + ": " + err.getDefaultMessage() + (code.isEmpty() ? "" : " (" + code + ")");
    }
}
