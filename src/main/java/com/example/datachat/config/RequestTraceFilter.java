package com.example.datachat.config;

import com.example.datachat.util.LogContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Una linea por peticion de chat: status, duracion, proyecto y tamano del cuerpo
 * (las subidas de CSV pueden ser grandes).
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTraceFilter.class);

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        long startNs = System.nanoTime();
        String requestId = LogContext.requestId();
        long bodyBytes = request.getContentLengthLong();

        log.debug("req id={} method={} path={} bytes={} multipart={}",
                requestId, request.getMethod(), request.getRequestURI(), bodyBytes, isMultipart(request));

        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - startNs) / 1_000_000;
            int status = response.getStatus();
            String line = "res id={} status={} ms={} {} {} project={} user={}";
            Object[] args = {
                    requestId, status, elapsedMs, request.getMethod(), resolvePattern(request),
                    resolveProject(request), resolveUser()
            };

            if (status >= 500) {
                log.error(line, args);
            } else if (status >= 400) {
                log.warn(line, args);
            } else {
                log.info(line, args);
            }
        }
    }

    private boolean isMultipart(HttpServletRequest request) {
        String type = request.getContentType();
        return type != null && type.toLowerCase(Locale.ROOT).startsWith("multipart/");
    }

    /**
     * projectId de la ruta o del formulario. En JSON va en el cuerpo y no se lee aqui.
     */
    private String resolveProject(HttpServletRequest request) {
        Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (vars instanceof Map<?, ?> map && map.get("projectId") != null) {
            return map.get("projectId").toString();
        }
        if (isMultipart(request)) {
            String fromForm = request.getParameter("projectId");
            if (fromForm != null) return fromForm;
        }
        return "-";
    }

    private String resolvePattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? request.getRequestURI() : pattern.toString();
    }

    private String resolveUser() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return "anon";
        }
        return auth.getName();
    }
}
