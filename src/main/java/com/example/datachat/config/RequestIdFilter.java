package com.example.datachat.config;

import com.example.datachat.util.LogContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Abre el contexto de log de la peticion: requestId (el del cliente si es valido)
 * y chatId vacio hasta que el servicio sepa sobre que chat trabaja.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";

    // Lo que venga de fuera acaba en logs y en el errorId: nada de espacios ni saltos de linea.
    private static final Pattern VALID_INCOMING = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String requestId = resolveRequestId(request.getHeader(HEADER));
        response.setHeader(HEADER, requestId);

        try (var req = LogContext.request(requestId); var chat = LogContext.chat(null)) {
            filterChain.doFilter(request, response);
        }
    }

    static String resolveRequestId(String incoming) {
        if (incoming != null) {
            String trimmed = incoming.trim();
            if (VALID_INCOMING.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
