package com.example.datachat.util;

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Construye la URL final del motor a partir de la URL base configurada.
 */
public final class AnalysisEndpoint {

    private AnalysisEndpoint() {
    }

    /**
     * - Sin esquema se asume http://
     * - Se quitan las barras finales del path
     * - Se añade la ruta salvo que el path ya termine en ella
     */
    public static URI resolve(String baseUrl, String route) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("No hay URL del motor de analisis configurada (analysis.base-url)");
        }
        String cleanRoute = trimSlashes(route == null ? "" : route.trim());

        String raw = baseUrl.trim();
        if (!raw.contains("://")) {
            raw = "http://" + raw;
        }

        UriComponents base;
        try {
            base = UriComponentsBuilder.fromHttpUrl(raw).build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("URL del motor de analisis no valida: " + baseUrl, e);
        }

        String path = base.getPath() == null ? "" : base.getPath().replaceAll("/+$", "");
        if (!cleanRoute.isEmpty() && !endsWithSegment(path, cleanRoute)) {
            path = path + "/" + cleanRoute;
        }

        return UriComponentsBuilder.newInstance()
                .uriComponents(base)
                .replacePath(path.isEmpty() ? "/" : path)
                .build()
                .toUri();
    }

    private static boolean endsWithSegment(String path, String route) {
        return path.equals("/" + route) || path.endsWith("/" + route);
    }

    private static String trimSlashes(String s) {
        return s.replaceAll("^/+", "").replaceAll("/+$", "");
    }
}
