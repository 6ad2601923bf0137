package com.example.datachat.service;

import com.example.datachat.model.entity.FileAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Se queda solo con los ficheros de texto delimitado (CSV/TSV). El resto se descarta
 * antes de crear el mensaje.
 */
@Component
public class TabularUploadFilter {

    private static final Logger log = LoggerFactory.getLogger(TabularUploadFilter.class);

    private static final Set<String> EXTENSIONS = Set.of(".csv", ".tsv");
    private static final Set<String> MEDIA_TYPES = Set.of("text/csv", "text/tab-separated-values");

    public List<FileAttachment> retain(List<MultipartFile> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            return List.of();
        }

        List<FileAttachment> out = new ArrayList<>();
        for (MultipartFile f : uploads) {
            if (f == null || f.isEmpty()) continue;
            String name = f.getOriginalFilename() == null ? "" : f.getOriginalFilename().trim();
            if (!isTabular(name, f.getContentType())) {
                log.debug("upload descartado name={} contentType={}", name, f.getContentType());
                continue;
            }
            out.add(new FileAttachment(
                    name.isEmpty() ? "dataset.csv" : fitName(name),
                    fitMediaType(f.getContentType()),
                    f.getSize(),
                    readBytes(f, name)
            ));
        }
        return out;
    }

    static boolean isTabular(String fileName, String contentType) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (lower.endsWith(ext)) return true;
        }
        if (contentType == null) return false;
        String type = contentType.toLowerCase(Locale.ROOT);
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) type = type.substring(0, semicolon);
        return MEDIA_TYPES.contains(type.trim());
    }

    /**
     * Recorta nombres que no caben en la columna. La extension se conserva:
     * el motor y el historial la usan para saber el formato.
     */
    static String fitName(String name) {
        if (name.length() <= FileAttachment.NAME_MAX_LENGTH) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String ext = (dot > 0 && name.length() - dot <= 10) ? name.substring(dot) : "";
        return name.substring(0, FileAttachment.NAME_MAX_LENGTH - ext.length()) + ext;
    }

    private static String fitMediaType(String contentType) {
        if (contentType == null || contentType.length() <= FileAttachment.MEDIA_TYPE_MAX_LENGTH) {
            return contentType;
        }
        // Los parametros (charset, boundary...) sobran: basta con el tipo.
        int semicolon = contentType.indexOf(';');
        String type = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
        return type.length() <= FileAttachment.MEDIA_TYPE_MAX_LENGTH
                ? type
                : type.substring(0, FileAttachment.MEDIA_TYPE_MAX_LENGTH);
    }

    private byte[] readBytes(MultipartFile f, String name) {
        try {
            return f.getBytes();
        } catch (IOException e) {
            throw new IllegalStateException("No se pudo leer el fichero subido: " + name, e);
        }
    }
}
