package com.example.datachat.model.entity;

import jakarta.persistence.*;

/**
 * Fichero tabular adjunto a un mensaje. rawContent puede faltar si el contenido ya no se conserva.
 */
@Embeddable
public class FileAttachment {

    public static final int NAME_MAX_LENGTH = 255;
    public static final int MEDIA_TYPE_MAX_LENGTH = 120;

    @Column(name = "original_name", nullable = false, length = NAME_MAX_LENGTH)
    private String originalName;

    @Column(name = "media_type", length = MEDIA_TYPE_MAX_LENGTH)
    private String mediaType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Lob
    @Column(name = "raw_content")
    private byte[] rawContent;

    protected FileAttachment() {
    }

    public FileAttachment(String originalName, String mediaType, long sizeBytes, byte[] rawContent) {
        this.originalName = originalName;
        this.mediaType = mediaType;
        this.sizeBytes = sizeBytes;
        this.rawContent = rawContent;
    }

    public String getOriginalName() { return originalName; }
    public String getMediaType() { return mediaType; }
    public long getSizeBytes() { return sizeBytes; }
    public byte[] getRawContent() { return rawContent; }

    public boolean hasContent() {
        return rawContent != null && rawContent.length > 0;
    }
}
