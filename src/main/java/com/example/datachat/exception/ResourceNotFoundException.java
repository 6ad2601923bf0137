package com.example.datachat.exception;

import java.util.NoSuchElementException;

public class ResourceNotFoundException extends NoSuchElementException {

    public enum Kind { PROJECT, TEAM, CHAT }

    private final Kind kind;

    public ResourceNotFoundException(Kind kind, String id) {
        super(describe(kind) + " no encontrado: " + id);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static String describe(Kind kind) {
        return switch (kind) {
            case PROJECT -> "Proyecto";
            case TEAM -> "Equipo del proyecto";
            case CHAT -> "Chat";
        };
    }
}
