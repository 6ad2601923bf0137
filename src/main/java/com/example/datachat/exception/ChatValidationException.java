package com.example.datachat.exception;

/**
 * Petición incompleta. Cada motivo indica el campo que el cliente debe rellenar.
 */
public class ChatValidationException extends IllegalArgumentException {

    public enum Reason {
        MISSING_PROJECT_ID("missing-project-id", "projectId",
                "projectId es obligatorio"),
        MISSING_CHAT_ID("missing-chat-id", "chatId",
                "chatId es obligatorio"),
        EMPTY_MESSAGE("empty-message", "content",
                "Hace falta al menos uno de: content, selectedDatasets o un fichero CSV"),
        EMPTY_TEXT("empty-text", "content",
                "content es obligatorio para pedir una respuesta"),
        EMPTY_TITLE("empty-title", "title",
                "El titulo no puede estar vacio"),
        INVALID_DATASET_IDS("invalid-dataset-ids", "selectedDatasets",
                "selectedDatasets no tiene un formato valido");

        private final String code;
        private final String field;
        private final String message;

        Reason(String code, String field, String message) {
            this.code = code;
            this.field = field;
            this.message = message;
        }

        public String code() { return code; }
        public String field() { return field; }
        public String message() { return message; }
    }

    private final Reason reason;

    public ChatValidationException(Reason reason) {
        this(reason, reason.message());
    }

    public ChatValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
