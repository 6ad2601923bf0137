package com.example.datachat.exception;

import org.springframework.security.access.AccessDeniedException;

/**
 * El llamante no pertenece al equipo dueño del proyecto.
 */
public class ChatAccessDeniedException extends AccessDeniedException {

    public enum Reason {
        WRONG_ORGANIZATION("wrong-organization", "No perteneces a esta organizacion"),
        NOT_A_MEMBER("not-a-member", "No eres miembro de este equipo");

        private final String code;
        private final String message;

        Reason(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String code() { return code; }
        public String message() { return message; }
    }

    private final Reason reason;

    public ChatAccessDeniedException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
