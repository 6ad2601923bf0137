package com.example.datachat.model.dto;

/**
 * Petición de respuesta del motor. Los campos obligatorios se validan en el servicio
 * para devolver el motivo concreto (missing-project-id, missing-chat-id, empty-text).
 */
public class AiReplyRequest {
    private String projectId;
    private String chatId;
    private String content;

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getChatId() { return chatId; }
    public void setChatId(String chatId) { this.chatId = chatId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
}
