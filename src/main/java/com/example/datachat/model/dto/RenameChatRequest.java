package com.example.datachat.model.dto;

import jakarta.validation.constraints.NotBlank;

public class RenameChatRequest {
    private String projectId;

    private String chatId;

    // Si pasa de 120 caracteres el servicio lo recorta.
    @NotBlank
    private String title;

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getChatId() { return chatId; }
    public void setChatId(String chatId) { this.chatId = chatId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
}
