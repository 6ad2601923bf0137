package com.example.datachat.model.dto;

public class CreateChatRequest {
    private String projectId;

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
}
