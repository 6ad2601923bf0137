package com.example.datachat.model.dto;

public record SubmitMessageResponse(
        String message,
        String chatId,
        Long messageId
) {}
