package com.example.datachat.repository;

import com.example.datachat.model.entity.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Log de mensajes por chat. Solo se insertan filas nuevas; nunca se editan.
 */
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {
    List<ChatMessage> findByChat_IdOrderByCreatedAtAscIdAsc(String chatId);

    long countByChat_Id(String chatId);
}
