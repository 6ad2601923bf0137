package com.example.datachat.service;

import com.example.datachat.exception.ResourceNotFoundException;
import com.example.datachat.model.entity.Chat;
import com.example.datachat.model.entity.ChatMessage;
import com.example.datachat.model.entity.Project;
import com.example.datachat.repository.ChatMessageRepository;
import com.example.datachat.repository.ChatRepository;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Chats de un proyecto: resolver, crear y leer su historial.
 */
@Service
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final ChatRepository chatRepo;
    private final ChatMessageRepository messageRepo;

    public ChatSessionService(ChatRepository chatRepo, ChatMessageRepository messageRepo) {
        this.chatRepo = chatRepo;
        this.messageRepo = messageRepo;
    }

    /**
     * Resuelve el chat de un turno:
     * - si viene chatId -> tiene que existir y ser de este proyecto
     * - si no viene -> el chat más reciente del proyecto, o uno nuevo
     *
     * Dos primeros mensajes simultáneos sin chatId pueden crear dos chats. Se acepta:
     * no hay bloqueo por proyecto.
     */
    @Transactional
    public Chat resolve(Project project, String maybeChatId) {
        if (maybeChatId != null && !maybeChatId.isBlank()) {
            return requireChat(project.getId(), maybeChatId);
        }
        return chatRepo.findFirstByProject_IdOrderByCreatedAtDesc(project.getId())
                .orElseGet(() -> create(project));
    }

    @Transactional
    public Chat create(Project project) {
        Chat chat = new Chat();
        chat.setId(UUID.randomUUID().toString());
        chat.setProject(project);
        chat.setTitle(Chat.DEFAULT_TITLE);
        chat.setLastActivityAt(Instant.now());

        Chat saved = chatRepo.save(chat);
        log.info("chat created chatId={} projectId={}", saved.getId(), project.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Chat requireChat(String projectId, String chatId) {
        return chatRepo.findByIdAndProject_Id(chatId, projectId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.Kind.CHAT, chatId));
    }

    /**
     * Historial completo en orden de creación, con adjuntos y datasets ya cargados
     * para poder usarlo fuera de la transacción.
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> loadHistory(String chatId) {
        List<ChatMessage> history = messageRepo.findByChat_IdOrderByCreatedAtAscIdAsc(chatId);
        for (ChatMessage m : history) {
            Hibernate.initialize(m.getSelectedDatasetIds());
            Hibernate.initialize(m.getAttachedFiles());
        }
        return history;
    }

    /**
     * Marca "última actividad". Ordena el listado de chats del proyecto.
     */
    @Transactional
    public void touch(String chatId) {
        chatRepo.findById(chatId).ifPresent(c -> {
            c.setLastActivityAt(Instant.now());
            chatRepo.save(c);
        });
    }

    @Transactional
    public Chat rename(String projectId, String chatId, String title) {
        Chat chat = requireChat(projectId, chatId);
        chat.setTitle(title);
        chat.setLastActivityAt(Instant.now());
        return chatRepo.save(chat);
    }
}
