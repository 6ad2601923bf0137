package com.example.datachat.service;

import com.example.datachat.exception.ChatValidationException;
import com.example.datachat.model.dto.*;
import com.example.datachat.model.entity.*;
import com.example.datachat.repository.AppUserRepository;
import com.example.datachat.repository.ChatMessageRepository;
import com.example.datachat.repository.ChatRepository;
import com.example.datachat.security.CallerIdentity;
import com.example.datachat.util.DatasetIdParser;
import com.example.datachat.util.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private static final int TITLE_MAX_LENGTH = 120;

    private final AppUserRepository userRepo;
    private final ProjectAccessGuard accessGuard;
    private final ChatSessionService sessions;
    private final ChatRepository chatRepo;
    private final ChatMessageRepository messageRepo;
    private final ChatContextAggregator contextAggregator;
    private final AnalysisEngineClient engine;
    private final TabularUploadFilter uploadFilter;

    public ChatService(
            AppUserRepository userRepo,
            ProjectAccessGuard accessGuard,
            ChatSessionService sessions,
            ChatRepository chatRepo,
            ChatMessageRepository messageRepo,
            ChatContextAggregator contextAggregator,
            AnalysisEngineClient engine,
            TabularUploadFilter uploadFilter
    ) {
        this.userRepo = userRepo;
        this.accessGuard = accessGuard;
        this.sessions = sessions;
        this.chatRepo = chatRepo;
        this.messageRepo = messageRepo;
        this.contextAggregator = contextAggregator;
        this.engine = engine;
        this.uploadFilter = uploadFilter;
    }

    // =========================================================================
    // TURNO: MENSAJE DEL USUARIO
    // =========================================================================

    /**
     * 1) validar projectId y normalizar selectedDatasets
     * 2) quedarse solo con los CSV/TSV
     * 3) autorizar contra el equipo del proyecto
     * 4) exigir texto, fichero o dataset
     * 5) resolver chat (el indicado, el último del proyecto o uno nuevo)
     * 6) guardar el mensaje del usuario
     *
     * No llama al motor: la respuesta se pide aparte con {@link #requestReply}.
     */
    @Transactional
    public SubmitMessageResponse submitUserMessage(String username,
                                                   String projectId,
                                                   String maybeChatId,
                                                   String text,
                                                   List<MultipartFile> files,
                                                   String selectedDatasets) {
        requireProjectId(projectId);
        List<String> datasetIds = parseDatasetIds(selectedDatasets);
        List<FileAttachment> retained = uploadFilter.retain(files);

        CallerIdentity caller = requireCaller(username);
        Project project = accessGuard.requireAccess(caller, projectId);

        String cleanText = trimToNull(text);
        if (cleanText == null && retained.isEmpty() && datasetIds.isEmpty()) {
            throw new ChatValidationException(ChatValidationException.Reason.EMPTY_MESSAGE);
        }

        Chat chat = sessions.resolve(project, maybeChatId);
        ChatMessage saved = messageRepo.save(ChatMessage.fromUser(chat, cleanText, datasetIds, retained));
        sessions.touch(chat.getId());

        try (var ignored = LogContext.chat(chat.getId())) {
            log.info("user message saved messageId={} projectId={} datasets={} files={} hasText={}",
                    saved.getId(), projectId, datasetIds.size(), retained.size(), cleanText != null);
        }
        return new SubmitMessageResponse("User message saved.", chat.getId(), saved.getId());
    }

    // =========================================================================
    // TURNO: RESPUESTA DEL MOTOR
    // =========================================================================

    /**
     * 1) validar projectId, chatId y texto
     * 2) autorizar
     * 3) cargar historial completo del chat
     * 4) agregar contexto (datasets de todo el historial + ventana reciente)
     * 5) una llamada al motor con los CSV del último mensaje del usuario
     * 6) guardar la respuesta cruda como mensaje del asistente
     *
     * Si el motor falla no se guarda nada: el mensaje del usuario ya guardado se queda
     * sin respuesta. No se hace rollback del turno.
     */
    public AnalysisResult requestReply(String username, String projectId, String chatId, String text) {
        requireProjectId(projectId);
        if (chatId == null || chatId.isBlank()) {
            throw new ChatValidationException(ChatValidationException.Reason.MISSING_CHAT_ID);
        }
        String cleanText = trimToNull(text);
        if (cleanText == null) {
            throw new ChatValidationException(ChatValidationException.Reason.EMPTY_TEXT);
        }

        CallerIdentity caller = requireCaller(username);
        accessGuard.requireAccess(caller, projectId);
        Chat chat = sessions.requireChat(projectId, chatId);

        try (var ignored = LogContext.chat(chat.getId())) {
            List<ChatMessage> history = sessions.loadHistory(chat.getId());
            List<FileAttachment> files = ChatContextAggregator.latestUserFiles(history);
            AnalysisContext context = contextAggregator.aggregate(projectId, history, files);

            AnalysisResult result = engine.dispatch(cleanText, context, files, chat.getId());

            ChatMessage reply = messageRepo.save(ChatMessage.fromAssistant(chat, result.toJson()));
            sessions.touch(chat.getId());
            log.info("assistant reply saved messageId={} historySize={}", reply.getId(), history.size());
            return result;
        }
    }

    // =========================================================================
    // CHATS (CREAR / RENOMBRAR / HISTORIAL / LISTAR)
    // =========================================================================

    @Transactional
    public ChatSummaryDto createChat(String username, String projectId) {
        requireProjectId(projectId);
        Project project = accessGuard.requireAccess(requireCaller(username), projectId);
        return toSummary(sessions.create(project), 0, null);
    }

    @Transactional
    public ChatSummaryDto renameChat(String username, String projectId, String chatId, String title) {
        requireProjectId(projectId);
        if (chatId == null || chatId.isBlank()) {
            throw new ChatValidationException(ChatValidationException.Reason.MISSING_CHAT_ID);
        }
        String clean = normalizeTitle(title);

        accessGuard.requireAccess(requireCaller(username), projectId);
        Chat chat = sessions.rename(projectId, chatId, clean);
        return toSummary(chat, messageRepo.countByChat_Id(chatId), null);
    }

    /**
     * Nunca se devuelven entidades ni los bytes de los adjuntos.
     */
    @Transactional(readOnly = true)
    public ChatHistoryDto history(String username, String projectId, String chatId) {
        accessGuard.requireAccess(requireCaller(username), projectId);
        Chat chat = sessions.requireChat(projectId, chatId);

        List<ChatMessageDto> messages = messageRepo.findByChat_IdOrderByCreatedAtAscIdAsc(chat.getId())
                .stream()
                .map(this::toDto)
                .toList();

        return new ChatHistoryDto(
                chat.getId(),
                projectId,
                chat.getTitle(),
                chat.getCreatedAt(),
                chat.getLastActivityAt(),
                messages
        );
    }

    @Transactional(readOnly = true)
    public List<ChatSummaryDto> listChats(String username, String projectId) {
        accessGuard.requireAccess(requireCaller(username), projectId);
        return chatRepo.listSummaries(projectId);
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private CallerIdentity requireCaller(String username) {
        AppUser user = userRepo.findByUsername(username)
                .orElseThrow(() -> new IllegalStateException("Usuario autenticado no existe en BD: " + username));
        return CallerIdentity.of(user);
    }

    private void requireProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new ChatValidationException(ChatValidationException.Reason.MISSING_PROJECT_ID);
        }
    }

    private List<String> parseDatasetIds(String raw) {
        DatasetIdParser.ParsedIds parsed = DatasetIdParser.parse(raw);
        if (parsed instanceof DatasetIdParser.Invalid invalid) {
            throw new ChatValidationException(ChatValidationException.Reason.INVALID_DATASET_IDS, invalid.reason());
        }
        return ((DatasetIdParser.Ids) parsed).values();
    }

    private String normalizeTitle(String title) {
        String clean = trimToNull(title);
        if (clean == null) {
            throw new ChatValidationException(ChatValidationException.Reason.EMPTY_TITLE);
        }
        if (clean.length() > TITLE_MAX_LENGTH) {
            clean = clean.substring(0, TITLE_MAX_LENGTH);
        }
        return clean;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private ChatMessageDto toDto(ChatMessage m) {
        List<FileAttachmentDto> files = m.getAttachedFiles().stream()
                .map(f -> new FileAttachmentDto(f.getOriginalName(), f.getMediaType(), f.getSizeBytes(), f.hasContent()))
                .toList();
        return new ChatMessageDto(
                m.getId(),
                m.getSender().name().toLowerCase(java.util.Locale.ROOT),
                m.getTextContent(),
                List.copyOf(m.getSelectedDatasetIds()),
                files,
                m.getCreatedAt()
        );
    }

    private ChatSummaryDto toSummary(Chat chat, long messageCount, java.time.Instant lastMessageAt) {
        return new ChatSummaryDto(
                chat.getId(),
                chat.getTitle(),
                chat.getCreatedAt(),
                chat.getLastActivityAt(),
                messageCount,
                lastMessageAt
        );
    }
}
