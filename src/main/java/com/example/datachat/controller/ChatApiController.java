package com.example.datachat.controller;

import com.example.datachat.model.dto.*;
import com.example.datachat.service.ChatService;
import com.example.datachat.service.ReplyQueueService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/chat")
public class ChatApiController {

    private final ChatService chatService;
    private final ReplyQueueService replyQueueService;

    public ChatApiController(ChatService chatService, ReplyQueueService replyQueueService) {
        this.chatService = chatService;
        this.replyQueueService = replyQueueService;
    }

    // ---------------------------------------------------------------------
    // MENSAJE DEL USUARIO (multipart)
    // Guarda texto, datasets seleccionados y CSV. No llama al motor.
    // selectedDatasets admite JSON ("[\"a\",\"b\"]") o lista separada por comas.
    // ---------------------------------------------------------------------
    @PostMapping
    public SubmitMessageResponse submit(@RequestParam(required = false) String projectId,
                                        @RequestParam(required = false) String chatId,
                                        @RequestParam(required = false) String content,
                                        @RequestParam(required = false) String selectedDatasets,
                                        @RequestParam(name = "files", required = false) List<MultipartFile> files,
                                        Principal principal) {
        return chatService.submitUserMessage(
                resolveUsername(principal),
                projectId,
                chatId,
                content,
                files,
                selectedDatasets
        );
    }

    // ---------------------------------------------------------------------
    // RESPUESTA DEL MOTOR
    // Devuelve el JSON del motor tal cual (insights, chartjs, error...).
    // ---------------------------------------------------------------------
    @PostMapping("/ai")
    public JsonNode aiReply(@RequestBody AiReplyRequest req, Principal principal) {
        return replyQueueService.replyAndWait(
                resolveUsername(principal),
                req.getProjectId(),
                req.getChatId(),
                req.getContent()
        ).payload();
    }

    // ---------------------------------------------------------------------
    // CREAR CHAT VACÍO
    // ---------------------------------------------------------------------
    @PostMapping("/create")
    public ResponseEntity<ChatSummaryDto> create(@RequestBody CreateChatRequest req, Principal principal) {
        ChatSummaryDto chat = chatService.createChat(resolveUsername(principal), req.getProjectId());
        return ResponseEntity.status(HttpStatus.CREATED).body(chat);
    }

    // ---------------------------------------------------------------------
    // RENOMBRAR CHAT
    // ---------------------------------------------------------------------
    @PatchMapping("/rename")
    public ChatSummaryDto rename(@Valid @RequestBody RenameChatRequest req, Principal principal) {
        return chatService.renameChat(resolveUsername(principal), req.getProjectId(), req.getChatId(), req.getTitle());
    }

    // ---------------------------------------------------------------------
    // LISTAR CHATS DEL PROYECTO
    // ---------------------------------------------------------------------
    @GetMapping("/{projectId}")
    public List<ChatSummaryDto> list(@PathVariable String projectId, Principal principal) {
        return chatService.listChats(resolveUsername(principal), projectId);
    }

    // ---------------------------------------------------------------------
    // HISTORIAL
    // DTOs sin bytes de adjuntos.
    // ---------------------------------------------------------------------
    @GetMapping("/{projectId}/{chatId}")
    public ChatHistoryDto history(@PathVariable String projectId,
                                  @PathVariable String chatId,
                                  Principal principal) {
        return chatService.history(resolveUsername(principal), projectId, chatId);
    }

    /**
     * Usuario autenticado o 401 si la petición llegó sin credenciales.
     */
    private String resolveUsername(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Autenticacion requerida.");
        }
        return principal.getName();
    }
}
