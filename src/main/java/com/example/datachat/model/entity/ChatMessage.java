package com.example.datachat.model.entity;

import com.example.datachat.util.DatasetIdParser;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entrada del log de un chat. Solo se inserta: no hay setters de contenido,
 * todo se fija en las factorías.
 */
@Entity
@Table(name = "chat_message")
public class ChatMessage {

    public enum Sender { USER, ASSISTANT }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "chat_id", nullable = false, updatable = false)
    private Chat chat;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private Sender sender;

    @Lob
    @Column(name = "text_content", updatable = false)
    private String textContent;

    @ElementCollection
    @CollectionTable(name = "chat_message_dataset", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "dataset_id", nullable = false, length = DatasetIdParser.MAX_ID_LENGTH)
    private List<String> selectedDatasetIds = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "chat_message_file", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "list_index")
    private List<FileAttachment> attachedFiles = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ChatMessage() {
    }

    private ChatMessage(Chat chat, Sender sender, String textContent) {
        this.chat = chat;
        this.sender = sender;
        this.textContent = textContent;
    }

    public static ChatMessage fromUser(Chat chat,
                                       String textContent,
                                       List<String> selectedDatasetIds,
                                       List<FileAttachment> attachedFiles) {
        ChatMessage m = new ChatMessage(chat, Sender.USER, textContent);
        if (selectedDatasetIds != null) m.selectedDatasetIds.addAll(selectedDatasetIds);
        if (attachedFiles != null) m.attachedFiles.addAll(attachedFiles);
        return m;
    }

    public static ChatMessage fromAssistant(Chat chat, String textContent) {
        if (textContent == null) {
            throw new IllegalArgumentException("La respuesta del asistente necesita contenido");
        }
        return new ChatMessage(chat, Sender.ASSISTANT, textContent);
    }

    public Long getId() { return id; }
    public Chat getChat() { return chat; }
    public Sender getSender() { return sender; }
    public String getTextContent() { return textContent; }
    public List<String> getSelectedDatasetIds() { return selectedDatasetIds; }
    public List<FileAttachment> getAttachedFiles() { return attachedFiles; }
    public Instant getCreatedAt() { return createdAt; }
}
