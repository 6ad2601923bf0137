package com.example.datachat.service;

import com.example.datachat.exception.ResourceNotFoundException;
import com.example.datachat.model.entity.Chat;
import com.example.datachat.model.entity.Project;
import com.example.datachat.repository.ChatMessageRepository;
import com.example.datachat.repository.ChatRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatSessionServiceTest {

    @Mock
    private ChatRepository chatRepo;

    @Mock
    private ChatMessageRepository messageRepo;

    @InjectMocks
    private ChatSessionService sessions;

    private Project project;

    @BeforeEach
    void setUp() {
        project = new Project();
        project.setId("p1");
    }

    @Test
    void explicitChatIdIsReusedWithoutCreating() {
        Chat existing = chat("c1");
        when(chatRepo.findByIdAndProject_Id("c1", "p1")).thenReturn(Optional.of(existing));

        Chat first = sessions.resolve(project, "c1");
        Chat second = sessions.resolve(project, "c1");

        assertThat(first).isSameAs(existing);
        assertThat(second).isSameAs(existing);
        verify(chatRepo, never()).save(any());
    }

    @Test
    void chatOfAnotherProjectIsNotFound() {
        when(chatRepo.findByIdAndProject_Id("c9", "p1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sessions.resolve(project, "c9"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(chatRepo, never()).save(any());
    }

    @Test
    void withoutChatIdFirstTurnCreatesAndNextReusesLatest() {
        when(chatRepo.save(any(Chat.class))).thenAnswer(inv -> inv.getArgument(0));
        when(chatRepo.findFirstByProject_IdOrderByCreatedAtDesc("p1")).thenReturn(Optional.empty());

        Chat created = sessions.resolve(project, null);

        when(chatRepo.findFirstByProject_IdOrderByCreatedAtDesc("p1")).thenReturn(Optional.of(created));
        Chat reused = sessions.resolve(project, "  ");

        assertThat(reused).isSameAs(created);
        assertThat(created.getTitle()).isEqualTo(Chat.DEFAULT_TITLE);
        assertThat(created.getProject()).isSameAs(project);
        assertThat(created.getId()).isNotBlank();
        verify(chatRepo, times(1)).save(any(Chat.class));
    }

    @Test
    void renameUpdatesTitle() {
        Chat existing = chat("c1");
        when(chatRepo.findByIdAndProject_Id("c1", "p1")).thenReturn(Optional.of(existing));
        when(chatRepo.save(existing)).thenReturn(existing);

        Chat renamed = sessions.rename("p1", "c1", "Ventas Q3");

        assertThat(renamed.getTitle()).isEqualTo("Ventas Q3");
    }

    private Chat chat(String id) {
        Chat c = new Chat();
        c.setId(id);
        c.setProject(project);
        return c;
    }
}
