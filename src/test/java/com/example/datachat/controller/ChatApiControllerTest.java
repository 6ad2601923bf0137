package com.example.datachat.controller;

import com.example.datachat.exception.AnalysisTransportException;
import com.example.datachat.exception.AnalysisUpstreamException;
import com.example.datachat.exception.ChatAccessDeniedException;
import com.example.datachat.exception.ChatValidationException;
import com.example.datachat.model.dto.ChatSummaryDto;
import com.example.datachat.model.dto.SubmitMessageResponse;
import com.example.datachat.service.AnalysisResult;
import com.example.datachat.service.ChatService;
import com.example.datachat.service.ReplyQueueService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatApiController.class)
@AutoConfigureMockMvc(addFilters = false)
class ChatApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChatService chatService;

    @MockBean
    private ReplyQueueService replyQueueService;

    @Test
    void submitAcceptsMultipartWithCsv() throws Exception {
        when(chatService.submitUserMessage(eq("ana"), eq("p1"), isNull(), eq("hola"), anyList(), eq("[\"d1\"]")))
                .thenReturn(new SubmitMessageResponse("User message saved.", "c1", 10L));

        MockMultipartFile csv = new MockMultipartFile("files", "ventas.csv", "text/csv", "a,b\n1,2\n".getBytes());

        mockMvc.perform(multipart("/api/chat")
                        .file(csv)
                        .param("projectId", "p1")
                        .param("content", "hola")
                        .param("selectedDatasets", "[\"d1\"]")
                        .principal(() -> "ana"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User message saved."))
                .andExpect(jsonPath("$.chatId").value("c1"))
                .andExpect(jsonPath("$.messageId").value(10));
    }

    @Test
    void emptySubmissionReturnsReasonCode() throws Exception {
        when(chatService.submitUserMessage(eq("ana"), eq("p1"), isNull(), isNull(), any(), isNull()))
                .thenThrow(new ChatValidationException(ChatValidationException.Reason.EMPTY_MESSAGE));

        mockMvc.perform(multipart("/api/chat")
                        .param("projectId", "p1")
                        .principal(() -> "ana"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.details[0]").value("code: empty-message"))
                .andExpect(jsonPath("$.details[1]").value("field: content"))
                .andExpect(jsonPath("$.errorId").isNotEmpty())
                .andExpect(jsonPath("$.upstreamStatus").doesNotExist());
    }

    @Test
    void aiReplyPassesEngineJsonThrough() throws Exception {
        ObjectNode payload = (ObjectNode) new ObjectMapper()
                .readTree("{\"insights\":\"sube\",\"chartjs\":{\"type\":\"bar\"},\"extra\":{\"k\":1}}");
        when(replyQueueService.replyAndWait("ana", "p1", "c1", "resumen"))
                .thenReturn(new AnalysisResult(payload));

        mockMvc.perform(post("/api/chat/ai")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p1","chatId":"c1","content":"resumen"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insights").value("sube"))
                .andExpect(jsonPath("$.chartjs.type").value("bar"))
                .andExpect(jsonPath("$.extra.k").value(1));
    }

    @Test
    void nonMemberGetsForbiddenWithCode() throws Exception {
        when(replyQueueService.replyAndWait("ana", "p1", "c1", "hola"))
                .thenThrow(new ChatAccessDeniedException(ChatAccessDeniedException.Reason.NOT_A_MEMBER));

        mockMvc.perform(post("/api/chat/ai")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p1","chatId":"c1","content":"hola"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.details[0]").value("code: not-a-member"));
    }

    @Test
    void engineErrorBecomesBadGatewayWithUpstreamStatus() throws Exception {
        when(replyQueueService.replyAndWait("ana", "p1", "c1", "hola"))
                .thenThrow(new AnalysisUpstreamException(422, "La columna fecha no existe", null));

        mockMvc.perform(post("/api/chat/ai")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p1","chatId":"c1","content":"hola"}
                                """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("La columna fecha no existe"))
                .andExpect(jsonPath("$.upstreamStatus").value(422));
    }

    @Test
    void engineTimeoutBecomesGatewayTimeout() throws Exception {
        when(replyQueueService.replyAndWait("ana", "p1", "c1", "hola"))
                .thenThrow(new AnalysisTransportException("El motor de analisis no respondio a tiempo", true, null));

        mockMvc.perform(post("/api/chat/ai")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p1","chatId":"c1","content":"hola"}
                                """))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void createReturnsCreated() throws Exception {
        Instant now = Instant.now();
        when(chatService.createChat("ana", "p1"))
                .thenReturn(new ChatSummaryDto("c9", "New chat", now, now, 0, null));

        mockMvc.perform(post("/api/chat/create")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("c9"))
                .andExpect(jsonPath("$.title").value("New chat"));
    }

    @Test
    void renameValidatesTitle() throws Exception {
        mockMvc.perform(patch("/api/chat/rename")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\",\"chatId\":\"c1\",\"title\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(chatService);
    }

    @Test
    void longTitleReachesServiceToBeTruncated() throws Exception {
        String longTitle = "t".repeat(130);
        Instant now = Instant.now();
        when(chatService.renameChat("ana", "p1", "c1", longTitle))
                .thenReturn(new ChatSummaryDto("c1", "t".repeat(120), now, now, 0, null));

        mockMvc.perform(patch("/api/chat/rename")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\",\"chatId\":\"c1\",\"title\":\"" + longTitle + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("t".repeat(120)));
    }

    @Test
    void malformedJsonBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/chat/ai")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(replyQueueService);
    }

    @Test
    void missingPrincipalIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/chat/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(chatService);
    }

    @Test
    void renameReturnsSummary() throws Exception {
        Instant now = Instant.now();
        when(chatService.renameChat("ana", "p1", "c1", "Ventas"))
                .thenReturn(new ChatSummaryDto("c1", "Ventas", now, now, 2, now));

        mockMvc.perform(patch("/api/chat/rename")
                        .principal(() -> "ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\",\"chatId\":\"c1\",\"title\":\"Ventas\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageCount").value(2));

        verify(chatService).renameChat("ana", "p1", "c1", "Ventas");
    }
}
