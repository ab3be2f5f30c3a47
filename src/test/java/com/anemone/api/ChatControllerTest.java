package com.anemone.api;

import com.anemone.orchestration.AgentCoordinator;
import com.anemone.orchestration.api.ConversationStore.StoredMessage;
import com.anemone.orchestration.model.ChatResult;
import com.anemone.orchestration.model.ChatTurn;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AgentCoordinator agentCoordinator;

    @Test
    void testChat() throws Exception {
        when(agentCoordinator.processChat("How healthy is my role?", "u1", "0xrole")).thenReturn(
                ChatResult.reply("Health is 87.", "u1", "0xrole", "m-1", "2026-01-01T00:00:00Z"));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"How healthy is my role?\", \"userId\": \"u1\", \"roleId\": \"0xrole\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.text").value("Health is 87."))
                .andExpect(jsonPath("$.messageId").value("m-1"))
                .andExpect(jsonPath("$.pending").value(false));
    }

    @Test
    void testChat_BlankMessageRejected() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \" \", \"userId\": \"u1\"}"))
                .andExpect(status().isBadRequest());

        verify(agentCoordinator, never()).processChat(anyString(), anyString(), any());
    }

    @Test
    void testHistory() throws Exception {
        StoredMessage stored = new StoredMessage(UUID.randomUUID(), "u1", ChatTurn.Role.ASSISTANT, "Hello!", 2,
                null, "m-1", OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(agentCoordinator.getChatHistory("u1", 10, null)).thenReturn(List.of(stored));

        mockMvc.perform(get("/api/chat/history").param("userId", "u1").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("u1"))
                .andExpect(jsonPath("$.messages[0].role").value("assistant"))
                .andExpect(jsonPath("$.messages[0].relatedMessageId").value("m-1"))
                .andExpect(jsonPath("$.messages[0].conversationRound").value(2));
    }

    @Test
    void testHistory_BeforeParsed() throws Exception {
        when(agentCoordinator.getChatHistory(eq("u1"), eq(50), any(OffsetDateTime.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/chat/history")
                        .param("userId", "u1")
                        .param("before", "2026-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages").isEmpty());
    }

    @Test
    void testHistory_InvalidParameters() throws Exception {
        mockMvc.perform(get("/api/chat/history"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/chat/history").param("userId", "u1").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/chat/history").param("userId", "u1").param("limit", "201"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/chat/history").param("userId", "u1").param("before", "yesterday"))
                .andExpect(status().isBadRequest());

        verify(agentCoordinator, never()).getChatHistory(anyString(), anyInt(), isNull());
    }
}
