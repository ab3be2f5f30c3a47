package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CompletionProvider;
import com.anemone.orchestration.model.Command;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmCommandClassifierTest {

    private final CompletionProvider completionProvider = mock(CompletionProvider.class);
    private final LlmCommandClassifier classifier = new LlmCommandClassifier(completionProvider,
            new JsonProcessingService(new ObjectMapper()), new CommandMarkerParser(), new OrchestrationMetricsService());

    @Test
    void testClassify_StructuredSelection() {
        when(completionProvider.generateChatResponse(anyList(), anyString()))
                .thenReturn("{\"reasoning\":\"asks for balance\",\"commands\":[\"queryRoleData\",\"bogus\",\"getTokens\"]}");

        assertEquals(List.of(Command.QUERY_ROLE_DATA, Command.GET_TOKENS), classifier.classify("balance?", List.of()));
    }

    @Test
    void testClassify_FallsBackToMarkers() {
        when(completionProvider.generateChatResponse(anyList(), anyString()))
                .thenReturn("I will run $execute:querySkillDetails for you.");

        assertEquals(List.of(Command.QUERY_SKILL_DETAILS), classifier.classify("skills?", List.of()));
    }

    @Test
    void testClassify_EmptyCompletionThrows() {
        when(completionProvider.generateChatResponse(any(), anyList(), anyString())).thenReturn(null);
        when(completionProvider.generateChatResponse(anyList(), anyString())).thenReturn(null);

        assertThrows(IllegalStateException.class, () -> classifier.classify("hi", List.of()));
    }
}
