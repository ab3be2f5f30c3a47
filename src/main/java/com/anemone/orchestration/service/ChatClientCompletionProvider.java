package com.anemone.orchestration.service;

import com.anemone.config.AgentProperties;
import com.anemone.orchestration.api.CompletionProvider;
import com.anemone.orchestration.model.ChatTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link CompletionProvider} over Spring AI chat clients. The active provider comes from configuration.
 */
@Slf4j
public class ChatClientCompletionProvider implements CompletionProvider {

    @Nullable
    private final ChatClient googleChatClient;
    @Nullable
    private final ChatClient openAiChatClient;
    private final AgentProperties properties;

    public ChatClientCompletionProvider(@Nullable ChatClient googleChatClient, @Nullable ChatClient openAiChatClient,
                                        AgentProperties properties) {
        this.googleChatClient = googleChatClient;
        this.openAiChatClient = openAiChatClient;
        this.properties = properties;
    }

    @Override
    @Nullable
    public String generateChatResponse(@Nullable String systemPrompt, List<ChatTurn> history, String message) {
        ChatClient.ChatClientRequestSpec spec = getChatRequestSpec();
        if (StringUtils.hasText(systemPrompt)) {
            spec = spec.system(systemPrompt);
        }
        List<Message> messages = new ArrayList<>();
        for (ChatTurn turn : history) {
            messages.add(toMessage(turn));
        }
        if (!messages.isEmpty()) {
            spec = spec.messages(messages);
        }
        String content = spec.user(message).call().content();
        if (!StringUtils.hasText(content)) {
            log.warn("Completion provider {} returned an empty answer.", properties.getAiProvider());
            return null;
        }
        return content;
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAiProvider() == AgentProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        if (googleChatClient == null) {
            throw new IllegalStateException("Google GenAI provider is not properly configured.");
        }
        return googleChatClient.prompt();
    }

    private static Message toMessage(ChatTurn turn) {
        return switch (turn.role()) {
            case USER -> new UserMessage(turn.content());
            case ASSISTANT -> new AssistantMessage(turn.content());
            case SYSTEM -> new SystemMessage(turn.content());
        };
    }
}
