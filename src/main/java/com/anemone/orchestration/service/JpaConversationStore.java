package com.anemone.orchestration.service;

import com.anemone.entity.ChatMessage;
import com.anemone.orchestration.api.ConversationStore;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.repository.ChatMessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional
public class JpaConversationStore implements ConversationStore {

    private final ChatMessageRepository chatMessageRepository;

    @Override
    public StoredMessage saveMessage(String userId, ChatTurn.Role role, String content, int round,
                                     @Nullable String messageId, @Nullable String relatedMessageId) {
        ChatMessage message = ChatMessage.builder()
                .userId(userId)
                .role(role)
                .content(content)
                .conversationRound(round)
                .messageId(messageId)
                .relatedMessageId(relatedMessageId)
                .build();
        return toStored(chatMessageRepository.save(message));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredMessage> getConversationHistory(String userId, int limit, @Nullable OffsetDateTime before) {
        PageRequest page = PageRequest.of(0, Math.max(limit, 1));
        List<ChatMessage> newestFirst = before == null
                ? chatMessageRepository.findByUserIdOrderByCreatedAtDesc(userId, page)
                : chatMessageRepository.findByUserIdAndCreatedAtBeforeOrderByCreatedAtDesc(userId, before, page);
        List<StoredMessage> history = new ArrayList<>(newestFirst.stream().map(this::toStored).toList());
        Collections.reverse(history);
        return history;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatTurn> getMessagesByRounds(String userId, int rounds) {
        if (rounds <= 0) {
            return List.of();
        }
        Optional<Integer> maxRound = chatMessageRepository.findMaxConversationRound(userId);
        if (maxRound.isEmpty()) {
            return List.of();
        }
        int fromRound = Math.max(1, maxRound.get() - rounds + 1);
        return chatMessageRepository
                .findByUserIdAndConversationRoundGreaterThanEqualOrderByCreatedAtAsc(userId, fromRound)
                .stream()
                .map(message -> new ChatTurn(message.getRole(), message.getContent()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public int getNextConversationRound(String userId) {
        return chatMessageRepository.findMaxConversationRound(userId).orElse(0) + 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredMessage> findLatestReply(String userId, String messageId) {
        return chatMessageRepository
                .findFirstByUserIdAndRelatedMessageIdAndRoleOrderByCreatedAtDesc(userId, messageId,
                        ChatTurn.Role.ASSISTANT)
                .map(this::toStored);
    }

    private StoredMessage toStored(ChatMessage message) {
        return new StoredMessage(
                message.getId(),
                message.getUserId(),
                message.getRole(),
                message.getContent(),
                message.getConversationRound(),
                message.getMessageId(),
                message.getRelatedMessageId(),
                message.getCreatedAt());
    }
}
