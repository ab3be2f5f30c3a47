package com.anemone.repository;

import com.anemone.entity.ChatMessage;
import com.anemone.orchestration.model.ChatTurn;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link ChatMessage} entities.
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    List<ChatMessage> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<ChatMessage> findByUserIdAndCreatedAtBeforeOrderByCreatedAtDesc(String userId, OffsetDateTime before,
                                                                          Pageable pageable);

    /**
     * Messages of a user whose conversation round is at least {@code fromRound}, oldest first.
     */
    List<ChatMessage> findByUserIdAndConversationRoundGreaterThanEqualOrderByCreatedAtAsc(String userId,
                                                                                         Integer fromRound);

    @Query("select max(m.conversationRound) from ChatMessage m where m.userId = :userId")
    Optional<Integer> findMaxConversationRound(@Param("userId") String userId);

    Optional<ChatMessage> findFirstByUserIdAndRelatedMessageIdAndRoleOrderByCreatedAtDesc(String userId,
                                                                                         String relatedMessageId,
                                                                                         ChatTurn.Role role);

    Optional<ChatMessage> findFirstByUserIdAndMessageId(String userId, String messageId);
}
