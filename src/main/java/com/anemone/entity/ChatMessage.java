package com.anemone.entity;

import com.anemone.orchestration.model.ChatTurn;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "chat_message", indexes = {
        @Index(name = "idx_chat_message_user_round", columnList = "user_id, conversation_round"),
        @Index(name = "idx_chat_message_related", columnList = "user_id, related_message_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private ChatTurn.Role role;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @Builder.Default
    @Column(name = "message_type", length = 30, nullable = false)
    private String messageType = "chat";

    @Column(name = "conversation_round", nullable = false)
    private Integer conversationRound;

    @Column(name = "message_id", length = 64)
    private String messageId;

    @Column(name = "related_message_id", length = 64)
    private String relatedMessageId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
