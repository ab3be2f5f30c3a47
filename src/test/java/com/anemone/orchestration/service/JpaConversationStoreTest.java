package com.anemone.orchestration.service;

import com.anemone.orchestration.api.ConversationStore.StoredMessage;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.repository.BaseRepositoryTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Import(JpaConversationStore.class)
class JpaConversationStoreTest extends BaseRepositoryTest {

    @Autowired
    private JpaConversationStore conversationStore;

    @Test
    void testGetNextConversationRound() throws InterruptedException {
        assertEquals(1, conversationStore.getNextConversationRound("u1"));

        save("u1", ChatTurn.Role.USER, "hi", 1, "m-1", null);
        save("u1", ChatTurn.Role.ASSISTANT, "hello", 1, null, "m-1");

        assertEquals(2, conversationStore.getNextConversationRound("u1"));
        assertEquals(1, conversationStore.getNextConversationRound("u2"));
    }

    @Test
    void testGetMessagesByRounds_LastRoundsOldestFirst() throws InterruptedException {
        for (int round = 1; round <= 4; round++) {
            save("u1", ChatTurn.Role.USER, "question " + round, round, "m-" + round, null);
            save("u1", ChatTurn.Role.ASSISTANT, "answer " + round, round, null, "m-" + round);
        }

        List<ChatTurn> turns = conversationStore.getMessagesByRounds("u1", 2);

        assertEquals(List.of(
                ChatTurn.user("question 3"), ChatTurn.assistant("answer 3"),
                ChatTurn.user("question 4"), ChatTurn.assistant("answer 4")), turns);
        assertTrue(conversationStore.getMessagesByRounds("u1", 0).isEmpty());
        assertTrue(conversationStore.getMessagesByRounds("nobody", 3).isEmpty());
    }

    @Test
    void testGetConversationHistory_LimitKeepsNewest() throws InterruptedException {
        for (int round = 1; round <= 3; round++) {
            save("u1", ChatTurn.Role.USER, "question " + round, round, "m-" + round, null);
        }

        List<StoredMessage> history = conversationStore.getConversationHistory("u1", 2, null);

        assertEquals(List.of("question 2", "question 3"), history.stream().map(StoredMessage::content).toList());
    }

    @Test
    void testGetConversationHistory_Before() throws InterruptedException {
        StoredMessage first = save("u1", ChatTurn.Role.USER, "old", 1, "m-1", null);
        save("u1", ChatTurn.Role.USER, "new", 2, "m-2", null);

        List<StoredMessage> history = conversationStore.getConversationHistory("u1", 10,
                first.createdAt().plus(Duration.ofMillis(2)));

        assertEquals(List.of(first.id()), history.stream().map(StoredMessage::id).toList());
    }

    @Test
    void testFindLatestReply() throws InterruptedException {
        save("u1", ChatTurn.Role.USER, "balance?", 1, "m-1", null);
        save("u1", ChatTurn.Role.ASSISTANT, "1 SUI", 1, null, "m-1");

        Optional<StoredMessage> reply = conversationStore.findLatestReply("u1", "m-1");

        assertTrue(reply.isPresent());
        assertEquals("1 SUI", reply.get().content());
        assertEquals(ChatTurn.Role.ASSISTANT, reply.get().role());
        assertTrue(conversationStore.findLatestReply("u1", "m-2").isEmpty());
    }

    // keeps creation timestamps strictly increasing
    private StoredMessage save(String userId, ChatTurn.Role role, String content, int round, String messageId,
                               String relatedMessageId) throws InterruptedException {
        StoredMessage stored = conversationStore.saveMessage(userId, role, content, round, messageId, relatedMessageId);
        Thread.sleep(5);
        return stored;
    }
}
